/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.ratelimiter;

/**
 * How a single attempt ended, as far as retrying is concerned.
 */
public enum Outcome {
  SUCCESS,
  /** The server asked us to slow down. Always retryable, after a wait. */
  RATE_LIMITED,
  /** Worth another attempt after a backoff. */
  TRANSIENT,
  /** Never retried. */
  PERMANENT;

  /**
   * Told about every attempt's outcome as the retry loop sees it.
   */
  @FunctionalInterface
  public interface Observer {
    Observer NONE = outcome -> {
    };

    void onOutcome(Outcome outcome);
  }
}
