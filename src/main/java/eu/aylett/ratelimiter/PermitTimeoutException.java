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

import java.time.Duration;

/**
 * Thrown when a blocking call waited its whole permit timeout without a
 * concurrency permit coming free.
 */
public class PermitTimeoutException extends RateLimiterException {
  /**
   * The permit pool that was full.
   */
  public final String permitKey;
  /**
   * How long the caller waited.
   */
  public final Duration waited;

  public PermitTimeoutException(String permitKey, Duration waited) {
    super("Timed out after " + waited.toMillis() + "ms waiting for a concurrency permit for " + permitKey);
    this.permitKey = permitKey;
    this.waited = waited;
  }
}
