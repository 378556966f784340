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
 * Thrown when a call kept failing with retryable errors until it ran out of
 * attempts. The last error is the cause.
 */
public class TransientFailureException extends RateLimiterException {
  /**
   * How many times the call was made.
   */
  public final int attempts;

  public TransientFailureException(int attempts, Throwable lastError) {
    super("Gave up after " + attempts + " attempts: " + lastError, lastError);
    this.attempts = attempts;
  }

  public Throwable lastError() {
    return getCause();
  }
}
