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

import org.jspecify.annotations.Nullable;

/**
 * Base class for failures raised by the rate limiter itself, as opposed to
 * failures of the call it wraps.
 */
public class RateLimiterException extends RuntimeException {
  public RateLimiterException(String message) {
    super(message);
  }

  public RateLimiterException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
