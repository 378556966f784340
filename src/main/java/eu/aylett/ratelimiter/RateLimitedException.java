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

import java.time.Instant;

/**
 * Thrown instead of waiting, when a call is refused by a retry window, the
 * usage budget or the concurrency gate.
 * <p>
 * Non-blocking callers should reschedule for {@link #retryAt}. A {@code null}
 * {@code retryAt} means there is no known time: the permit pool was full, or
 * the call is bigger than the whole budget.
 * </p>
 */
public class RateLimitedException extends RateLimiterException {
  /**
   * The earliest instant the call is worth retrying, if known.
   */
  public final @Nullable Instant retryAt;
  /**
   * Which limit refused the call, and the server's quota details if any.
   */
  public final RateLimitDetails details;

  public RateLimitedException(@Nullable Instant retryAt, RateLimitDetails details) {
    this(retryAt, details, null);
  }

  public RateLimitedException(@Nullable Instant retryAt, RateLimitDetails details, @Nullable Throwable cause) {
    super(message(retryAt, details), cause);
    this.retryAt = retryAt;
    this.details = details;
  }

  private static String message(@Nullable Instant retryAt, RateLimitDetails details) {
    var message = new StringBuilder("Rate limited (").append(details.reason());
    if (retryAt != null) {
      message.append(", retry at ").append(retryAt);
    }
    if (details.quotaMetric() != null) {
      message.append(", quota metric ").append(details.quotaMetric());
    }
    if (details.quotaId() != null) {
      message.append(", quota id ").append(details.quotaId());
    }
    return message.append(")").toString();
  }
}
