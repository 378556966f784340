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
import java.util.Map;

/**
 * A key's active rate limit: nobody should call before {@code retryUntil}.
 *
 * @param retryUntil
 *          earliest instant a call is worth making
 * @param quotaMetric
 *          the exhausted quota's metric, if the server said
 * @param quotaId
 *          the exhausted quota's identifier, if the server said
 * @param quotaDimensions
 *          the exhausted quota's dimensions, if the server said
 * @param quotaValue
 *          the exhausted quota's limit, if the server said
 * @param lastRateLimitedAt
 *          when the most recent 429 for this key was recorded
 */
public record RetryWindow(Instant retryUntil, @Nullable String quotaMetric, @Nullable String quotaId,
    @Nullable Map<String, ?> quotaDimensions, @Nullable Object quotaValue, Instant lastRateLimitedAt) {

  public boolean isActive(Instant now) {
    return retryUntil.isAfter(now);
  }

  /**
   * Folds a newer rate-limit signal into this window. The expiry only ever
   * moves later; quota fields the newer signal supplies replace the old ones.
   */
  RetryWindow extendedBy(Instant newRetryUntil, RetryInfo info, Instant now) {
    var until = newRetryUntil.isAfter(retryUntil) ? newRetryUntil : retryUntil;
    return new RetryWindow(until, info.quotaMetric() != null ? info.quotaMetric() : quotaMetric,
        info.quotaId() != null ? info.quotaId() : quotaId,
        info.quotaDimensions() != null ? info.quotaDimensions() : quotaDimensions,
        info.quotaValue() != null ? info.quotaValue() : quotaValue, now);
  }

  static RetryWindow from(Instant retryUntil, RetryInfo info, Instant now) {
    return new RetryWindow(retryUntil, info.quotaMetric(), info.quotaId(), info.quotaDimensions(), info.quotaValue(),
        now);
  }
}
