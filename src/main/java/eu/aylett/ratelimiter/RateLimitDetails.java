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

import java.util.Map;

/**
 * What a caller needs to know to reschedule a call that was refused.
 *
 * @param reason
 *          which limit refused the call
 * @param quotaMetric
 *          the server's exhausted quota metric, for retry windows
 * @param quotaId
 *          the server's exhausted quota identifier, for retry windows
 * @param quotaDimensions
 *          the exhausted quota's dimensions, for retry windows
 * @param quotaValue
 *          the exhausted quota's limit, for retry windows
 * @param attempt
 *          the attempt that was refused, counting from one
 * @param availablePermits
 *          free permits at the time, for {@link Reason#NO_PERMITS}
 * @param budget
 *          the budget that was exceeded, for {@link Reason#OVER_BUDGET}
 */
public record RateLimitDetails(Reason reason, @Nullable String quotaMetric, @Nullable String quotaId,
    @Nullable Map<String, ?> quotaDimensions, @Nullable Object quotaValue, int attempt, int availablePermits,
    BudgetDecision.@Nullable Exceeded budget) {

  public enum Reason {
    /** The server rate limited this key and the window hasn't passed. */
    RETRY_WINDOW,
    /** The call's estimated usage doesn't fit in the key's budget. */
    OVER_BUDGET,
    /** Every concurrency permit for the key is in use. */
    NO_PERMITS,
  }

  static RateLimitDetails retryWindow(@Nullable RetryWindow window, int attempt) {
    if (window == null) {
      return new RateLimitDetails(Reason.RETRY_WINDOW, null, null, null, null, attempt, 0, null);
    }
    return new RateLimitDetails(Reason.RETRY_WINDOW, window.quotaMetric(), window.quotaId(),
        window.quotaDimensions(), window.quotaValue(), attempt, 0, null);
  }

  static RateLimitDetails overBudget(BudgetDecision.Exceeded exceeded) {
    return new RateLimitDetails(Reason.OVER_BUDGET, null, null, null, null, 1, 0, exceeded);
  }

  static RateLimitDetails noPermits(int availablePermits) {
    return new RateLimitDetails(Reason.NO_PERMITS, null, null, null, null, 1, availablePermits, null);
  }
}
