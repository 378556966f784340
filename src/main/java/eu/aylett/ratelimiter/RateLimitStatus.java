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
 * What would happen to a call made now, without making it.
 *
 * @param kind
 *          the first reason the call would be held back, or {@link Kind#OK}
 * @param retryAt
 *          when that reason should clear, if known
 * @param details
 *          the retry window or budget behind a refusal
 * @param availablePermits
 *          free permits, for {@link Kind#NO_PERMITS}
 * @param usage
 *          the key's budget usage, for {@link Kind#OVER_BUDGET}
 */
public record RateLimitStatus(Kind kind, @Nullable Instant retryAt, @Nullable RateLimitDetails details,
    int availablePermits, @Nullable UsageSnapshot usage) {

  public enum Kind {
    OK,
    RATE_LIMITED,
    NO_PERMITS,
    OVER_BUDGET,
  }

  static final RateLimitStatus OK = new RateLimitStatus(Kind.OK, null, null, 0, null);

  static RateLimitStatus rateLimited(RetryWindow window) {
    return new RateLimitStatus(Kind.RATE_LIMITED, window.retryUntil(), RateLimitDetails.retryWindow(window, 1), 0,
        null);
  }

  static RateLimitStatus noPermits(int availablePermits) {
    return new RateLimitStatus(Kind.NO_PERMITS, null, RateLimitDetails.noPermits(availablePermits),
        availablePermits, null);
  }

  static RateLimitStatus overBudget(BudgetDecision.Exceeded exceeded) {
    return new RateLimitStatus(Kind.OVER_BUDGET, exceeded.retryAt(), RateLimitDetails.overBudget(exceeded), 0,
        exceeded.usage());
  }

  public boolean isOk() {
    return kind == Kind.OK;
  }
}
