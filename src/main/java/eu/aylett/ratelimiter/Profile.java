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
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Named bundles of settings matching the quota tiers a client is likely to be
 * on.
 * <p>
 * A profile is applied on top of the base defaults, and is itself overridden
 * by application properties and then by per-call options.
 * </p>
 */
public enum Profile {
  /** Local development: low concurrency, patient retries. */
  DEV(b -> b.maxConcurrencyPerKey(2).maxAttempts(5).baseBackoff(Duration.ofSeconds(2)).adaptiveCeiling(4)
      .tokenBudgetPerWindow(16_000L).adaptiveConcurrency(false)),
  /** Balanced production settings; the default. */
  PROD(b -> b.maxConcurrencyPerKey(4).maxAttempts(3).baseBackoff(Duration.ofSeconds(1)).adaptiveCeiling(8)
      .tokenBudgetPerWindow(500_000L).adaptiveConcurrency(false)),
  /** Conservative settings for a free tier (around 15 requests per minute). */
  FREE_TIER(b -> b.maxConcurrencyPerKey(2).maxAttempts(5).baseBackoff(Duration.ofSeconds(2))
      .tokenBudgetPerWindow(32_000L).adaptiveConcurrency(true).adaptiveCeiling(4)),
  PAID_TIER_1(b -> b.maxConcurrencyPerKey(10).maxAttempts(3).baseBackoff(Duration.ofMillis(500))
      .tokenBudgetPerWindow(1_000_000L).adaptiveConcurrency(true).adaptiveCeiling(15)),
  PAID_TIER_2(b -> b.maxConcurrencyPerKey(20).maxAttempts(2).baseBackoff(Duration.ofMillis(250))
      .tokenBudgetPerWindow(2_000_000L).adaptiveConcurrency(true).adaptiveCeiling(30)),
  PAID_TIER_3(b -> b.maxConcurrencyPerKey(30).maxAttempts(2).baseBackoff(Duration.ofMillis(100))
      .tokenBudgetPerWindow(4_000_000L).adaptiveConcurrency(true).adaptiveCeiling(50)),
  /** No overrides at all: the base defaults plus whatever is set explicitly. */
  CUSTOM(b -> {
  });

  private final Consumer<RateLimiterConfig.Builder> overrides;

  Profile(Consumer<RateLimiterConfig.Builder> overrides) {
    this.overrides = overrides;
  }

  void applyTo(RateLimiterConfig.Builder builder) {
    overrides.accept(builder);
  }

  /**
   * Parses a profile name as written in configuration files: case-insensitive,
   * with either dashes or underscores ({@code paid-tier-1}, {@code PAID_TIER_1}).
   *
   * @throws IllegalArgumentException
   *           if the name matches no profile
   */
  public static Profile parse(String name) {
    return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}
