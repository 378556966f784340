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

import java.time.Duration;

/**
 * Per-call overrides and request-scoped values.
 * <p>
 * Any setting left unset falls through to the manager's defaults. The
 * estimated unit counts feed the usage budget; the concurrency key narrows the
 * permit pool for this call.
 * </p>
 * <p>
 * Values are range-checked as they are set, so options that build at all can
 * always be applied.
 * </p>
 */
public final class RequestOptions {
  private static final RequestOptions NONE = builder().build();

  private final @Nullable Profile profile;
  private final @Nullable Integer maxConcurrencyPerKey;
  private final boolean maxConcurrencySet;
  private final @Nullable Duration permitTimeout;
  private final boolean permitTimeoutSet;
  private final @Nullable Integer maxAttempts;
  private final @Nullable Duration baseBackoff;
  private final @Nullable Double jitterFactor;
  private final @Nullable Boolean adaptiveConcurrency;
  private final @Nullable Integer adaptiveCeiling;
  private final @Nullable Boolean nonBlocking;
  private final @Nullable Boolean disabled;
  private final @Nullable Long tokenBudgetPerWindow;
  private final boolean tokenBudgetSet;
  private final @Nullable Duration windowDuration;
  private final @Nullable Duration maxBudgetWait;
  private final boolean maxBudgetWaitSet;
  private final @Nullable Double budgetSafetyMultiplier;
  private final @Nullable Duration defaultRetryDelay;
  private final @Nullable String concurrencyKey;
  private final long estimatedInputUnits;
  private final long estimatedCachedUnits;

  private RequestOptions(Builder builder) {
    this.profile = builder.profile;
    this.maxConcurrencyPerKey = builder.maxConcurrencyPerKey;
    this.maxConcurrencySet = builder.maxConcurrencySet;
    this.permitTimeout = builder.permitTimeout;
    this.permitTimeoutSet = builder.permitTimeoutSet;
    this.maxAttempts = builder.maxAttempts;
    this.baseBackoff = builder.baseBackoff;
    this.jitterFactor = builder.jitterFactor;
    this.adaptiveConcurrency = builder.adaptiveConcurrency;
    this.adaptiveCeiling = builder.adaptiveCeiling;
    this.nonBlocking = builder.nonBlocking;
    this.disabled = builder.disabled;
    this.tokenBudgetPerWindow = builder.tokenBudgetPerWindow;
    this.tokenBudgetSet = builder.tokenBudgetSet;
    this.windowDuration = builder.windowDuration;
    this.maxBudgetWait = builder.maxBudgetWait;
    this.maxBudgetWaitSet = builder.maxBudgetWaitSet;
    this.budgetSafetyMultiplier = builder.budgetSafetyMultiplier;
    this.defaultRetryDelay = builder.defaultRetryDelay;
    this.concurrencyKey = builder.concurrencyKey;
    this.estimatedInputUnits = builder.estimatedInputUnits;
    this.estimatedCachedUnits = builder.estimatedCachedUnits;
  }

  /**
   * Options that override nothing.
   */
  public static RequestOptions none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Nullable
  Profile profile() {
    return profile;
  }

  void applyTo(RateLimiterConfig.Builder builder) {
    if (maxConcurrencySet) {
      builder.maxConcurrencyPerKey(maxConcurrencyPerKey);
    }
    if (permitTimeoutSet) {
      builder.permitTimeout(permitTimeout);
    }
    if (maxAttempts != null) {
      builder.maxAttempts(maxAttempts);
    }
    if (baseBackoff != null) {
      builder.baseBackoff(baseBackoff);
    }
    if (jitterFactor != null) {
      builder.jitterFactor(jitterFactor);
    }
    if (adaptiveConcurrency != null) {
      builder.adaptiveConcurrency(adaptiveConcurrency);
    }
    if (adaptiveCeiling != null) {
      builder.adaptiveCeiling(adaptiveCeiling);
    }
    if (nonBlocking != null) {
      builder.nonBlocking(nonBlocking);
    }
    if (disabled != null) {
      builder.disabled(disabled);
    }
    if (tokenBudgetSet) {
      builder.tokenBudgetPerWindow(tokenBudgetPerWindow);
    }
    if (windowDuration != null) {
      builder.windowDuration(windowDuration);
    }
    if (maxBudgetWaitSet) {
      builder.maxBudgetWait(maxBudgetWait);
    }
    if (budgetSafetyMultiplier != null) {
      builder.budgetSafetyMultiplier(budgetSafetyMultiplier);
    }
    if (defaultRetryDelay != null) {
      builder.defaultRetryDelay(defaultRetryDelay);
    }
  }

  /**
   * Narrows the permit pool: calls with a concurrency key share permits only
   * with calls on the same resource and the same concurrency key.
   */
  public @Nullable String concurrencyKey() {
    return concurrencyKey;
  }

  public long estimatedInputUnits() {
    return estimatedInputUnits;
  }

  public long estimatedCachedUnits() {
    return estimatedCachedUnits;
  }

  /**
   * Units this call is expected to consume, reserved against the budget
   * before it runs.
   */
  public long estimatedTotalUnits() {
    return estimatedInputUnits + estimatedCachedUnits;
  }

  public static final class Builder {
    private @Nullable Profile profile;
    private @Nullable Integer maxConcurrencyPerKey;
    private boolean maxConcurrencySet;
    private @Nullable Duration permitTimeout;
    private boolean permitTimeoutSet;
    private @Nullable Integer maxAttempts;
    private @Nullable Duration baseBackoff;
    private @Nullable Double jitterFactor;
    private @Nullable Boolean adaptiveConcurrency;
    private @Nullable Integer adaptiveCeiling;
    private @Nullable Boolean nonBlocking;
    private @Nullable Boolean disabled;
    private @Nullable Long tokenBudgetPerWindow;
    private boolean tokenBudgetSet;
    private @Nullable Duration windowDuration;
    private @Nullable Duration maxBudgetWait;
    private boolean maxBudgetWaitSet;
    private @Nullable Double budgetSafetyMultiplier;
    private @Nullable Duration defaultRetryDelay;
    private @Nullable String concurrencyKey;
    private long estimatedInputUnits;
    private long estimatedCachedUnits;

    private Builder() {
    }

    public Builder profile(Profile profile) {
      this.profile = profile;
      return this;
    }

    /**
     * {@code null} or {@code 0} turns gating off for this call.
     */
    public Builder maxConcurrencyPerKey(@Nullable Integer maxConcurrencyPerKey) {
      this.maxConcurrencyPerKey = maxConcurrencyPerKey;
      this.maxConcurrencySet = true;
      return this;
    }

    /**
     * {@code null} waits for a permit indefinitely.
     */
    public Builder permitTimeout(@Nullable Duration permitTimeout) {
      this.permitTimeout = RateLimiterConfig.checkNotNegative(permitTimeout, "permitTimeout");
      this.permitTimeoutSet = true;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = RateLimiterConfig.checkMaxAttempts(maxAttempts);
      return this;
    }

    public Builder baseBackoff(Duration baseBackoff) {
      this.baseBackoff = RateLimiterConfig.checkNotNegative(baseBackoff, "baseBackoff");
      return this;
    }

    public Builder jitterFactor(double jitterFactor) {
      this.jitterFactor = RateLimiterConfig.checkJitterFactor(jitterFactor);
      return this;
    }

    public Builder adaptiveConcurrency(boolean adaptiveConcurrency) {
      this.adaptiveConcurrency = adaptiveConcurrency;
      return this;
    }

    public Builder adaptiveCeiling(int adaptiveCeiling) {
      this.adaptiveCeiling = RateLimiterConfig.checkAdaptiveCeiling(adaptiveCeiling);
      return this;
    }

    public Builder nonBlocking(boolean nonBlocking) {
      this.nonBlocking = nonBlocking;
      return this;
    }

    public Builder disabled(boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    /**
     * {@code null} turns budgeting off for this call.
     */
    public Builder tokenBudgetPerWindow(@Nullable Long tokenBudgetPerWindow) {
      this.tokenBudgetPerWindow = RateLimiterConfig.checkTokenBudget(tokenBudgetPerWindow);
      this.tokenBudgetSet = true;
      return this;
    }

    public Builder windowDuration(Duration windowDuration) {
      this.windowDuration = RateLimiterConfig.checkPositive(windowDuration, "windowDuration");
      return this;
    }

    /**
     * {@code null} lets a blocking call wait as long as the budget needs.
     */
    public Builder maxBudgetWait(@Nullable Duration maxBudgetWait) {
      this.maxBudgetWait = RateLimiterConfig.checkNotNegative(maxBudgetWait, "maxBudgetWait");
      this.maxBudgetWaitSet = true;
      return this;
    }

    public Builder budgetSafetyMultiplier(double budgetSafetyMultiplier) {
      this.budgetSafetyMultiplier = RateLimiterConfig.checkSafetyMultiplier(budgetSafetyMultiplier);
      return this;
    }

    public Builder defaultRetryDelay(Duration defaultRetryDelay) {
      this.defaultRetryDelay = RateLimiterConfig.checkNotNegative(defaultRetryDelay, "defaultRetryDelay");
      return this;
    }

    public Builder concurrencyKey(@Nullable String concurrencyKey) {
      this.concurrencyKey = concurrencyKey;
      return this;
    }

    public Builder estimatedInputUnits(long estimatedInputUnits) {
      if (estimatedInputUnits < 0) {
        throw new IllegalArgumentException("estimatedInputUnits must not be negative");
      }
      this.estimatedInputUnits = estimatedInputUnits;
      return this;
    }

    public Builder estimatedCachedUnits(long estimatedCachedUnits) {
      if (estimatedCachedUnits < 0) {
        throw new IllegalArgumentException("estimatedCachedUnits must not be negative");
      }
      this.estimatedCachedUnits = estimatedCachedUnits;
      return this;
    }

    public RequestOptions build() {
      return new RequestOptions(this);
    }
  }
}
