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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable settings for one call through the rate limiter.
 * <p>
 * A manager holds a process-wide default configuration; each call merges its
 * {@link RequestOptions} over that with {@link #build(RateLimiterConfig,
 * RequestOptions)} and discards the result when the call finishes.
 * </p>
 * <p>
 * Each configuration remembers which settings were given explicitly, as
 * opposed to coming from the base defaults or a profile, so that switching
 * profile per call keeps application settings in force.
 * </p>
 */
public final class RateLimiterConfig {
  private static final Logger log = LoggerFactory.getLogger(RateLimiterConfig.class);

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE_NAME = "rate-limiter.properties";
  /** Prefix for system properties read by {@link #load()}. */
  public static final String PROPERTY_PREFIX = "ratelimiter.";

  static final int DEFAULT_MAX_CONCURRENCY = 4;

  private static final RateLimiterConfig DEFAULTS = builder().build();

  enum Setting {
    MAX_CONCURRENCY_PER_KEY,
    PERMIT_TIMEOUT,
    MAX_ATTEMPTS,
    BASE_BACKOFF,
    JITTER_FACTOR,
    ADAPTIVE_CONCURRENCY,
    ADAPTIVE_CEILING,
    NON_BLOCKING,
    DISABLED,
    TOKEN_BUDGET_PER_WINDOW,
    WINDOW_DURATION,
    MAX_BUDGET_WAIT,
    BUDGET_SAFETY_MULTIPLIER,
    DEFAULT_RETRY_DELAY
  }

  private final Profile profile;
  private final int maxConcurrencyPerKey;
  private final @Nullable Duration permitTimeout;
  private final int maxAttempts;
  private final Duration baseBackoff;
  private final double jitterFactor;
  private final boolean adaptiveConcurrency;
  private final int adaptiveCeiling;
  private final boolean nonBlocking;
  private final boolean disabled;
  private final @Nullable Long tokenBudgetPerWindow;
  private final Duration windowDuration;
  private final @Nullable Duration maxBudgetWait;
  private final double budgetSafetyMultiplier;
  private final Duration defaultRetryDelay;
  private final Set<Setting> explicitSettings;

  private RateLimiterConfig(Builder builder) {
    this.profile = builder.profile;
    this.maxConcurrencyPerKey = builder.maxConcurrencyPerKey;
    this.permitTimeout = builder.permitTimeout;
    this.maxAttempts = builder.maxAttempts;
    this.baseBackoff = builder.baseBackoff;
    this.jitterFactor = builder.jitterFactor;
    this.adaptiveConcurrency = builder.adaptiveConcurrency;
    this.adaptiveCeiling = builder.adaptiveCeiling;
    this.nonBlocking = builder.nonBlocking;
    this.disabled = builder.disabled;
    this.tokenBudgetPerWindow = builder.tokenBudgetPerWindow;
    this.windowDuration = builder.windowDuration;
    this.maxBudgetWait = builder.maxBudgetWait;
    this.budgetSafetyMultiplier = builder.budgetSafetyMultiplier;
    this.defaultRetryDelay = builder.defaultRetryDelay;
    this.explicitSettings = Collections.unmodifiableSet(EnumSet.copyOf(builder.explicit));
  }

  /**
   * The base defaults with the {@link Profile#PROD} profile applied.
   */
  public static RateLimiterConfig defaults() {
    return DEFAULTS;
  }

  /**
   * A builder starting from the base defaults with {@link Profile#PROD}
   * applied.
   */
  public static Builder builder() {
    return new Builder().profile(Profile.PROD);
  }

  /**
   * A builder holding exactly this configuration's values.
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Merges call-site options over a default configuration.
   * <p>
   * If the options name a profile, the result is layered afresh: base
   * defaults, then that profile, then the settings {@code defaults} was given
   * explicitly, then the remaining options. Otherwise the options go straight
   * over {@code defaults}. Never fails and never touches shared state; option
   * values are checked when the {@link RequestOptions} are built.
   * </p>
   */
  public static RateLimiterConfig build(RateLimiterConfig defaults, RequestOptions options) {
    var requestedProfile = options.profile();
    var builder = requestedProfile == null ? defaults.toBuilder()
        : new Builder().profile(requestedProfile).overlayExplicit(defaults);
    options.applyTo(builder);
    return builder.build();
  }

  /**
   * Reads {@value #RESOURCE_NAME} from the classpath if it exists, then lets
   * system properties prefixed with {@value #PROPERTY_PREFIX} override it.
   */
  public static RateLimiterConfig load() {
    var properties = new Properties();
    try (InputStream in = RateLimiterConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
      if (in != null) {
        properties.load(in);
        log.debug("Loaded rate limiter settings from {}", RESOURCE_NAME);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + RESOURCE_NAME, e);
    }
    for (var name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith(PROPERTY_PREFIX)) {
        properties.setProperty(name.substring(PROPERTY_PREFIX.length()), System.getProperty(name));
      }
    }
    return fromProperties(properties);
  }

  /**
   * Builds a configuration from un-prefixed keys such as
   * {@code max-concurrency-per-key}. A {@code profile} key is applied before
   * any other key, whatever order the properties are in.
   *
   * @throws IllegalArgumentException
   *           if a value cannot be parsed; the message names the key
   */
  public static RateLimiterConfig fromProperties(Properties properties) {
    var builder = builder();
    var profileName = properties.getProperty("profile");
    if (profileName != null) {
      builder.profile(parse("profile", profileName, Profile::parse));
    }
    for (var key : properties.stringPropertyNames()) {
      var value = properties.getProperty(key).trim();
      switch (key) {
        case "profile" -> {
          // applied above
        }
        case "max-concurrency-per-key" -> builder.maxConcurrencyPerKey(parse(key, value, Integer::valueOf));
        case "permit-timeout-ms" -> builder.permitTimeout(optionalMillis(key, value));
        case "max-attempts" -> builder.maxAttempts(parse(key, value, Integer::parseInt));
        case "base-backoff-ms" -> builder.baseBackoff(Duration.ofMillis(parse(key, value, Long::parseLong)));
        case "jitter-factor" -> builder.jitterFactor(parse(key, value, Double::parseDouble));
        case "adaptive-concurrency" -> builder.adaptiveConcurrency(parseBoolean(key, value));
        case "adaptive-ceiling" -> builder.adaptiveCeiling(parse(key, value, Integer::parseInt));
        case "non-blocking" -> builder.nonBlocking(parseBoolean(key, value));
        case "disabled" -> builder.disabled(parseBoolean(key, value));
        case "token-budget-per-window" -> builder
            .tokenBudgetPerWindow(isUnset(value) ? null : parse(key, value, Long::valueOf));
        case "window-duration-ms" -> builder.windowDuration(Duration.ofMillis(parse(key, value, Long::parseLong)));
        case "max-budget-wait-ms" -> builder.maxBudgetWait(optionalMillis(key, value));
        case "budget-safety-multiplier" -> builder.budgetSafetyMultiplier(parse(key, value, Double::parseDouble));
        case "default-retry-delay-ms" -> builder
            .defaultRetryDelay(Duration.ofMillis(parse(key, value, Long::parseLong)));
        default -> log.warn("Ignoring unrecognised rate limiter setting '{}'", key);
      }
    }
    return builder.build();
  }

  private interface Parser<T> {
    T parse(String value);
  }

  private static <T> T parse(String key, String value, Parser<T> parser) {
    try {
      return parser.parse(value);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid value '" + value + "' for rate limiter setting '" + key + "'", e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException("Invalid value '" + value + "' for rate limiter setting '" + key + "'");
  }

  private static boolean isUnset(String value) {
    return value.isEmpty() || "none".equalsIgnoreCase(value) || "infinity".equalsIgnoreCase(value);
  }

  private static @Nullable Duration optionalMillis(String key, String value) {
    if (isUnset(value)) {
      return null;
    }
    return Duration.ofMillis(parse(key, value, Long::parseLong));
  }

  static int checkMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    return maxAttempts;
  }

  static double checkJitterFactor(double jitterFactor) {
    if (!(jitterFactor >= 0.0 && jitterFactor <= 1.0)) {
      throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
    }
    return jitterFactor;
  }

  static int checkAdaptiveCeiling(int adaptiveCeiling) {
    if (adaptiveCeiling < 1) {
      throw new IllegalArgumentException("adaptiveCeiling must be at least 1");
    }
    return adaptiveCeiling;
  }

  static @Nullable Long checkTokenBudget(@Nullable Long tokenBudgetPerWindow) {
    if (tokenBudgetPerWindow != null && tokenBudgetPerWindow < 0) {
      throw new IllegalArgumentException("tokenBudgetPerWindow must not be negative");
    }
    return tokenBudgetPerWindow;
  }

  static double checkSafetyMultiplier(double budgetSafetyMultiplier) {
    if (!(budgetSafetyMultiplier > 0.0) || Double.isInfinite(budgetSafetyMultiplier)) {
      throw new IllegalArgumentException("budgetSafetyMultiplier must be positive");
    }
    return budgetSafetyMultiplier;
  }

  @Contract("null, _ -> null; !null, _ -> !null")
  static @Nullable Duration checkNotNegative(@Nullable Duration duration, String name) {
    if (duration != null && duration.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative");
    }
    return duration;
  }

  static Duration checkPositive(Duration duration, String name) {
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return duration;
  }

  public Profile profile() {
    return profile;
  }

  /**
   * Maximum simultaneous calls per key; {@code 0} means concurrency gating is
   * off.
   */
  public int maxConcurrencyPerKey() {
    return maxConcurrencyPerKey;
  }

  /**
   * How long to wait for a permit; {@code null} waits indefinitely.
   */
  public @Nullable Duration permitTimeout() {
    return permitTimeout;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration baseBackoff() {
    return baseBackoff;
  }

  public double jitterFactor() {
    return jitterFactor;
  }

  public boolean adaptiveConcurrency() {
    return adaptiveConcurrency;
  }

  public int adaptiveCeiling() {
    return adaptiveCeiling;
  }

  public boolean nonBlocking() {
    return nonBlocking;
  }

  public boolean disabled() {
    return disabled;
  }

  /**
   * Usage units allowed per window; {@code null} turns budgeting off.
   */
  public @Nullable Long tokenBudgetPerWindow() {
    return tokenBudgetPerWindow;
  }

  public Duration windowDuration() {
    return windowDuration;
  }

  /**
   * Longest a blocking call will wait for budget to free up; {@code null}
   * means no cap.
   */
  public @Nullable Duration maxBudgetWait() {
    return maxBudgetWait;
  }

  public double budgetSafetyMultiplier() {
    return budgetSafetyMultiplier;
  }

  /**
   * Retry delay assumed when a 429 response doesn't say how long to wait.
   */
  public Duration defaultRetryDelay() {
    return defaultRetryDelay;
  }

  public boolean isEnabled() {
    return !disabled;
  }

  public boolean isConcurrencyEnabled() {
    return maxConcurrencyPerKey > 0;
  }

  /**
   * Settings given explicitly rather than inherited from the base defaults or
   * the profile. Not part of equality.
   */
  Set<Setting> explicitSettings() {
    return explicitSettings;
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof RateLimiterConfig that) {
      return profile == that.profile && maxConcurrencyPerKey == that.maxConcurrencyPerKey
          && Objects.equals(permitTimeout, that.permitTimeout) && maxAttempts == that.maxAttempts
          && baseBackoff.equals(that.baseBackoff) && Double.compare(jitterFactor, that.jitterFactor) == 0
          && adaptiveConcurrency == that.adaptiveConcurrency && adaptiveCeiling == that.adaptiveCeiling
          && nonBlocking == that.nonBlocking && disabled == that.disabled
          && Objects.equals(tokenBudgetPerWindow, that.tokenBudgetPerWindow)
          && windowDuration.equals(that.windowDuration) && Objects.equals(maxBudgetWait, that.maxBudgetWait)
          && Double.compare(budgetSafetyMultiplier, that.budgetSafetyMultiplier) == 0
          && defaultRetryDelay.equals(that.defaultRetryDelay);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(profile, maxConcurrencyPerKey, permitTimeout, maxAttempts, baseBackoff, jitterFactor,
        adaptiveConcurrency, adaptiveCeiling, nonBlocking, disabled, tokenBudgetPerWindow, windowDuration,
        maxBudgetWait, budgetSafetyMultiplier, defaultRetryDelay);
  }

  @Override
  public String toString() {
    return "RateLimiterConfig{profile=" + profile + ", maxConcurrencyPerKey=" + maxConcurrencyPerKey
        + ", permitTimeout=" + permitTimeout + ", maxAttempts=" + maxAttempts + ", baseBackoff=" + baseBackoff
        + ", jitterFactor=" + jitterFactor + ", adaptiveConcurrency=" + adaptiveConcurrency + ", adaptiveCeiling="
        + adaptiveCeiling + ", nonBlocking=" + nonBlocking + ", disabled=" + disabled + ", tokenBudgetPerWindow="
        + tokenBudgetPerWindow + ", windowDuration=" + windowDuration + ", maxBudgetWait=" + maxBudgetWait
        + ", budgetSafetyMultiplier=" + budgetSafetyMultiplier + ", defaultRetryDelay=" + defaultRetryDelay + "}";
  }

  /**
   * Mutable builder; {@link #build()} produces the immutable value.
   */
  public static final class Builder {
    private Profile profile = Profile.CUSTOM;
    private int maxConcurrencyPerKey = DEFAULT_MAX_CONCURRENCY;
    private @Nullable Duration permitTimeout;
    private int maxAttempts = 3;
    private Duration baseBackoff = Duration.ofSeconds(1);
    private double jitterFactor = 0.25;
    private boolean adaptiveConcurrency;
    private int adaptiveCeiling = 8;
    private boolean nonBlocking;
    private boolean disabled;
    private @Nullable Long tokenBudgetPerWindow = 32_000L;
    private Duration windowDuration = Duration.ofSeconds(60);
    private @Nullable Duration maxBudgetWait;
    private double budgetSafetyMultiplier = 1.0;
    private Duration defaultRetryDelay = Duration.ofSeconds(60);
    private final EnumSet<Setting> explicit = EnumSet.noneOf(Setting.class);
    private boolean applyingProfile;

    private Builder() {
    }

    private Builder(RateLimiterConfig config) {
      this.profile = config.profile;
      this.maxConcurrencyPerKey = config.maxConcurrencyPerKey;
      this.permitTimeout = config.permitTimeout;
      this.maxAttempts = config.maxAttempts;
      this.baseBackoff = config.baseBackoff;
      this.jitterFactor = config.jitterFactor;
      this.adaptiveConcurrency = config.adaptiveConcurrency;
      this.adaptiveCeiling = config.adaptiveCeiling;
      this.nonBlocking = config.nonBlocking;
      this.disabled = config.disabled;
      this.tokenBudgetPerWindow = config.tokenBudgetPerWindow;
      this.windowDuration = config.windowDuration;
      this.maxBudgetWait = config.maxBudgetWait;
      this.budgetSafetyMultiplier = config.budgetSafetyMultiplier;
      this.defaultRetryDelay = config.defaultRetryDelay;
      this.explicit.addAll(config.explicitSettings);
    }

    // A profile's values are not explicit: they give way to the next profile
    private void mark(Setting setting) {
      if (applyingProfile) {
        explicit.remove(setting);
      } else {
        explicit.add(setting);
      }
    }

    /**
     * Copies the settings {@code config} was given explicitly over this
     * builder's values.
     */
    private Builder overlayExplicit(RateLimiterConfig config) {
      for (var setting : config.explicitSettings) {
        switch (setting) {
          case MAX_CONCURRENCY_PER_KEY -> maxConcurrencyPerKey(config.maxConcurrencyPerKey);
          case PERMIT_TIMEOUT -> permitTimeout(config.permitTimeout);
          case MAX_ATTEMPTS -> maxAttempts(config.maxAttempts);
          case BASE_BACKOFF -> baseBackoff(config.baseBackoff);
          case JITTER_FACTOR -> jitterFactor(config.jitterFactor);
          case ADAPTIVE_CONCURRENCY -> adaptiveConcurrency(config.adaptiveConcurrency);
          case ADAPTIVE_CEILING -> adaptiveCeiling(config.adaptiveCeiling);
          case NON_BLOCKING -> nonBlocking(config.nonBlocking);
          case DISABLED -> disabled(config.disabled);
          case TOKEN_BUDGET_PER_WINDOW -> tokenBudgetPerWindow(config.tokenBudgetPerWindow);
          case WINDOW_DURATION -> windowDuration(config.windowDuration);
          case MAX_BUDGET_WAIT -> maxBudgetWait(config.maxBudgetWait);
          case BUDGET_SAFETY_MULTIPLIER -> budgetSafetyMultiplier(config.budgetSafetyMultiplier);
          case DEFAULT_RETRY_DELAY -> defaultRetryDelay(config.defaultRetryDelay);
        }
      }
      return this;
    }

    /**
     * Records the profile and applies its settings, replacing whatever those
     * fields held before. Settings made after this call override the profile.
     */
    public Builder profile(Profile profile) {
      this.profile = profile;
      applyingProfile = true;
      try {
        profile.applyTo(this);
      } finally {
        applyingProfile = false;
      }
      return this;
    }

    /**
     * {@code null} or {@code 0} turns gating off. Negative values fall back to
     * the default of {@value #DEFAULT_MAX_CONCURRENCY}.
     */
    public Builder maxConcurrencyPerKey(@Nullable Integer maxConcurrencyPerKey) {
      if (maxConcurrencyPerKey == null || maxConcurrencyPerKey == 0) {
        this.maxConcurrencyPerKey = 0;
      } else if (maxConcurrencyPerKey < 0) {
        this.maxConcurrencyPerKey = DEFAULT_MAX_CONCURRENCY;
      } else {
        this.maxConcurrencyPerKey = maxConcurrencyPerKey;
      }
      mark(Setting.MAX_CONCURRENCY_PER_KEY);
      return this;
    }

    public Builder permitTimeout(@Nullable Duration permitTimeout) {
      this.permitTimeout = checkNotNegative(permitTimeout, "permitTimeout");
      mark(Setting.PERMIT_TIMEOUT);
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = checkMaxAttempts(maxAttempts);
      mark(Setting.MAX_ATTEMPTS);
      return this;
    }

    public Builder baseBackoff(Duration baseBackoff) {
      this.baseBackoff = checkNotNegative(baseBackoff, "baseBackoff");
      mark(Setting.BASE_BACKOFF);
      return this;
    }

    public Builder jitterFactor(double jitterFactor) {
      this.jitterFactor = checkJitterFactor(jitterFactor);
      mark(Setting.JITTER_FACTOR);
      return this;
    }

    public Builder adaptiveConcurrency(boolean adaptiveConcurrency) {
      this.adaptiveConcurrency = adaptiveConcurrency;
      mark(Setting.ADAPTIVE_CONCURRENCY);
      return this;
    }

    public Builder adaptiveCeiling(int adaptiveCeiling) {
      this.adaptiveCeiling = checkAdaptiveCeiling(adaptiveCeiling);
      mark(Setting.ADAPTIVE_CEILING);
      return this;
    }

    public Builder nonBlocking(boolean nonBlocking) {
      this.nonBlocking = nonBlocking;
      mark(Setting.NON_BLOCKING);
      return this;
    }

    public Builder disabled(boolean disabled) {
      this.disabled = disabled;
      mark(Setting.DISABLED);
      return this;
    }

    public Builder tokenBudgetPerWindow(@Nullable Long tokenBudgetPerWindow) {
      this.tokenBudgetPerWindow = checkTokenBudget(tokenBudgetPerWindow);
      mark(Setting.TOKEN_BUDGET_PER_WINDOW);
      return this;
    }

    public Builder windowDuration(Duration windowDuration) {
      this.windowDuration = checkPositive(windowDuration, "windowDuration");
      mark(Setting.WINDOW_DURATION);
      return this;
    }

    public Builder maxBudgetWait(@Nullable Duration maxBudgetWait) {
      this.maxBudgetWait = checkNotNegative(maxBudgetWait, "maxBudgetWait");
      mark(Setting.MAX_BUDGET_WAIT);
      return this;
    }

    public Builder budgetSafetyMultiplier(double budgetSafetyMultiplier) {
      this.budgetSafetyMultiplier = checkSafetyMultiplier(budgetSafetyMultiplier);
      mark(Setting.BUDGET_SAFETY_MULTIPLIER);
      return this;
    }

    public Builder defaultRetryDelay(Duration defaultRetryDelay) {
      this.defaultRetryDelay = checkNotNegative(defaultRetryDelay, "defaultRetryDelay");
      mark(Setting.DEFAULT_RETRY_DELAY);
      return this;
    }

    public RateLimiterConfig build() {
      return new RateLimiterConfig(this);
    }
  }
}
