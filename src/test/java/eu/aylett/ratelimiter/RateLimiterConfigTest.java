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

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RateLimiterConfigTest {
  @Test
  void defaultsUseTheProductionProfile() {
    var config = RateLimiterConfig.defaults();
    assertThat(config.profile(), is(Profile.PROD));
    assertThat(config.maxConcurrencyPerKey(), is(4));
    assertThat(config.maxAttempts(), is(3));
    assertThat(config.baseBackoff(), is(Duration.ofSeconds(1)));
    assertThat(config.jitterFactor(), is(0.25));
    assertThat(config.tokenBudgetPerWindow(), is(500_000L));
    assertThat(config.windowDuration(), is(Duration.ofSeconds(60)));
    assertThat(config.defaultRetryDelay(), is(Duration.ofSeconds(60)));
    assertThat(config.permitTimeout(), is(nullValue()));
    assertThat(config.isEnabled(), is(true));
  }

  @Test
  void freeTierIsConservative() {
    var config = RateLimiterConfig.builder().profile(Profile.FREE_TIER).build();
    assertThat(config.maxConcurrencyPerKey(), is(2));
    assertThat(config.maxAttempts(), is(5));
    assertThat(config.tokenBudgetPerWindow(), is(32_000L));
    assertThat(config.adaptiveConcurrency(), is(true));
    assertThat(config.adaptiveCeiling(), is(4));
  }

  @Test
  void requestOptionsOverrideTheirProfile() {
    var options = RequestOptions.builder().profile(Profile.PAID_TIER_1).maxAttempts(7).build();
    var config = RateLimiterConfig.build(RateLimiterConfig.defaults(), options);
    assertThat(config.profile(), is(Profile.PAID_TIER_1));
    assertThat(config.maxConcurrencyPerKey(), is(10));
    assertThat(config.maxAttempts(), is(7));
  }

  @Test
  void callSiteProfileKeepsApplicationSettings() {
    var properties = new Properties();
    properties.setProperty("max-attempts", "4");
    properties.setProperty("profile", "dev");
    var appDefaults = RateLimiterConfig.fromProperties(properties);

    var config = RateLimiterConfig.build(appDefaults,
        RequestOptions.builder().profile(Profile.PAID_TIER_1).build());
    assertThat(config.profile(), is(Profile.PAID_TIER_1));
    assertThat(config.maxAttempts(), is(4));
    assertThat(config.maxConcurrencyPerKey(), is(10));
    assertThat(config.tokenBudgetPerWindow(), is(1_000_000L));
    assertThat(config.adaptiveCeiling(), is(15));
  }

  @Test
  void callSiteProfileReplacesTheDefaultProfileOnly() {
    var appDefaults = RateLimiterConfig.builder().profile(Profile.FREE_TIER).nonBlocking(true)
        .tokenBudgetPerWindow(null).build();
    var options = RequestOptions.builder().profile(Profile.PAID_TIER_2).tokenBudgetPerWindow(7L).build();

    var config = RateLimiterConfig.build(appDefaults, options);
    assertThat(config.maxAttempts(), is(2));
    assertThat(config.adaptiveCeiling(), is(30));
    assertThat(config.nonBlocking(), is(true));
    assertThat(config.tokenBudgetPerWindow(), is(7L));
  }

  @Test
  void laterProfileOverridesEarlierOne() {
    var config = RateLimiterConfig.builder().profile(Profile.FREE_TIER).profile(Profile.PAID_TIER_3).build();
    assertThat(config, equalTo(RateLimiterConfig.builder().profile(Profile.PAID_TIER_3).build()));
    assertThat(config.explicitSettings().isEmpty(), is(true));
  }

  @Test
  void budgetSettingsCanBeOverriddenPerCall() {
    var defaults = RateLimiterConfig.builder().maxBudgetWait(Duration.ofSeconds(5)).build();
    var options = RequestOptions.builder().maxBudgetWait(null).budgetSafetyMultiplier(1.5)
        .defaultRetryDelay(Duration.ofSeconds(10)).build();

    var config = RateLimiterConfig.build(defaults, options);
    assertThat(config.maxBudgetWait(), is(nullValue()));
    assertThat(config.budgetSafetyMultiplier(), is(1.5));
    assertThat(config.defaultRetryDelay(), is(Duration.ofSeconds(10)));

    var capped = RateLimiterConfig.build(RateLimiterConfig.defaults(),
        RequestOptions.builder().maxBudgetWait(Duration.ofMillis(250)).build());
    assertThat(capped.maxBudgetWait(), is(Duration.ofMillis(250)));
    assertThat(RateLimiterConfig.build(defaults, RequestOptions.none()).maxBudgetWait(), is(Duration.ofSeconds(5)));
  }

  @Test
  void invalidRequestOptionsFailWhenSet() {
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().jitterFactor(1.5));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().maxAttempts(0));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().windowDuration(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().adaptiveCeiling(0));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().tokenBudgetPerWindow(-1L));
    assertThrows(IllegalArgumentException.class,
        () -> RequestOptions.builder().permitTimeout(Duration.ofMillis(-1)));
    assertThrows(IllegalArgumentException.class,
        () -> RequestOptions.builder().maxBudgetWait(Duration.ofMillis(-1)));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().budgetSafetyMultiplier(0));
    assertThrows(IllegalArgumentException.class,
        () -> RequestOptions.builder().defaultRetryDelay(Duration.ofSeconds(-1)));
  }

  @Test
  void buildAcceptsEveryValidOption() {
    var options = RequestOptions.builder().profile(Profile.FREE_TIER).maxAttempts(1).jitterFactor(1.0)
        .baseBackoff(Duration.ZERO).adaptiveCeiling(1).tokenBudgetPerWindow(0L).windowDuration(Duration.ofMillis(1))
        .permitTimeout(Duration.ZERO).maxBudgetWait(Duration.ZERO).budgetSafetyMultiplier(0.5)
        .defaultRetryDelay(Duration.ZERO).maxConcurrencyPerKey(-1).build();
    var config = RateLimiterConfig.build(RateLimiterConfig.defaults(), options);
    assertThat(config.maxAttempts(), is(1));
    assertThat(config.jitterFactor(), is(1.0));
    assertThat(config.maxConcurrencyPerKey(), is(4));
  }

  @Test
  void requestOptionsCanClearNullableSettings() {
    var defaults = RateLimiterConfig.builder().permitTimeout(Duration.ofSeconds(5)).build();
    var options = RequestOptions.builder().permitTimeout(null).tokenBudgetPerWindow(null).maxConcurrencyPerKey(null)
        .build();
    var config = RateLimiterConfig.build(defaults, options);
    assertThat(config.permitTimeout(), is(nullValue()));
    assertThat(config.tokenBudgetPerWindow(), is(nullValue()));
    assertThat(config.isConcurrencyEnabled(), is(false));
  }

  @Test
  void emptyOptionsLeaveDefaultsAlone() {
    var defaults = RateLimiterConfig.builder().maxAttempts(9).build();
    assertThat(RateLimiterConfig.build(defaults, RequestOptions.none()), equalTo(defaults));
  }

  @Test
  void concurrencyNormalisation() {
    assertThat(RateLimiterConfig.builder().maxConcurrencyPerKey(0).build().maxConcurrencyPerKey(), is(0));
    assertThat(RateLimiterConfig.builder().maxConcurrencyPerKey(null).build().isConcurrencyEnabled(), is(false));
    assertThat(RateLimiterConfig.builder().maxConcurrencyPerKey(-3).build().maxConcurrencyPerKey(), is(4));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.builder().maxAttempts(0));
    assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.builder().jitterFactor(1.5));
    assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.builder().windowDuration(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> RequestOptions.builder().estimatedInputUnits(-1));
  }

  @Test
  void fromPropertiesAppliesProfileFirst() {
    var properties = new Properties();
    properties.setProperty("max-attempts", "6");
    properties.setProperty("profile", "paid-tier-2");
    properties.setProperty("token-budget-per-window", "none");
    properties.setProperty("permit-timeout-ms", "1500");
    properties.setProperty("non-blocking", "TRUE");

    var config = RateLimiterConfig.fromProperties(properties);
    assertThat(config.profile(), is(Profile.PAID_TIER_2));
    assertThat(config.maxConcurrencyPerKey(), is(20));
    assertThat(config.maxAttempts(), is(6));
    assertThat(config.tokenBudgetPerWindow(), is(nullValue()));
    assertThat(config.permitTimeout(), is(Duration.ofMillis(1500)));
    assertThat(config.nonBlocking(), is(true));
  }

  @Test
  void fromPropertiesNamesTheBadKey() {
    var properties = new Properties();
    properties.setProperty("max-attempts", "lots");
    var e = assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fromProperties(properties));
    assertThat(e.getMessage(), containsString("max-attempts"));
  }

  @Test
  void loadReadsTheClasspathResource() {
    // src/test/resources/rate-limiter.properties
    var config = RateLimiterConfig.load();
    assertThat(config.profile(), is(Profile.DEV));
    assertThat(config.maxAttempts(), is(4));
  }

  @Test
  void profileNames() {
    assertThat(Profile.parse("paid-tier-3"), is(Profile.PAID_TIER_3));
    assertThat(Profile.parse(" Free_Tier "), is(Profile.FREE_TIER));
    assertThrows(IllegalArgumentException.class, () -> Profile.parse("platinum"));
  }

  @Test
  void equalityTest() {
    new EqualsTester()
        .addEqualityGroup(RateLimiterConfig.defaults(), RateLimiterConfig.builder().build(),
            RateLimiterConfig.defaults().toBuilder().build())
        .addEqualityGroup(RateLimiterConfig.builder().nonBlocking(true).build(),
            RateLimiterConfig.builder().nonBlocking(true).build())
        .addEqualityGroup(RateLimiterConfig.builder().profile(Profile.DEV).build())
        .testEquals();
  }
}
