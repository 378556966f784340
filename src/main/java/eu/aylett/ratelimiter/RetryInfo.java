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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whatever a rate-limited response said about when to retry and which quota
 * was exhausted. Every field is optional.
 *
 * @param retryDelay
 *          how long the server asked callers to wait
 * @param quotaMetric
 *          the metric whose quota was exceeded
 * @param quotaId
 *          the specific quota's identifier
 * @param quotaDimensions
 *          the dimensions the quota applies to, such as model or location
 * @param quotaValue
 *          the quota's limit, in whatever form the server reported it
 */
public record RetryInfo(@Nullable Duration retryDelay, @Nullable String quotaMetric, @Nullable String quotaId,
    @Nullable Map<String, ?> quotaDimensions, @Nullable Object quotaValue) {

  public static final RetryInfo EMPTY = new RetryInfo(null, null, null, null, null);

  public RetryInfo {
    if (quotaDimensions != null) {
      quotaDimensions = Collections.unmodifiableMap(new LinkedHashMap<>(quotaDimensions));
    }
  }

  public static RetryInfo ofDelay(Duration retryDelay) {
    return new RetryInfo(retryDelay, null, null, null, null);
  }

  public boolean isEmpty() {
    return EMPTY.equals(this);
  }

  /**
   * Parses a retry delay as servers send it: {@code "60s"}, {@code "1.5s"},
   * {@code "100ms"}, {@code "2m"}, a bare number of seconds as a string, or an
   * integral number of milliseconds.
   *
   * @return the delay, or {@code null} if {@code value} isn't one of those
   *         forms or is negative
   */
  public static @Nullable Duration parseDelay(@Nullable Object value) {
    if (value instanceof Integer || value instanceof Long) {
      var millis = ((Number) value).longValue();
      return millis >= 0 ? Duration.ofMillis(millis) : null;
    }
    if (value instanceof Duration duration) {
      return duration.isNegative() ? null : duration;
    }
    if (!(value instanceof String text)) {
      return null;
    }
    var trimmed = text.trim();
    if (trimmed.endsWith("ms")) {
      return scaled(trimmed.substring(0, trimmed.length() - 2), 1);
    }
    if (trimmed.endsWith("s")) {
      return scaled(trimmed.substring(0, trimmed.length() - 1), 1_000);
    }
    if (trimmed.endsWith("m")) {
      return scaled(trimmed.substring(0, trimmed.length() - 1), 60_000);
    }
    return scaled(trimmed, 1_000);
  }

  private static @Nullable Duration scaled(String number, long millisPerUnit) {
    try {
      var amount = new BigDecimal(number.trim());
      // Absurd magnitudes in either direction are rejected before scaling
      if (amount.scale() > 12 || amount.precision() - amount.scale() > 12) {
        return null;
      }
      var millis = amount.multiply(BigDecimal.valueOf(millisPerUnit)).setScale(0, RoundingMode.HALF_UP);
      if (millis.signum() < 0) {
        return null;
      }
      return Duration.ofMillis(millis.longValueExact());
    } catch (ArithmeticException | NumberFormatException e) {
      return null;
    }
  }
}
