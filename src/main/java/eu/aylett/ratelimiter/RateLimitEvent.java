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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something the rate limiter did, for a {@link RateLimitListener}.
 *
 * @param type
 *          what happened
 * @param key
 *          the partition it happened to
 * @param attributes
 *          event-specific details, such as {@code retryUntil} or
 *          {@code status}
 * @param duration
 *          elapsed time, for events that close a span
 */
public record RateLimitEvent(Type type, StateKey key, Map<String, Object> attributes, @Nullable Duration duration) {

  public enum Type {
    WINDOW_SET,
    WINDOW_HIT,
    WINDOW_RELEASE,
    REQUEST_START,
    REQUEST_STOP,
    REQUEST_EXCEPTION,
    BUDGET_RESERVED,
    BUDGET_REJECTED,
    BUDGET_WAIT,
    STREAM_STARTED,
    STREAM_COMPLETED,
    STREAM_ERROR,
    STREAM_CANCELLED,
  }

  public RateLimitEvent {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  static RateLimitEvent of(Type type, StateKey key) {
    return new RateLimitEvent(type, key, Map.of(), null);
  }

  /**
   * Builds an event from alternating attribute names and values, skipping
   * pairs whose value is {@code null}.
   */
  static RateLimitEvent of(Type type, StateKey key, @Nullable Duration duration, @Nullable Object... attributes) {
    var map = new LinkedHashMap<String, Object>();
    for (var i = 0; i + 1 < attributes.length; i += 2) {
      var value = attributes[i + 1];
      if (value != null) {
        map.put(String.valueOf(attributes[i]), value);
      }
    }
    return new RateLimitEvent(type, key, map, duration);
  }

  public @Nullable Object attribute(String name) {
    return attributes.get(name);
  }
}
