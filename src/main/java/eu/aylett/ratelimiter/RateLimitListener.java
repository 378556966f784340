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

/**
 * Receives the rate limiter's events. Called synchronously on the caller's
 * thread, so implementations should be quick; exceptions they throw are
 * logged and otherwise ignored.
 */
@FunctionalInterface
public interface RateLimitListener {
  void onEvent(RateLimitEvent event);

  /**
   * A listener that sends each event to both listeners in turn.
   */
  default RateLimitListener andThen(RateLimitListener next) {
    return event -> {
      onEvent(event);
      next.onEvent(event);
    };
  }
}
