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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a misbehaving listener from failing the call it is observing.
 */
final class GuardedListener implements RateLimitListener {
  private static final Logger log = LoggerFactory.getLogger(GuardedListener.class);

  private final RateLimitListener delegate;

  private GuardedListener(RateLimitListener delegate) {
    this.delegate = delegate;
  }

  static RateLimitListener guard(RateLimitListener listener) {
    if (listener instanceof GuardedListener) {
      return listener;
    }
    return new GuardedListener(listener);
  }

  @Override
  public void onEvent(RateLimitEvent event) {
    try {
      delegate.onEvent(event);
    } catch (RuntimeException e) {
      log.warn("Rate limit listener failed on {} for {}", event.type(), event.key(), e);
    }
  }
}
