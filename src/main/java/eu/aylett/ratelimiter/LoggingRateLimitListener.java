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
 * The default listener: writes every event to SLF4J.
 */
public final class LoggingRateLimitListener implements RateLimitListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingRateLimitListener.class);

  @Override
  public void onEvent(RateLimitEvent event) {
    switch (event.type()) {
      case WINDOW_SET -> log.info("Rate limited on {} until {} (quota {})", event.key(),
          event.attribute("retryUntil"), event.attribute("quotaId"));
      case WINDOW_HIT -> log.debug("Call on {} hit retry window ending {}", event.key(), event.attribute("retryUntil"));
      case WINDOW_RELEASE -> log.debug("Retry window on {} ending {} has passed", event.key(),
          event.attribute("retryUntil"));
      case REQUEST_START -> log.debug("Starting call on {}", event.key());
      case REQUEST_STOP -> log.debug("Call on {} finished with {} after {}", event.key(), event.attribute("status"),
          event.duration());
      case REQUEST_EXCEPTION -> log.warn("Call on {} failed after {}: {}", event.key(), event.duration(),
          event.attribute("reason"));
      case BUDGET_RESERVED -> log.debug("Reserved {} units on {}", event.attribute("reservedUnits"), event.key());
      case BUDGET_REJECTED -> log.info("Call on {} does not fit the budget of {} units; retry at {}", event.key(),
          event.attribute("budget"), event.attribute("retryAt"));
      case BUDGET_WAIT -> log.info("Waiting {} for budget on {}", event.duration(), event.key());
      case STREAM_STARTED -> log.debug("Stream started on {}", event.key());
      case STREAM_COMPLETED, STREAM_CANCELLED -> log.debug("Stream on {} ended: {}", event.key(), event.type());
      case STREAM_ERROR -> log.warn("Stream on {} ended with an error", event.key());
    }
  }
}
