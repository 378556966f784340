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
 * How a stream ended.
 */
public enum StreamOutcome {
  COMPLETED,
  ERROR,
  CANCELLED;

  RateLimitEvent.Type eventType() {
    return switch (this) {
      case COMPLETED -> RateLimitEvent.Type.STREAM_COMPLETED;
      case ERROR -> RateLimitEvent.Type.STREAM_ERROR;
      case CANCELLED -> RateLimitEvent.Type.STREAM_CANCELLED;
    };
  }
}
