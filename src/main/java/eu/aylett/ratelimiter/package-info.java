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

/**
 * Every call a client makes to a quota-limited API should go through one
 * {@link eu.aylett.ratelimiter.RateLimitManager}.
 * <p>
 * The manager bounds how many calls are in flight per key, remembers the retry
 * window a 429 response asks for so that nobody else on the same key calls
 * until it has passed, retries transient failures with jittered exponential
 * backoff, and keeps a sliding budget of usage units so a client can throttle
 * itself before the server does.
 * </p>
 * <p>
 * Keys are independent: nothing done for one {@link eu.aylett.ratelimiter.StateKey}
 * blocks or changes another. The limiting is advisory and local to one
 * process.
 * </p>
 * <p>
 * In blocking mode callers wait out retry windows and backoff. In
 * non-blocking mode they get a {@link eu.aylett.ratelimiter.RateLimitedException}
 * straight away, carrying the instant it is worth trying again.
 * </p>
 */
@NullMarked
package eu.aylett.ratelimiter;

import org.jspecify.annotations.NullMarked;
