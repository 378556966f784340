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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.InstantSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation until it succeeds, fails permanently, or runs out of
 * attempts, honouring the retry windows servers hand out.
 * <p>
 * Waiting out a rate limit does not use up an attempt: only transient failures
 * count towards {@link RateLimiterConfig#maxAttempts()}.
 * </p>
 */
public final class RetryManager {
  private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

  static final String RETRY_INFO_TYPE = "type.googleapis.com/google.rpc.RetryInfo";
  static final String SHORT_RETRY_INFO_TYPE = "google.rpc.RetryInfo";
  static final Duration RETRY_INFO_DEFAULT_DELAY = Duration.ofSeconds(60);
  private static final int MAX_SEARCH_DEPTH = 8;

  private final RateLimitState state;
  private final InstantSource clock;
  private final DoubleSupplier randomSource;
  private final Sleeper sleeper;
  private final RateLimitListener listener;

  /**
   * @param randomSource
   *          uniform values in {@code [0, 1)}, for jitter
   * @param sleeper
   *          how to wait out windows and backoffs
   * @param listener
   *          receives window events
   */
  public RetryManager(RateLimitState state, InstantSource clock, DoubleSupplier randomSource, Sleeper sleeper,
      RateLimitListener listener) {
    this.state = state;
    this.clock = clock;
    this.randomSource = randomSource;
    this.sleeper = sleeper;
    this.listener = GuardedListener.guard(listener);
  }

  /**
   * Calls {@code operation}, retrying as {@code config} allows.
   *
   * @throws RateLimitedException
   *           in non-blocking mode, if the key is in a retry window or the call
   *           was rate limited
   * @throws TransientFailureException
   *           once {@code maxAttempts} transient failures have been seen
   * @throws InterruptedException
   *           if interrupted while waiting
   * @throws Exception
   *           whatever the operation threw, if it was a permanent failure
   */
  public <T> T executeWithRetry(Callable<T> operation, StateKey key, RateLimiterConfig config,
      Outcome.Observer observer) throws Exception {
    var attempt = 1;
    while (true) {
      var window = state.getRetryState(key);
      if (window != null) {
        emit(RateLimitEvent.of(RateLimitEvent.Type.WINDOW_HIT, key, null, "retryUntil", window.retryUntil()));
        if (config.nonBlocking()) {
          throw new RateLimitedException(window.retryUntil(), RateLimitDetails.retryWindow(window, attempt));
        }
        awaitWindow(key, window, config);
        continue;
      }

      T result;
      try {
        result = operation.call();
      } catch (Exception e) {
        var outcome = classify(e);
        observer.onOutcome(outcome);
        switch (outcome) {
          case RATE_LIMITED -> {
            var info = extractRetryInfo(e);
            var updated = state.setRetryState(key, info, config.defaultRetryDelay());
            emit(RateLimitEvent.of(RateLimitEvent.Type.WINDOW_SET, key, null, "retryUntil", updated.retryUntil(),
                "quotaMetric", updated.quotaMetric(), "quotaId", updated.quotaId()));
            if (config.nonBlocking()) {
              throw new RateLimitedException(updated.retryUntil(), RateLimitDetails.retryWindow(updated, attempt), e);
            }
          }
          case TRANSIENT -> {
            if (attempt >= config.maxAttempts()) {
              throw new TransientFailureException(attempt, e);
            }
            if (!config.nonBlocking()) {
              var backoff = calculateBackoff(attempt, config);
              log.debug("Attempt {} on {} failed transiently; retrying in {}", attempt, key, backoff);
              sleeper.sleep(backoff);
            }
            attempt++;
          }
          default -> throw e;
        }
        continue;
      }

      observer.onOutcome(Outcome.SUCCESS);
      state.clearRetryState(key);
      return result;
    }
  }

  private void awaitWindow(StateKey key, RetryWindow window, RateLimiterConfig config) throws InterruptedException {
    var wait = Duration.between(clock.instant(), window.retryUntil());
    if (!wait.isNegative() && !wait.isZero()) {
      var extra = (long) (randomSource.getAsDouble() * config.jitterFactor() * wait.toMillis());
      var jittered = wait.plusMillis(extra);
      log.debug("Waiting {} for the retry window on {} to pass", jittered, key);
      sleeper.sleep(jittered);
    }
    emit(RateLimitEvent.of(RateLimitEvent.Type.WINDOW_RELEASE, key, null, "retryUntil", window.retryUntil()));
  }

  private void emit(RateLimitEvent event) {
    listener.onEvent(event);
  }

  /**
   * Decides whether a failure is worth retrying. {@code null} means the call
   * succeeded.
   * <p>
   * HTTP 429 is a rate limit; HTTP 5xx, timeouts and broken connections are
   * transient; anything else, including exceptions this library doesn't
   * recognise, is permanent.
   * </p>
   */
  public static Outcome classify(@Nullable Throwable error) {
    if (error == null) {
      return Outcome.SUCCESS;
    }
    var transport = TransportException.from(error);
    if (transport == null) {
      return Outcome.PERMANENT;
    }
    return switch (transport.kind) {
      case HTTP -> classifyStatus(transport.status);
      case TIMEOUT, CONNECTION_CLOSED, CONNECTION_REFUSED, CONNECTION_RESET -> Outcome.TRANSIENT;
    };
  }

  static Outcome classifyStatus(int status) {
    if (status == 429) {
      return Outcome.RATE_LIMITED;
    }
    if (status >= 500 && status <= 599) {
      return Outcome.TRANSIENT;
    }
    return Outcome.PERMANENT;
  }

  /**
   * Exponential backoff: {@code baseBackoff * 2^(attempt - 1)}, scaled by a
   * uniform draw from {@code [1 - jitterFactor, 1 + jitterFactor]} and rounded
   * to the millisecond.
   */
  public Duration calculateBackoff(int attempt, RateLimiterConfig config) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be at least 1, was " + attempt);
    }
    var exponential = config.baseBackoff().toMillis() * Math.pow(2, attempt - 1);
    var jitter = config.jitterFactor();
    var factor = 1 - jitter + randomSource.getAsDouble() * 2 * jitter;
    return Duration.ofMillis(Math.round(exponential * factor));
  }

  /**
   * Digs the retry delay and quota details out of an error response, wherever
   * the server put them: at the top level, under {@code error}, in a
   * {@code details} list (including {@code google.rpc.RetryInfo} entries, whose
   * delay defaults to a minute) or in a {@code violations} list. Delays that
   * can't be parsed are passed over.
   * <p>
   * Accepts a {@link TransportException} (reading its body) or an already
   * decoded {@code Map} or {@code List}. Never throws.
   * </p>
   */
  public static RetryInfo extractRetryInfo(@Nullable Object error) {
    try {
      var body = error instanceof TransportException transport ? transport.body : error;
      if (body == null) {
        return RetryInfo.EMPTY;
      }
      var delay = findDelay(body, 0);
      var dimensions = findField(body, "quotaDimensions", 0);
      var metric = findField(body, "quotaMetric", 0);
      var quotaId = findField(body, "quotaId", 0);
      return new RetryInfo(delay, metric == null ? null : metric.toString(),
          quotaId == null ? null : quotaId.toString(), dimensions instanceof Map<?, ?> map ? stringKeys(map) : null,
          findField(body, "quotaValue", 0));
    } catch (RuntimeException e) {
      log.debug("Ignoring unreadable rate limit details", e);
      return RetryInfo.EMPTY;
    }
  }

  // Candidates that don't parse are skipped so a usable delay further in still wins
  private static @Nullable Duration findDelay(@Nullable Object term, int depth) {
    if (depth > MAX_SEARCH_DEPTH) {
      return null;
    }
    if (term instanceof List<?> list) {
      return findDelayInList(list, depth);
    }
    if (!(term instanceof Map<?, ?> map)) {
      return null;
    }
    var direct = RetryInfo.parseDelay(map.get("retryDelay"));
    if (direct != null) {
      return direct;
    }
    var nested = findDelay(map.get("error"), depth + 1);
    if (nested != null) {
      return nested;
    }
    if (map.get("details") instanceof List<?> details) {
      for (var detail : details) {
        if (detail instanceof Map<?, ?> entry) {
          var delay = RetryInfo.parseDelay(entry.get("retryDelay"));
          if (delay != null) {
            return delay;
          }
          var type = entry.get("@type");
          if (RETRY_INFO_TYPE.equals(type) || SHORT_RETRY_INFO_TYPE.equals(type)) {
            return RETRY_INFO_DEFAULT_DELAY;
          }
        }
      }
    }
    if (map.get("violations") instanceof List<?> violations) {
      return findDelayInList(violations, depth);
    }
    return null;
  }

  private static @Nullable Duration findDelayInList(List<?> list, int depth) {
    for (var element : list) {
      var found = findDelay(element, depth + 1);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private static @Nullable Object findField(@Nullable Object term, String field, int depth) {
    if (depth > MAX_SEARCH_DEPTH) {
      return null;
    }
    if (term instanceof List<?> list) {
      return findInList(list, field, depth);
    }
    if (!(term instanceof Map<?, ?> map)) {
      return null;
    }
    var direct = map.get(field);
    if (direct != null) {
      return direct;
    }
    var inError = findField(map.get("error"), field, depth + 1);
    if (inError != null) {
      return inError;
    }
    if (map.get("details") instanceof List<?> details) {
      var found = findInList(details, field, depth);
      if (found != null) {
        return found;
      }
    }
    if (map.get("violations") instanceof List<?> violations) {
      return findInList(violations, field, depth);
    }
    return null;
  }

  private static @Nullable Object findInList(List<?> list, String field, int depth) {
    for (var element : list) {
      var found = findField(element, field, depth + 1);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map) {
    var result = new LinkedHashMap<String, Object>();
    map.forEach((k, v) -> {
      if (k != null && v != null) {
        result.put(k.toString(), v);
      }
    });
    return result;
  }
}
