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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Shared, key-partitioned store of retry windows and usage windows.
 * <p>
 * Every operation is atomic for its key: each key has its own lock, so callers
 * on one key never wait for callers on another. Entries are created on first
 * use and only go away by expiring or through {@link #resetAll()}.
 * </p>
 * <p>
 * The store has an explicit lifecycle. It is usable once {@link #start()}ed
 * (the constructor starts it) and refuses every operation after
 * {@link #stop()}.
 * </p>
 */
public final class RateLimitState implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RateLimitState.class);

  private final InstantSource clock;
  private final ConcurrentMap<StateKey, KeyState> entries = new ConcurrentHashMap<>();
  private volatile boolean running;

  /**
   * A started store.
   *
   * @param clock
   *          the time source for window expiry (mainly for testing)
   */
  public RateLimitState(InstantSource clock) {
    this.clock = clock;
    this.running = true;
  }

  public RateLimitState() {
    this(Clock.systemUTC());
  }

  private static final class KeyState {
    final ReentrantLock lock = new ReentrantLock();
    @Nullable
    RetryWindow retryWindow;
    final UsageWindow usage = new UsageWindow();
  }

  public void start() {
    running = true;
  }

  /**
   * Stops the store and drops everything in it.
   */
  public void stop() {
    running = false;
    entries.clear();
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isRunning() {
    return running;
  }

  InstantSource clock() {
    return clock;
  }

  private <T> T withKey(StateKey key, Function<KeyState, T> action) {
    if (!running) {
      throw new IllegalStateException("Rate limit state has been stopped");
    }
    var state = entries.computeIfAbsent(key, k -> new KeyState());
    state.lock.lock();
    try {
      return action.apply(state);
    } finally {
      state.lock.unlock();
    }
  }

  /**
   * When the key's retry window ends, or {@code null} if there isn't an active
   * one. An expired window is removed as a side effect.
   */
  public @Nullable Instant getRetryUntil(StateKey key) {
    var window = getRetryState(key);
    return window == null ? null : window.retryUntil();
  }

  /**
   * The key's active retry window, or {@code null}.
   */
  public @Nullable RetryWindow getRetryState(StateKey key) {
    return withKey(key, state -> activeWindow(state, clock.instant()));
  }

  private static @Nullable RetryWindow activeWindow(KeyState state, Instant now) {
    var window = state.retryWindow;
    if (window != null && !window.isActive(now)) {
      state.retryWindow = null;
      return null;
    }
    return window;
  }

  /**
   * Records a rate-limit signal. The window ends {@code info.retryDelay()} from
   * now, or {@code defaultDelay} from now if the signal carried no delay.
   * <p>
   * An active window is never shortened: if it already ends later, its end
   * stays put and only the quota details are refreshed.
   * </p>
   *
   * @return the window now in force
   */
  public RetryWindow setRetryState(StateKey key, RetryInfo info, Duration defaultDelay) {
    var now = clock.instant();
    var delay = info.retryDelay() != null ? info.retryDelay() : defaultDelay;
    var retryUntil = now.plus(delay);
    return withKey(key, state -> {
      var existing = activeWindow(state, now);
      RetryWindow updated;
      if (existing == null) {
        updated = RetryWindow.from(retryUntil, info, now);
      } else {
        updated = existing.extendedBy(retryUntil, info, now);
        if (updated.retryUntil().isAfter(retryUntil)) {
          log.debug("Keeping retry window for {} until {} rather than shortening it to {}", key,
              updated.retryUntil(), retryUntil);
        }
      }
      state.retryWindow = updated;
      return updated;
    });
  }

  public void clearRetryState(StateKey key) {
    withKey(key, state -> {
      state.retryWindow = null;
      return null;
    });
  }

  /**
   * Adds consumed units to the key's window. They stop counting once
   * {@code horizon} has passed.
   */
  public void recordUsage(StateKey key, long units, Duration horizon) {
    if (units < 0) {
      throw new IllegalArgumentException("units must not be negative");
    }
    withKey(key, state -> {
      state.usage.record(units, horizon, clock);
      return null;
    });
  }

  public UsageSnapshot getUsage(StateKey key) {
    return withKey(key, state -> state.usage.snapshot());
  }

  /**
   * Reserves {@code estimatedUnits * multiplier} (rounded up) against
   * {@code budget}, or explains why that doesn't fit. A {@code null} budget
   * always succeeds without reserving anything.
   */
  public BudgetDecision tryReserve(StateKey key, long estimatedUnits, @Nullable Long budget, double multiplier,
      Duration horizon) {
    var requested = scaled(estimatedUnits, multiplier);
    if (budget == null) {
      return BudgetDecision.allow(new BudgetReservation(estimatedUnits, 0, null, null));
    }
    return withKey(key, state -> {
      var exceeded = exceeded(state, estimatedUnits, requested, budget);
      if (exceeded != null) {
        return BudgetDecision.reject(exceeded);
      }
      var entry = state.usage.reserve(requested, horizon, clock);
      return BudgetDecision.allow(new BudgetReservation(estimatedUnits, requested, budget, entry));
    });
  }

  /**
   * Like {@link #tryReserve} but changes nothing.
   *
   * @return why the units wouldn't fit, or {@code null} if they would
   */
  public BudgetDecision.@Nullable Exceeded checkBudget(StateKey key, long estimatedUnits, @Nullable Long budget,
      double multiplier) {
    if (budget == null) {
      return null;
    }
    var requested = scaled(estimatedUnits, multiplier);
    return withKey(key, state -> exceeded(state, estimatedUnits, requested, budget));
  }

  private BudgetDecision.@Nullable Exceeded exceeded(KeyState state, long estimatedUnits, long requested,
      long budget) {
    if (requested > budget) {
      return new BudgetDecision.Exceeded(estimatedUnits, requested, budget, true, state.usage.snapshot(), null);
    }
    if (state.usage.committedUnits() + requested > budget) {
      var retryAt = state.usage.whenFits(requested, budget, clock.instant());
      return new BudgetDecision.Exceeded(estimatedUnits, requested, budget, false, state.usage.snapshot(), retryAt);
    }
    return null;
  }

  /**
   * Swaps a reservation for the units the call actually used.
   */
  public UsageSnapshot reconcile(StateKey key, BudgetReservation reservation, long actualUnits, Duration horizon) {
    return withKey(key, state -> {
      var entry = reservation.entry;
      if (entry != null) {
        state.usage.cancel(entry);
      }
      state.usage.record(Math.max(0, actualUnits), horizon, clock);
      return state.usage.snapshot();
    });
  }

  /**
   * Drops a reservation without charging anything, for calls that never ran.
   */
  public UsageSnapshot releaseReservation(StateKey key, BudgetReservation reservation) {
    return withKey(key, state -> {
      var entry = reservation.entry;
      if (entry != null) {
        state.usage.cancel(entry);
      }
      return state.usage.snapshot();
    });
  }

  /**
   * Forgets every key. Administrative and test use only.
   */
  public void resetAll() {
    entries.clear();
  }

  private static long scaled(long units, double multiplier) {
    if (multiplier == 1.0) {
      return units;
    }
    return (long) Math.ceil(units * multiplier);
  }
}
