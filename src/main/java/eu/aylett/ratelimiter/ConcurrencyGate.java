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

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds how many calls may be in flight at once for each permit key.
 * <p>
 * Pools are created on first use and sized from the configuration of the call
 * that uses them. In adaptive mode a pool's ceiling drops by a quarter (and by
 * at least one) for every rate-limited outcome, down to one, and climbs back
 * by one per success up to the configured adaptive ceiling.
 * </p>
 * <p>
 * Waiting is best effort, not first-come-first-served: a release wakes one
 * waiter, but a caller arriving at that moment may take the slot first.
 * </p>
 */
public final class ConcurrencyGate {
  private static final Logger log = LoggerFactory.getLogger(ConcurrencyGate.class);

  static final double ADAPTIVE_BACKOFF_FACTOR = 0.75;
  static final int ADAPTIVE_RAISE_AMOUNT = 1;

  private final ConcurrentMap<String, Pool> pools = new ConcurrentHashMap<>();

  static final class Pool {
    private final String key;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    // guarded by lock
    private int max;
    private @Nullable Integer adaptiveMax;
    private int inFlight;

    Pool(String key, int max) {
      this.key = key;
      this.max = max;
    }

    private int effectiveMax() {
      return adaptiveMax != null ? adaptiveMax : max;
    }

    private boolean tryTake() {
      if (inFlight < effectiveMax()) {
        inFlight++;
        return true;
      }
      return false;
    }

    private int available() {
      return Math.max(0, effectiveMax() - inFlight);
    }

    void release() {
      lock.lock();
      try {
        if (inFlight > 0) {
          inFlight--;
        } else {
          log.warn("Permit released for {} with nothing in flight", key);
        }
        available.signal();
      } finally {
        lock.unlock();
      }
    }
  }

  private Pool pool(String key, RateLimiterConfig config) {
    var pool = pools.computeIfAbsent(key, k -> new Pool(k, config.maxConcurrencyPerKey()));
    pool.lock.lock();
    try {
      if (pool.max != config.maxConcurrencyPerKey()) {
        pool.max = config.maxConcurrencyPerKey();
        pool.available.signalAll();
      }
    } finally {
      pool.lock.unlock();
    }
    return pool;
  }

  /**
   * Takes a permit if one is free, without waiting.
   */
  public Optional<Permit> tryAcquire(String key, RateLimiterConfig config) {
    if (!config.isConcurrencyEnabled()) {
      return Optional.of(Permit.ungated());
    }
    var pool = pool(key, config);
    pool.lock.lock();
    try {
      if (pool.tryTake()) {
        return Optional.of(new Permit(key, pool));
      }
      return Optional.empty();
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * Takes a permit for {@code key}.
   * <p>
   * In non-blocking mode a full pool fails at once. Otherwise the caller waits
   * up to the configured permit timeout, or indefinitely if there is none.
   * With gating turned off the permit holds nothing.
   * </p>
   *
   * @throws RateLimitedException
   *           in non-blocking mode, if the pool is full
   * @throws PermitTimeoutException
   *           if the permit timeout passed first
   * @throws InterruptedException
   *           if the thread was interrupted while waiting
   */
  public Permit acquire(String key, RateLimiterConfig config) throws InterruptedException {
    if (!config.isConcurrencyEnabled()) {
      return Permit.ungated();
    }
    var pool = pool(key, config);
    pool.lock.lockInterruptibly();
    try {
      if (pool.tryTake()) {
        return new Permit(key, pool);
      }
      if (config.nonBlocking()) {
        log.debug("No concurrency permit free for {}", key);
        throw new RateLimitedException(null, RateLimitDetails.noPermits(pool.available()));
      }
      var timeout = config.permitTimeout();
      var remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
      log.debug("Waiting for a concurrency permit for {}", key);
      try {
        while (!pool.tryTake()) {
          if (timeout == null) {
            pool.available.await();
          } else {
            if (remaining <= 0) {
              throw new PermitTimeoutException(key, timeout);
            }
            remaining = pool.available.awaitNanos(remaining);
          }
        }
      } catch (InterruptedException | RuntimeException e) {
        // We may have consumed a signal meant for a slot we're not taking
        if (pool.available() > 0) {
          pool.available.signal();
        }
        throw e;
      }
      return new Permit(key, pool);
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * Free permits for {@code key}: the configured maximum for a pool nobody has
   * used yet, never negative.
   * <p>
   * Returns {@code 0} when gating is off for {@code config}. That means calls
   * are not gated at all, not that they would have to wait; check
   * {@link RateLimiterConfig#isConcurrencyEnabled()} before treating {@code 0}
   * as a full pool.
   * </p>
   */
  public int availablePermits(String key, RateLimiterConfig config) {
    if (!config.isConcurrencyEnabled()) {
      return 0;
    }
    var pool = pools.get(key);
    if (pool == null) {
      return config.maxConcurrencyPerKey();
    }
    pool.lock.lock();
    try {
      return pool.available();
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * The ceiling currently applied to {@code key}, including any adaptive
   * adjustment.
   */
  public int effectiveLimit(String key, RateLimiterConfig config) {
    var pool = pools.get(key);
    if (pool == null) {
      return config.maxConcurrencyPerKey();
    }
    pool.lock.lock();
    try {
      return pool.effectiveMax();
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * Lowers the key's ceiling after a rate-limited outcome. Does nothing unless
   * adaptive concurrency is on.
   */
  public void signalRateLimited(String key, RateLimiterConfig config) {
    if (!config.adaptiveConcurrency() || !config.isConcurrencyEnabled()) {
      return;
    }
    var pool = pool(key, config);
    pool.lock.lock();
    try {
      var current = pool.effectiveMax();
      var lowered = Math.max(1, Math.min(current - 1, (int) Math.round(current * ADAPTIVE_BACKOFF_FACTOR)));
      if (lowered != current) {
        log.info("Lowering concurrency for {} from {} to {} after rate limiting", key, current, lowered);
      }
      pool.adaptiveMax = lowered;
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * Raises the key's ceiling by one after a success, up to the adaptive
   * ceiling. Does nothing unless adaptive concurrency is on and the ceiling
   * has been lowered at some point.
   */
  public void signalSuccess(String key, RateLimiterConfig config) {
    if (!config.adaptiveConcurrency() || !config.isConcurrencyEnabled()) {
      return;
    }
    var pool = pools.get(key);
    if (pool == null) {
      return;
    }
    pool.lock.lock();
    try {
      var current = pool.adaptiveMax;
      if (current == null) {
        return;
      }
      var raised = Math.min(config.adaptiveCeiling(), current + ADAPTIVE_RAISE_AMOUNT);
      if (raised > current) {
        log.debug("Raising concurrency for {} from {} to {}", key, current, raised);
        pool.available.signalAll();
      }
      pool.adaptiveMax = raised;
    } finally {
      pool.lock.unlock();
    }
  }

  /**
   * Forgets every pool. Administrative and test use only.
   */
  public void resetAll() {
    pools.clear();
  }
}
