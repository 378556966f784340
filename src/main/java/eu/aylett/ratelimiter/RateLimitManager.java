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

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

import static eu.aylett.ratelimiter.SneakyThrows.sneakyThrow;

/**
 * Runs calls to a rate-limited service: reserves budget, takes a concurrency
 * permit, and retries through the {@link RetryManager}, giving everything back
 * however the call ends.
 * <p>
 * Calls are partitioned by {@link StateKey}. Retry windows and budgets belong
 * to the full key; concurrency permits are shared by every key with the same
 * resource, or narrowed further with
 * {@link RequestOptions.Builder#concurrencyKey}.
 * </p>
 */
public final class RateLimitManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RateLimitManager.class);

  private final RateLimiterConfig defaults;
  private final RateLimitState state;
  private final ConcurrencyGate gate;
  private final RetryManager retryManager;
  private final RateLimitListener listener;
  private final InstantSource clock;
  private final Sleeper sleeper;

  private RateLimitManager(Builder builder) {
    this.defaults = builder.defaults == null ? RateLimiterConfig.load() : builder.defaults;
    this.clock = builder.clock;
    this.state = builder.state == null ? new RateLimitState(clock) : builder.state;
    this.gate = builder.gate == null ? new ConcurrencyGate() : builder.gate;
    this.listener = GuardedListener.guard(builder.listener);
    this.sleeper = builder.sleeper;
    this.retryManager = new RetryManager(state, clock, builder.randomSource, sleeper, listener);
  }

  /**
   * A manager using the configuration from {@link RateLimiterConfig#load()}, the
   * system clock and SLF4J for events.
   */
  public static RateLimitManager create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public RateLimiterConfig defaults() {
    return defaults;
  }

  /**
   * Calls {@code operation} under the key's limits.
   * <p>
   * When the limiter is disabled, this is exactly one direct call. Otherwise
   * budget is reserved, a permit taken and the call retried as configured; the
   * permit is always released, and the reservation is settled against the
   * usage the result reports (see {@link UsageExtractors#standard()}).
   * </p>
   *
   * @throws RateLimitedException
   *           if the call can't go ahead now: over budget, no permits in
   *           non-blocking mode, or in a retry window in non-blocking mode
   * @throws PermitTimeoutException
   *           if no permit came free within the permit timeout
   * @throws TransientFailureException
   *           if every attempt failed transiently
   * @throws RateLimiterException
   *           if interrupted while waiting
   * @throws Exception
   *           whatever {@code operation} threw, if it failed permanently
   */
  public <T> T checkedExecute(StateKey key, RequestOptions options, Callable<T> operation) throws Exception {
    return run(key, options, operation, UsageExtractors.standard(), false);
  }

  public <T> T checkedExecute(StateKey key, Callable<T> operation) throws Exception {
    return checkedExecute(key, RequestOptions.none(), operation);
  }

  /**
   * {@link #checkedExecute} for a {@link Supplier}. Checked exceptions are
   * rethrown without being wrapped.
   */
  public <T> T execute(StateKey key, RequestOptions options, Supplier<T> supplier) {
    try {
      return checkedExecute(key, options, supplier::get);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  public <T> T execute(StateKey key, Supplier<T> supplier) {
    return execute(key, RequestOptions.none(), supplier);
  }

  public void execute(StateKey key, RequestOptions options, Runnable runnable) {
    execute(key, options, () -> {
      runnable.run();
      return null;
    });
  }

  /**
   * As {@link #checkedExecute}, charging the usage {@code extractor} reads from
   * the result. Usage is recorded even when the limiter is disabled.
   */
  public <T> T executeWithUsageTracking(StateKey key, RequestOptions options, Callable<T> operation,
      UsageExtractor<? super T> extractor) throws Exception {
    return run(key, options, operation, extractor, true);
  }

  private <T> T run(StateKey key, RequestOptions options, Callable<T> operation, UsageExtractor<? super T> extractor,
      boolean recordWhenDisabled) throws Exception {
    var config = configFor(options);
    if (!config.isEnabled()) {
      var result = operation.call();
      if (recordWhenDisabled) {
        var usage = usageOf(key, result, extractor);
        if (usage != null) {
          state.recordUsage(key, usage.totalUnits(), config.windowDuration());
        }
      }
      return result;
    }

    var started = clock.instant();
    emit(RateLimitEvent.of(RateLimitEvent.Type.REQUEST_START, key));
    var gateKey = gateKey(key, options);
    BudgetReservation reservation;
    Permit permit;
    try {
      reservation = reserveBudget(key, options, config);
      try {
        permit = gate.acquire(gateKey, config);
      } catch (InterruptedException | RuntimeException e) {
        state.releaseReservation(key, reservation);
        throw e;
      }
    } catch (InterruptedException e) {
      emitException(key, started, e);
      throw interrupted(key, e);
    } catch (RuntimeException e) {
      emitException(key, started, e);
      throw e;
    }

    T result;
    var success = false;
    try (permit) {
      result = retryManager.executeWithRetry(operation, key, config, outcome -> signal(gateKey, config, outcome));
      success = true;
    } catch (InterruptedException e) {
      emitException(key, started, e);
      throw interrupted(key, e);
    } catch (Exception e) {
      emitException(key, started, e);
      throw e;
    } finally {
      if (!success) {
        state.releaseReservation(key, reservation);
      }
    }

    var usage = usageOf(key, result, extractor);
    state.reconcile(key, reservation, usage == null ? 0 : usage.totalUnits(), config.windowDuration());
    emit(RateLimitEvent.of(RateLimitEvent.Type.REQUEST_STOP, key, elapsedSince(started), "status", "ok"));
    return result;
  }

  /**
   * Reserves budget and takes a permit for something that outlives this call,
   * then starts it. The returned handle owns both until it is released.
   * <p>
   * If {@code starter} fails, everything is released as
   * {@link StreamOutcome#ERROR} before its exception propagates. Streams don't
   * retry and don't wait for retry windows.
   * </p>
   *
   * @throws RateLimitedException
   *           if the budget or permits aren't available
   */
  public <T> StreamingHandle<T> executeStreaming(StateKey key, RequestOptions options, StreamStarter<T> starter)
      throws Exception {
    var config = configFor(options);
    if (!config.isEnabled()) {
      return new StreamingHandle<>(starter.start(), new StreamingHandle.Lease(key, (outcome, usage) -> {
      }));
    }

    var gateKey = gateKey(key, options);
    BudgetReservation reservation;
    Permit permit;
    try {
      reservation = reserveBudget(key, options, config);
      try {
        permit = gate.acquire(gateKey, config);
      } catch (InterruptedException | RuntimeException e) {
        state.releaseReservation(key, reservation);
        throw e;
      }
    } catch (InterruptedException e) {
      throw interrupted(key, e);
    }

    var lease = new StreamingHandle.Lease(key, (outcome, usage) -> {
      permit.release();
      if (usage == null) {
        state.releaseReservation(key, reservation);
      } else {
        state.reconcile(key, reservation, usage.totalUnits(), config.windowDuration());
      }
      emit(RateLimitEvent.of(outcome.eventType(), key, null, "outcome", outcome));
    });

    T value;
    var started = false;
    try {
      value = starter.start();
      started = true;
    } finally {
      if (!started) {
        lease.release(StreamOutcome.ERROR, null);
      }
    }
    emit(RateLimitEvent.of(RateLimitEvent.Type.STREAM_STARTED, key));
    return new StreamingHandle<>(value, lease);
  }

  /**
   * What would stop a call made now, checked in order: retry window, permits,
   * budget. Changes nothing.
   */
  public RateLimitStatus checkStatus(StateKey key, RequestOptions options) {
    var config = configFor(options);
    if (!config.isEnabled()) {
      return RateLimitStatus.OK;
    }
    var window = state.getRetryState(key);
    if (window != null) {
      return RateLimitStatus.rateLimited(window);
    }
    if (config.isConcurrencyEnabled()) {
      var available = gate.availablePermits(gateKey(key, options), config);
      if (available == 0) {
        return RateLimitStatus.noPermits(available);
      }
    }
    var exceeded = state.checkBudget(key, options.estimatedTotalUnits(), config.tokenBudgetPerWindow(),
        config.budgetSafetyMultiplier());
    if (exceeded != null) {
      return RateLimitStatus.overBudget(exceeded);
    }
    return RateLimitStatus.OK;
  }

  public RateLimitStatus checkStatus(StateKey key) {
    return checkStatus(key, RequestOptions.none());
  }

  /**
   * Free concurrency permits for calls made with these options.
   */
  public int availablePermits(StateKey key, RequestOptions options) {
    return gate.availablePermits(gateKey(key, options), configFor(options));
  }

  public @Nullable RetryWindow getRetryState(StateKey key) {
    return state.getRetryState(key);
  }

  public UsageSnapshot getUsage(StateKey key) {
    return state.getUsage(key);
  }

  /**
   * Forgets all retry windows, usage and permit pools. Permits still held are
   * released into pools that no longer exist.
   */
  public void resetAll() {
    log.info("Resetting all rate limit state");
    state.resetAll();
    gate.resetAll();
  }

  /**
   * Wrap a Supplier so that every call goes through {@link #execute}.
   */
  public <T> Supplier<T> wrap(StateKey key, RequestOptions options, Supplier<T> supplier) {
    return () -> execute(key, options, supplier);
  }

  /**
   * Wrap a Runnable so that every call goes through {@link #execute}.
   */
  public Runnable wrap(StateKey key, RequestOptions options, Runnable runnable) {
    return () -> execute(key, options, runnable);
  }

  /**
   * Wrap a Function so that every call goes through {@link #execute}.
   */
  public <T, R> Function<T, R> wrap(StateKey key, RequestOptions options, Function<T, R> function) {
    return (T t) -> execute(key, options, () -> function.apply(t));
  }

  @Override
  public void close() {
    state.close();
  }

  private RateLimiterConfig configFor(RequestOptions options) {
    return RateLimiterConfig.build(defaults, options);
  }

  static String gateKey(StateKey key, RequestOptions options) {
    var concurrencyKey = options.concurrencyKey();
    return concurrencyKey == null ? key.resource() : key.resource() + ":" + concurrencyKey;
  }

  private BudgetReservation reserveBudget(StateKey key, RequestOptions options, RateLimiterConfig config)
      throws InterruptedException {
    var estimated = options.estimatedTotalUnits();
    var decision = state.tryReserve(key, estimated, config.tokenBudgetPerWindow(), config.budgetSafetyMultiplier(),
        config.windowDuration());
    if (decision.isAllowed()) {
      return reserved(key, decision.reservation());
    }

    var exceeded = decision.exceeded();
    emitRejected(key, exceeded);
    if (exceeded.requestTooLarge()) {
      throw new RateLimitedException(null, RateLimitDetails.overBudget(exceeded));
    }
    if (config.nonBlocking()) {
      throw new RateLimitedException(exceeded.retryAt(), RateLimitDetails.overBudget(exceeded));
    }

    var retryAt = exceeded.retryAt();
    if (retryAt != null) {
      var wait = Duration.between(clock.instant(), retryAt);
      if (wait.isNegative()) {
        wait = Duration.ZERO;
      }
      var cap = config.maxBudgetWait();
      var capped = cap != null && wait.compareTo(cap) > 0;
      if (capped) {
        wait = cap;
      }
      emit(RateLimitEvent.of(RateLimitEvent.Type.BUDGET_WAIT, key, wait, "retryAt", retryAt, "capped", capped));
      if (!wait.isZero()) {
        sleeper.sleep(wait);
      }
    }

    var again = state.tryReserve(key, estimated, config.tokenBudgetPerWindow(), config.budgetSafetyMultiplier(),
        config.windowDuration());
    if (again.isAllowed()) {
      return reserved(key, again.reservation());
    }
    emitRejected(key, again.exceeded());
    throw new RateLimitedException(again.exceeded().retryAt(), RateLimitDetails.overBudget(again.exceeded()));
  }

  private BudgetReservation reserved(StateKey key, BudgetReservation reservation) {
    if (reservation.budget() != null) {
      emit(RateLimitEvent.of(RateLimitEvent.Type.BUDGET_RESERVED, key, null, "reservedUnits",
          reservation.reservedUnits(), "estimatedUnits", reservation.estimatedUnits(), "budget",
          reservation.budget()));
    }
    return reservation;
  }

  private void emitRejected(StateKey key, BudgetDecision.Exceeded exceeded) {
    emit(RateLimitEvent.of(RateLimitEvent.Type.BUDGET_REJECTED, key, null, "requestedUnits",
        exceeded.requestedUnits(), "budget", exceeded.budget(), "requestTooLarge", exceeded.requestTooLarge(),
        "retryAt", exceeded.retryAt()));
  }

  private void signal(String gateKey, RateLimiterConfig config, Outcome outcome) {
    switch (outcome) {
      case SUCCESS -> gate.signalSuccess(gateKey, config);
      case RATE_LIMITED -> gate.signalRateLimited(gateKey, config);
      default -> {
      }
    }
  }

  private <T> @Nullable TokenUsage usageOf(StateKey key, T result, UsageExtractor<? super T> extractor) {
    try {
      return extractor.extract(result);
    } catch (RuntimeException e) {
      log.warn("Unable to read usage from the result of a call on {}", key, e);
      return null;
    }
  }

  private void emitException(StateKey key, Instant started, Exception e) {
    emit(RateLimitEvent.of(RateLimitEvent.Type.REQUEST_EXCEPTION, key, elapsedSince(started), "reason",
        reason(e), "exception", e));
  }

  private static String reason(Exception e) {
    if (e instanceof RateLimitedException limited) {
      return limited.details.reason().name();
    }
    if (e instanceof PermitTimeoutException) {
      return "PERMIT_TIMEOUT";
    }
    if (e instanceof TransientFailureException) {
      return "TRANSIENT_FAILURE";
    }
    if (e instanceof InterruptedException) {
      return "INTERRUPTED";
    }
    return "PERMANENT";
  }

  private Duration elapsedSince(Instant started) {
    return Duration.between(started, clock.instant());
  }

  private static RateLimiterException interrupted(StateKey key, InterruptedException e) {
    Thread.currentThread().interrupt();
    return new RateLimiterException("Interrupted while rate limiting a call on " + key, e);
  }

  private void emit(RateLimitEvent event) {
    listener.onEvent(event);
  }

  public static final class Builder {
    private @Nullable RateLimiterConfig defaults;
    private @Nullable RateLimitState state;
    private @Nullable ConcurrencyGate gate;
    private RateLimitListener listener = new LoggingRateLimitListener();
    private InstantSource clock = Clock.systemUTC();
    private DoubleSupplier randomSource = new SecureRandom()::nextDouble;
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder() {
    }

    /**
     * Configuration for calls that don't override it. Defaults to
     * {@link RateLimiterConfig#load()}.
     */
    public Builder defaults(RateLimiterConfig defaults) {
      this.defaults = defaults;
      return this;
    }

    /**
     * A state store to share, perhaps with another manager. If not given, the
     * manager creates one on its clock.
     */
    public Builder state(RateLimitState state) {
      this.state = state;
      return this;
    }

    public Builder gate(ConcurrencyGate gate) {
      this.gate = gate;
      return this;
    }

    public Builder listener(RateLimitListener listener) {
      this.listener = listener;
      return this;
    }

    public Builder clock(InstantSource clock) {
      this.clock = clock;
      return this;
    }

    public Builder randomSource(DoubleSupplier randomSource) {
      this.randomSource = randomSource;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RateLimitManager build() {
      return new RateLimitManager(this);
    }
  }
}
