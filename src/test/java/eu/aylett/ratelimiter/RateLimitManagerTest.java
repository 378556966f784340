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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RateLimitManagerTest {
  private static final StateKey KEY = StateKey.of("model-a");
  private static final RequestOptions NON_BLOCKING = RequestOptions.builder().nonBlocking(true).build();

  private FakeTime time;
  private List<RateLimitEvent> events;
  private RateLimitManager manager;

  @BeforeEach
  void setUp() {
    time = new FakeTime();
    events = new CopyOnWriteArrayList<>();
    manager = manager(RateLimiterConfig.builder().maxConcurrencyPerKey(2).tokenBudgetPerWindow(1000L).build());
  }

  private RateLimitManager manager(RateLimiterConfig defaults) {
    return RateLimitManager.builder().defaults(defaults).clock(time).sleeper(time).randomSource(() -> 0.5)
        .listener(events::add).build();
  }

  private List<RateLimitEvent.Type> types() {
    return events.stream().map(RateLimitEvent::type).toList();
  }

  private static RequestOptions estimate(long units) {
    return RequestOptions.builder().estimatedInputUnits(units).build();
  }

  private static TransportException rateLimited(String delay) {
    return TransportException.http(429, Map.of("error", Map.of("code", 429, "status", "RESOURCE_EXHAUSTED",
        "details", List.of(Map.of("@type", RetryManager.RETRY_INFO_TYPE, "retryDelay", delay)))));
  }

  record Reply(String text, TokenUsage usage) implements ReportsUsage {
    @Override
    public TokenUsage reportedUsage() {
      return usage;
    }
  }

  @Test
  void rateLimitSetsAWindowThatLaterCallsWaitOut() throws Exception {
    assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
      throw rateLimited("5s");
    }));
    var window = manager.getRetryState(KEY);
    assertThat(window, is(notNullValue()));
    assertThat(window.retryUntil(), is(FakeTime.START.plusSeconds(5)));

    var calls = new AtomicInteger();
    var result = manager.checkedExecute(KEY, () -> {
      calls.incrementAndGet();
      return "ok";
    });
    assertThat(result, is("ok"));
    assertThat(calls.get(), is(1));
    assertThat(time.sleeps, contains(Duration.ofMillis(5625)));
  }

  @Test
  void nonBlockingCallsFailFastInsideAWindow() throws Exception {
    assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
      throw rateLimited("30s");
    }));
    var calls = new AtomicInteger();
    var e = assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
      calls.incrementAndGet();
      return "ok";
    }));
    assertThat(calls.get(), is(0));
    assertThat(time.sleeps, is(empty()));
    assertThat(e.retryAt, is(FakeTime.START.plusSeconds(30)));
    assertThat(e.details.reason(), is(RateLimitDetails.Reason.RETRY_WINDOW));
    // Permits and reservations are all given back
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    assertThat(manager.getUsage(KEY), is(UsageSnapshot.EMPTY));
  }

  @Test
  void transientFailuresGiveUpAfterMaxAttempts() {
    var calls = new AtomicInteger();
    var e = assertThrows(TransientFailureException.class, () -> manager.execute(KEY, () -> {
      calls.incrementAndGet();
      throw TransportException.http(503, "overloaded");
    }));
    assertThat(e.attempts, is(3));
    assertThat(calls.get(), is(3));
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    assertThat(types(), hasItems(RateLimitEvent.Type.REQUEST_START, RateLimitEvent.Type.REQUEST_EXCEPTION));
    assertThat(events.get(events.size() - 1).attribute("reason"), is("TRANSIENT_FAILURE"));
  }

  @Test
  void concurrentCallersShareTwoPermits() throws Exception {
    var realTime = RateLimitManager.builder()
        .defaults(RateLimiterConfig.builder().maxConcurrencyPerKey(2).tokenBudgetPerWindow(null).build())
        .listener(event -> {
        }).build();
    var started = new AtomicInteger();
    var inFlight = new AtomicInteger();
    var peak = new AtomicInteger();
    var release = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(5);
    try {
      var futures = new ArrayList<Future<String>>();
      for (var i = 0; i < 5; i++) {
        futures.add(executor.submit(() -> realTime.checkedExecute(KEY, () -> {
          started.incrementAndGet();
          peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
          try {
            release.await();
          } finally {
            inFlight.decrementAndGet();
          }
          return "done";
        })));
      }
      await().atMost(Duration.ofSeconds(5)).until(() -> started.get() == 2);
      await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> started.get() == 2);
      assertThat(realTime.availablePermits(KEY, RequestOptions.none()), is(0));

      release.countDown();
      for (var future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS), is("done"));
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(started.get(), is(5));
    assertThat(peak.get(), is(2));
    assertThat(realTime.availablePermits(KEY, RequestOptions.none()), is(2));
  }

  @Test
  void disabledCallsAreUntouched() {
    var disabled = RequestOptions.builder().disabled(true).build();
    assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
      throw rateLimited("30s");
    }));
    events.clear();

    var calls = new AtomicInteger();
    var failure = TransportException.http(503, null);
    var thrown = assertThrows(TransportException.class, () -> manager.checkedExecute(KEY, disabled, () -> {
      calls.incrementAndGet();
      throw failure;
    }));
    assertThat(thrown, is(sameInstance(failure)));
    assertThat(calls.get(), is(1));
    assertThat(manager.execute(KEY, disabled, () -> "verbatim"), is("verbatim"));
    assertThat(time.sleeps, is(empty()));
    assertThat(events, is(empty()));
  }

  @Test
  void permanentFailuresPropagateOnce() {
    var calls = new AtomicInteger();
    assertThrows(IllegalArgumentException.class, () -> manager.execute(KEY, estimate(100), () -> {
      calls.incrementAndGet();
      throw new IllegalArgumentException("400 Bad Request");
    }));
    assertThat(calls.get(), is(1));
    assertThat(manager.getUsage(KEY), is(UsageSnapshot.EMPTY));
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
  }

  @Test
  void successfulCallEmitsStartAndStop() {
    manager.execute(KEY, () -> "ok");
    assertThat(types(), contains(RateLimitEvent.Type.REQUEST_START, RateLimitEvent.Type.BUDGET_RESERVED,
        RateLimitEvent.Type.REQUEST_STOP));
    assertThat(events.get(2).duration(), is(Duration.ZERO));
    assertThat(events.get(2).attribute("status"), is("ok"));
  }

  @Test
  void reservationIsReconciledWithReportedUsage() {
    var reply = manager.execute(KEY, estimate(500), () -> new Reply("hi", new TokenUsage(100, 20)));
    assertThat(reply.text(), is("hi"));
    var usage = manager.getUsage(KEY);
    assertThat(usage.usedUnits(), is(120L));
    assertThat(usage.reservedUnits(), is(0L));
    assertThat(types(), contains(RateLimitEvent.Type.REQUEST_START, RateLimitEvent.Type.BUDGET_RESERVED,
        RateLimitEvent.Type.REQUEST_STOP));
  }

  @Test
  void usageMetadataIsReadFromDecodedResponses() {
    Supplier<Map<String, Object>> call = () -> Map.of("candidates", List.of(), "usageMetadata",
        Map.of("promptTokenCount", 40, "cachedContentTokenCount", 10, "candidatesTokenCount", 25));
    manager.execute(KEY, call);
    assertThat(manager.getUsage(KEY).usedUnits(), is(75L));
  }

  @Test
  void usageTrackingWorksWhenDisabled() throws Exception {
    var disabled = RequestOptions.builder().disabled(true).build();
    manager.executeWithUsageTracking(KEY, disabled, () -> "text", result -> new TokenUsage(7, 3));
    assertThat(manager.getUsage(KEY).usedUnits(), is(10L));
  }

  @Test
  void nonBlockingOverBudgetFailsFast() throws Exception {
    manager.executeWithUsageTracking(KEY, estimate(100), () -> "first", result -> new TokenUsage(900, 0));
    var calls = new AtomicInteger();
    var options = RequestOptions.builder().nonBlocking(true).estimatedInputUnits(150).estimatedCachedUnits(50)
        .build();
    var e = assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, options, () -> {
      calls.incrementAndGet();
      return "second";
    }));
    assertThat(calls.get(), is(0));
    assertThat(e.details.reason(), is(RateLimitDetails.Reason.OVER_BUDGET));
    assertThat(e.details.budget().requestedUnits(), is(200L));
    assertThat(e.retryAt, is(FakeTime.START.plusSeconds(60)));
    assertThat(types(), hasItems(RateLimitEvent.Type.BUDGET_REJECTED));
  }

  @Test
  void oversizedRequestsAreRefusedOutright() {
    var e = assertThrows(RateLimitedException.class, () -> manager.execute(KEY, estimate(5000), () -> "never"));
    assertThat(e.retryAt, is(nullValue()));
    assertThat(e.details.budget().requestTooLarge(), is(true));
    assertThat(time.sleeps, is(empty()));
  }

  @Test
  void blockingCallsWaitForBudget() throws Exception {
    manager.executeWithUsageTracking(KEY, estimate(100), () -> "first", result -> new TokenUsage(900, 0));
    time.advance(Duration.ofSeconds(10));

    assertThat(manager.execute(KEY, estimate(200), () -> "second"), is("second"));
    assertThat(time.sleeps, contains(Duration.ofSeconds(50)));
    assertThat(types(), hasItems(RateLimitEvent.Type.BUDGET_REJECTED, RateLimitEvent.Type.BUDGET_WAIT));
  }

  @Test
  void budgetWaitsAreCapped() throws Exception {
    var capped = manager(RateLimiterConfig.builder().tokenBudgetPerWindow(1000L).maxBudgetWait(Duration.ofSeconds(10))
        .build());
    capped.executeWithUsageTracking(KEY, estimate(100), () -> "first", result -> new TokenUsage(900, 0));

    var e = assertThrows(RateLimitedException.class, () -> capped.execute(KEY, estimate(200), () -> "second"));
    assertThat(time.sleeps, contains(Duration.ofSeconds(10)));
    assertThat(e.retryAt, is(FakeTime.START.plusSeconds(60)));
    var wait = events.stream().filter(event -> event.type() == RateLimitEvent.Type.BUDGET_WAIT).findFirst()
        .orElseThrow();
    assertThat(wait.attribute("capped"), is(true));
  }

  @Test
  void streamHoldsItsPermitUntilReleased() throws Exception {
    var handle = manager.executeStreaming(KEY, estimate(100), () -> "stream");
    assertThat(handle.value(), is("stream"));
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(1));
    assertThat(manager.getUsage(KEY).reservedUnits(), is(100L));

    assertThat(handle.release(StreamOutcome.COMPLETED, new TokenUsage(30, 50)), is(true));
    assertThat(handle.release(StreamOutcome.ERROR, null), is(false));
    handle.close();

    assertThat(handle.isReleased(), is(true));
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    assertThat(manager.getUsage(KEY).usedUnits(), is(80L));
    assertThat(manager.getUsage(KEY).reservedUnits(), is(0L));
    assertThat(types(), contains(RateLimitEvent.Type.BUDGET_RESERVED, RateLimitEvent.Type.STREAM_STARTED,
        RateLimitEvent.Type.STREAM_COMPLETED));
  }

  @Test
  void closingAnUnreleasedStreamCancelsIt() throws Exception {
    try (var handle = manager.executeStreaming(KEY, RequestOptions.none(), () -> "stream")) {
      assertThat(handle.isReleased(), is(false));
    }
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    assertThat(types(), contains(RateLimitEvent.Type.BUDGET_RESERVED, RateLimitEvent.Type.STREAM_STARTED,
        RateLimitEvent.Type.STREAM_CANCELLED));
  }

  @Test
  void failedStartReleasesEverything() {
    assertThrows(IOException.class, () -> manager.executeStreaming(KEY, estimate(100), () -> {
      throw new IOException("connection refused");
    }));
    assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    assertThat(manager.getUsage(KEY), is(UsageSnapshot.EMPTY));
    assertThat(types(), contains(RateLimitEvent.Type.BUDGET_RESERVED, RateLimitEvent.Type.STREAM_ERROR));
  }

  @Test
  void streamsAreRefusedWhenPermitsRunOut() throws Exception {
    var single = RequestOptions.builder().maxConcurrencyPerKey(1).nonBlocking(true).estimatedInputUnits(10).build();
    try (var ignored = manager.executeStreaming(KEY, single, () -> "first")) {
      var e = assertThrows(RateLimitedException.class, () -> manager.executeStreaming(KEY, single, () -> "second"));
      assertThat(e.details.reason(), is(RateLimitDetails.Reason.NO_PERMITS));
      assertThat(manager.getUsage(KEY).reservedUnits(), is(10L));
    }
  }

  @Test
  void concurrencyKeysNarrowThePool() throws Exception {
    var tenant1 = RequestOptions.builder().maxConcurrencyPerKey(1).concurrencyKey("tenant-1").build();
    var tenant2 = RequestOptions.builder().maxConcurrencyPerKey(1).concurrencyKey("tenant-2").build();
    try (var ignored = manager.executeStreaming(KEY, tenant1, () -> "stream")) {
      assertThat(manager.availablePermits(KEY, tenant1), is(0));
      assertThat(manager.availablePermits(KEY, tenant2), is(1));
      assertThat(manager.availablePermits(KEY, RequestOptions.none()), is(2));
    }
    assertThat(RateLimitManager.gateKey(KEY, tenant1), is("model-a:tenant-1"));
  }

  @Test
  void checkStatusReportsWhatWouldHappen() throws Exception {
    assertThat(manager.checkStatus(KEY).isOk(), is(true));

    manager.executeWithUsageTracking(KEY, RequestOptions.none(), () -> "x", result -> new TokenUsage(950, 0));
    var overBudget = manager.checkStatus(KEY, estimate(100));
    assertThat(overBudget.kind(), is(RateLimitStatus.Kind.OVER_BUDGET));
    assertThat(overBudget.usage().usedUnits(), is(950L));
    assertThat(overBudget.retryAt(), is(FakeTime.START.plusSeconds(60)));

    var single = RequestOptions.builder().maxConcurrencyPerKey(1).estimatedInputUnits(100).build();
    try (var ignored = manager.executeStreaming(KEY, RequestOptions.builder().maxConcurrencyPerKey(1).build(),
        () -> "stream")) {
      assertThat(manager.checkStatus(KEY, single).kind(), is(RateLimitStatus.Kind.NO_PERMITS));

      assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
        throw rateLimited("20s");
      }));
      var limited = manager.checkStatus(KEY, single);
      assertThat(limited.kind(), is(RateLimitStatus.Kind.RATE_LIMITED));
      assertThat(limited.retryAt(), is(FakeTime.START.plusSeconds(20)));
    }

    assertThat(manager.checkStatus(KEY, RequestOptions.builder().disabled(true).build()).isOk(), is(true));
    // Nothing above was charged by checking
    assertThat(manager.getUsage(KEY).totalUnits(), is(950L));
  }

  @Test
  void rateLimitsLowerAdaptiveConcurrency() {
    var adaptive = RequestOptions.builder().maxConcurrencyPerKey(4).adaptiveConcurrency(true).nonBlocking(true)
        .build();
    assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, adaptive, () -> {
      throw rateLimited("1s");
    }));
    assertThat(manager.availablePermits(KEY, adaptive), is(3));
  }

  @Test
  void interruptedWaitsAreReported() throws Exception {
    var single = RequestOptions.builder().maxConcurrencyPerKey(1).estimatedInputUnits(10).build();
    try (var ignored = manager.executeStreaming(KEY, single, () -> "stream")) {
      Thread.currentThread().interrupt();
      var e = assertThrows(RateLimiterException.class, () -> manager.execute(KEY, single, () -> "never"));
      assertThat(e.getCause(), is(notNullValue()));
      assertThat(Thread.interrupted(), is(true));
      assertThat(manager.getUsage(KEY).reservedUnits(), is(10L));
    }
  }

  @Test
  void throwingListenersAreIgnored() {
    var noisy = RateLimitManager.builder().defaults(RateLimiterConfig.defaults()).clock(time).sleeper(time)
        .listener(event -> {
          throw new IllegalStateException("listener bug");
        }).build();
    assertThat(noisy.execute(KEY, () -> "ok"), is("ok"));
  }

  @Test
  void resetAllForgetsEverything() throws Exception {
    assertThrows(RateLimitedException.class, () -> manager.checkedExecute(KEY, NON_BLOCKING, () -> {
      throw rateLimited("30s");
    }));
    manager.executeWithUsageTracking(KEY, RequestOptions.none(), () -> "x", result -> new TokenUsage(5, 5));
    manager.resetAll();
    assertThat(manager.getRetryState(KEY), is(nullValue()));
    assertThat(manager.getUsage(KEY), is(UsageSnapshot.EMPTY));
  }

  @Test
  void closedManagerRefusesCalls() {
    manager.close();
    assertThrows(IllegalStateException.class, () -> manager.execute(KEY, () -> "late"));
  }

  @Test
  void wrappedSuppliersAndFunctionsAreLimited() {
    Supplier<String> original = () -> "wrapped";
    var wrapped = manager.wrap(KEY, RequestOptions.none(), original);
    assertThat(wrapped, is(not(sameInstance(original))));
    assertThat(wrapped.get(), is("wrapped"));

    Function<Integer, String> function = i -> "wrapped" + i;
    assertThat(manager.wrap(KEY, RequestOptions.none(), function).apply(1), is("wrapped1"));

    var counter = new int[]{0};
    manager.wrap(KEY, RequestOptions.none(), (Runnable) () -> counter[0]++).run();
    assertThat(counter[0], is(1));
    assertThat(types().stream().filter(type -> type == RateLimitEvent.Type.REQUEST_STOP).count(), is(3L));
  }
}
