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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * A started stream, still holding its concurrency permit and budget
 * reservation.
 * <p>
 * The holder must call {@link #release} once, when the stream ends. Only the
 * first call has any effect. Closing a handle that hasn't been released
 * releases it as {@link StreamOutcome#CANCELLED}, so try-with-resources is
 * enough to avoid leaking the permit.
 * </p>
 */
public final class StreamingHandle<T> implements AutoCloseable {
  private final T value;
  private final Lease lease;

  StreamingHandle(T value, Lease lease) {
    this.value = value;
    this.lease = lease;
  }

  /**
   * Whatever the {@link StreamStarter} returned.
   */
  public T value() {
    return value;
  }

  /**
   * Gives back the permit and settles the reservation: charged with
   * {@code usage} if given, otherwise dropped.
   *
   * @return {@code true} if this call did the release
   */
  public boolean release(StreamOutcome outcome, @Nullable TokenUsage usage) {
    return lease.release(outcome, usage);
  }

  public boolean isReleased() {
    return lease.isReleased();
  }

  @Override
  public void close() {
    lease.release(StreamOutcome.CANCELLED, null);
  }

  /**
   * The release obligation itself, which exists before the stream has started.
   */
  static final class Lease {
    private static final Logger log = LoggerFactory.getLogger(Lease.class);

    private final StateKey key;
    private final BiConsumer<StreamOutcome, @Nullable TokenUsage> action;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Lease(StateKey key, BiConsumer<StreamOutcome, @Nullable TokenUsage> action) {
      this.key = key;
      this.action = action;
    }

    boolean release(StreamOutcome outcome, @Nullable TokenUsage usage) {
      if (!released.compareAndSet(false, true)) {
        log.debug("Ignoring {} for stream on {}: already released", outcome, key);
        return false;
      }
      action.accept(outcome, usage);
      return true;
    }

    boolean isReleased() {
      return released.get();
    }
  }
}
