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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One slot in a key's concurrency pool. Releasing is idempotent, so it is
 * safe to use in try-with-resources and release early as well.
 */
public final class Permit implements AutoCloseable {
  private static final Permit UNGATED = new Permit("", null);

  private final String key;
  private final ConcurrencyGate.@Nullable Pool pool;
  private final AtomicBoolean released = new AtomicBoolean();

  Permit(String key, ConcurrencyGate.@Nullable Pool pool) {
    this.key = key;
    this.pool = pool;
  }

  /**
   * A permit that holds nothing, for calls made with gating turned off.
   */
  static Permit ungated() {
    return UNGATED;
  }

  public String key() {
    return key;
  }

  /**
   * Gives the slot back. Only the first call has any effect.
   *
   * @return whether this call released the slot
   */
  public boolean release() {
    if (pool == null || !released.compareAndSet(false, true)) {
      return false;
    }
    pool.release();
    return true;
  }

  public boolean isReleased() {
    return pool == null || released.get();
  }

  @Override
  public void close() {
    release();
  }
}
