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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Objects;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Units charged to a usage window, either consumed or merely reserved, that
 * stop counting once the window's horizon has passed.
 */
final class UsageEntry implements Delayed {
  public final long units;
  public final boolean reservation;
  public final Instant recordedAt;
  private final InstantSource clock;
  private final Instant expiry;

  UsageEntry(long units, boolean reservation, Duration horizon, InstantSource clock) {
    this.units = units;
    this.reservation = reservation;
    this.clock = clock;
    this.recordedAt = clock.instant();
    this.expiry = recordedAt.plus(horizon);
  }

  Instant expiry() {
    return expiry;
  }

  @Override
  public long getDelay(TimeUnit unit) {
    return clock.instant().until(expiry, unit.toChronoUnit());
  }

  @Override
  public int compareTo(Delayed o) {
    if (o instanceof UsageEntry other) {
      return expiry.compareTo(other.expiry);
    }
    return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof UsageEntry that) {
      return units == that.units && reservation == that.reservation && Objects.equals(expiry, that.expiry);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(units, reservation, expiry);
  }
}
