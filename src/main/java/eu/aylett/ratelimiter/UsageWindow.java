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

import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.concurrent.DelayQueue;

/**
 * Sliding log of usage for one key. Not thread-safe on its own: callers hold
 * the key's lock.
 */
final class UsageWindow {
  private final DelayQueue<UsageEntry> queue = new DelayQueue<>();
  private long usedUnits;
  private long reservedUnits;

  private void prune() {
    UsageEntry old;
    while ((old = queue.poll()) != null) {
      if (old.reservation) {
        reservedUnits -= old.units;
      } else {
        usedUnits -= old.units;
      }
    }
    // Should hold by construction.
    assert usedUnits >= 0;
    assert reservedUnits >= 0;
  }

  void record(long units, Duration horizon, InstantSource clock) {
    prune();
    if (units <= 0) {
      return;
    }
    queue.offer(new UsageEntry(units, false, horizon, clock));
    usedUnits += units;
  }

  @Nullable
  UsageEntry reserve(long units, Duration horizon, InstantSource clock) {
    prune();
    if (units <= 0) {
      return null;
    }
    var entry = new UsageEntry(units, true, horizon, clock);
    queue.offer(entry);
    reservedUnits += units;
    return entry;
  }

  /**
   * Drops a reservation. A reservation that has already expired out of the
   * window is not counted twice.
   */
  void cancel(UsageEntry reservation) {
    prune();
    if (queue.remove(reservation)) {
      reservedUnits -= reservation.units;
    }
  }

  long committedUnits() {
    prune();
    return usedUnits + reservedUnits;
  }

  UsageSnapshot snapshot() {
    prune();
    Instant start = null;
    Instant end = null;
    for (var entry : queue) {
      if (start == null || entry.recordedAt.isBefore(start)) {
        start = entry.recordedAt;
      }
      if (end == null || entry.expiry().isAfter(end)) {
        end = entry.expiry();
      }
    }
    return new UsageSnapshot(usedUnits, reservedUnits, start, end);
  }

  /**
   * The earliest instant at which enough entries will have expired for
   * {@code units} more to fit under {@code budget}.
   */
  Instant whenFits(long units, long budget, Instant now) {
    prune();
    var excess = usedUnits + reservedUnits + units - budget;
    if (excess <= 0) {
      return now;
    }
    var entries = new ArrayList<>(queue);
    entries.sort(Comparator.comparing(UsageEntry::expiry));
    var freed = 0L;
    for (var entry : entries) {
      freed += entry.units;
      if (freed >= excess) {
        return entry.expiry();
      }
    }
    // Only reachable when the request alone exceeds the budget
    return entries.isEmpty() ? now : entries.get(entries.size() - 1).expiry();
  }
}
