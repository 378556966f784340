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

/**
 * Units held against a key's budget on behalf of a call that hasn't reported
 * its real usage yet. Hand it back to {@link RateLimitState#reconcile} or
 * {@link RateLimitState#releaseReservation} exactly once.
 */
public final class BudgetReservation {
  private final long estimatedUnits;
  private final long reservedUnits;
  private final @Nullable Long budget;
  final @Nullable UsageEntry entry;

  BudgetReservation(long estimatedUnits, long reservedUnits, @Nullable Long budget, @Nullable UsageEntry entry) {
    this.estimatedUnits = estimatedUnits;
    this.reservedUnits = reservedUnits;
    this.budget = budget;
    this.entry = entry;
  }

  public long estimatedUnits() {
    return estimatedUnits;
  }

  /**
   * The estimate after the safety multiplier was applied.
   */
  public long reservedUnits() {
    return reservedUnits;
  }

  public @Nullable Long budget() {
    return budget;
  }

  @Override
  public String toString() {
    return "BudgetReservation{estimatedUnits=" + estimatedUnits + ", reservedUnits=" + reservedUnits + ", budget="
        + budget + "}";
  }
}
