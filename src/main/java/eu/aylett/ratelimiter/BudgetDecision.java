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

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of trying to fit a call's estimated usage into its key's budget:
 * either a reservation, or the reason it didn't fit.
 */
public final class BudgetDecision {
  private final @Nullable BudgetReservation reservation;
  private final @Nullable Exceeded exceeded;

  private BudgetDecision(@Nullable BudgetReservation reservation, @Nullable Exceeded exceeded) {
    this.reservation = reservation;
    this.exceeded = exceeded;
  }

  static BudgetDecision allow(BudgetReservation reservation) {
    return new BudgetDecision(reservation, null);
  }

  static BudgetDecision reject(Exceeded exceeded) {
    return new BudgetDecision(null, exceeded);
  }

  public boolean isAllowed() {
    return reservation != null;
  }

  /**
   * @throws IllegalStateException
   *           if the budget was exceeded
   */
  public BudgetReservation reservation() {
    if (reservation == null) {
      throw new IllegalStateException("Budget was exceeded; there is no reservation");
    }
    return reservation;
  }

  /**
   * @throws IllegalStateException
   *           if the reservation succeeded
   */
  public Exceeded exceeded() {
    if (exceeded == null) {
      throw new IllegalStateException("Budget was not exceeded");
    }
    return exceeded;
  }

  /**
   * Why a call's usage didn't fit.
   *
   * @param estimatedUnits
   *          the call's own estimate
   * @param requestedUnits
   *          the estimate after the safety multiplier
   * @param budget
   *          units allowed per window
   * @param requestTooLarge
   *          the call would not fit even into an empty window
   * @param usage
   *          the window as it stood when the call was refused
   * @param retryAt
   *          when enough usage expires for the call to fit; {@code null} if it
   *          never will
   */
  public record Exceeded(long estimatedUnits, long requestedUnits, long budget, boolean requestTooLarge,
      UsageSnapshot usage, @Nullable Instant retryAt) {
    public Exceeded {
      Objects.requireNonNull(usage, "usage");
    }
  }
}
