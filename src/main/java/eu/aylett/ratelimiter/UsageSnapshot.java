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

/**
 * Usage currently inside a key's sliding window.
 *
 * @param usedUnits
 *          units actually consumed
 * @param reservedUnits
 *          units held by calls that haven't finished yet
 * @param windowStart
 *          when the oldest entry still counted was recorded, or {@code null}
 *          if the window is empty
 * @param windowEnd
 *          when the newest entry stops counting, or {@code null} if the
 *          window is empty
 */
public record UsageSnapshot(long usedUnits, long reservedUnits, @Nullable Instant windowStart,
    @Nullable Instant windowEnd) {

  public static final UsageSnapshot EMPTY = new UsageSnapshot(0, 0, null, null);

  public long totalUnits() {
    return usedUnits + reservedUnits;
  }
}
