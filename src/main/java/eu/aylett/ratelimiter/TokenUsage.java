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

/**
 * Units a call actually consumed.
 *
 * @param inputUnits
 *          units sent, including any cached context
 * @param outputUnits
 *          units generated
 */
public record TokenUsage(long inputUnits, long outputUnits) {
  public static final TokenUsage NONE = new TokenUsage(0, 0);

  public TokenUsage {
    if (inputUnits < 0 || outputUnits < 0) {
      throw new IllegalArgumentException("usage must not be negative");
    }
  }

  public long totalUnits() {
    return inputUnits + outputUnits;
  }
}
