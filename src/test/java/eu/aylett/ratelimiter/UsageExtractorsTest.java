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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UsageExtractorsTest {
  @Test
  void readsCamelCaseMetadata() {
    var response = Map.of("usageMetadata",
        Map.of("promptTokenCount", 120, "cachedContentTokenCount", 30L, "candidatesTokenCount", 45));
    assertThat(UsageExtractors.usageMetadata().extract(response), is(new TokenUsage(150, 45)));
  }

  @Test
  void readsSnakeCaseMetadata() {
    var response = Map.of("usage_metadata", Map.of("prompt_token_count", 10, "candidates_token_count", 5));
    assertThat(UsageExtractors.usageMetadata().extract(response), is(new TokenUsage(10, 5)));
  }

  @Test
  void missingCountsAreZero() {
    var response = Map.of("usageMetadata", Map.of("totalTokenCount", 99, "promptTokenCount", "lots"));
    assertThat(UsageExtractors.usageMetadata().extract(response), is(TokenUsage.NONE));
  }

  @Test
  void anythingElseHasNoUsage() {
    assertThat(UsageExtractors.usageMetadata().extract("text"), is(nullValue()));
    assertThat(UsageExtractors.usageMetadata().extract(List.of()), is(nullValue()));
    assertThat(UsageExtractors.usageMetadata().extract(Map.of("candidates", List.of())), is(nullValue()));
  }

  @Test
  void standardPrefersReportedUsage() {
    ReportsUsage reply = () -> new TokenUsage(1, 2);
    assertThat(UsageExtractors.standard().extract(reply), is(new TokenUsage(1, 2)));
    assertThat(UsageExtractors.standard().extract(Map.of("usageMetadata", Map.of("candidatesTokenCount", 4))),
        is(new TokenUsage(0, 4)));
  }

  @Test
  void usageIsNeverNegative() {
    assertThrows(IllegalArgumentException.class, () -> new TokenUsage(-1, 0));
    assertThat(new TokenUsage(3, 4).totalUnits(), is(7L));
  }
}
