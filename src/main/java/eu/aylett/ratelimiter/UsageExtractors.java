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

import java.util.Map;

/**
 * Stock {@link UsageExtractor}s.
 */
public final class UsageExtractors {
  private UsageExtractors() {
  }

  /**
   * Reads a decoded JSON response's {@code usageMetadata} (or
   * {@code usage_metadata}) block: input is
   * {@code promptTokenCount + cachedContentTokenCount}, output is
   * {@code candidatesTokenCount}.
   */
  public static UsageExtractor<Object> usageMetadata() {
    return UsageExtractors::fromUsageMetadata;
  }

  /**
   * Asks results that implement {@link ReportsUsage}, and falls back to
   * {@link #usageMetadata()} for maps.
   */
  public static UsageExtractor<Object> standard() {
    return result -> {
      if (result instanceof ReportsUsage reports) {
        return reports.reportedUsage();
      }
      return fromUsageMetadata(result);
    };
  }

  private static @Nullable TokenUsage fromUsageMetadata(@Nullable Object result) {
    if (!(result instanceof Map<?, ?> response)) {
      return null;
    }
    if (response.get("usageMetadata") instanceof Map<?, ?> metadata) {
      return new TokenUsage(count(metadata, "promptTokenCount") + count(metadata, "cachedContentTokenCount"),
          count(metadata, "candidatesTokenCount"));
    }
    if (response.get("usage_metadata") instanceof Map<?, ?> metadata) {
      return new TokenUsage(count(metadata, "prompt_token_count") + count(metadata, "cached_content_token_count"),
          count(metadata, "candidates_token_count"));
    }
    return null;
  }

  private static long count(Map<?, ?> metadata, String field) {
    if (metadata.get(field) instanceof Number number) {
      return Math.max(0, number.longValue());
    }
    return 0;
  }
}
