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

import java.util.Objects;

/**
 * Identifies one rate-limit partition: the resource being called (a model, an
 * endpoint), where it is served from, and which quota metric is tracked.
 *
 * @param resource
 *          the remote resource, also the default permit pool
 * @param location
 *          region or other serving location
 * @param metric
 *          the quota metric tracked for this partition
 */
public record StateKey(String resource, String location, String metric) {
  public static final String DEFAULT_LOCATION = "global";
  public static final String DEFAULT_METRIC = "tokens";

  public StateKey {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(metric, "metric");
  }

  public static StateKey of(String resource) {
    return new StateKey(resource, DEFAULT_LOCATION, DEFAULT_METRIC);
  }

  public static StateKey of(String resource, String location) {
    return new StateKey(resource, location, DEFAULT_METRIC);
  }

  @Override
  public String toString() {
    return resource + "@" + location + "/" + metric;
  }
}
