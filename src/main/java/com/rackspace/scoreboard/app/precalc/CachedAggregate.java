/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.scoreboard.app.precalc;

import java.time.Instant;
import lombok.Data;

/**
 * A derived view stored in the cache together with the time it was computed.
 */
@Data
public class CachedAggregate<T> {
  String cacheKey;
  AggregateCategory category;
  String targetId;
  T payload;
  Instant lastUpdated;
  /**
   * Set on read when <code>lastUpdated</code> is older than the category's update interval
   * plus one processing cycle.
   */
  boolean stale;
}
