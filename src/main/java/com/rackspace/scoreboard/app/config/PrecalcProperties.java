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

package com.rackspace.scoreboard.app.config;

import com.rackspace.scoreboard.app.precalc.AggregateCategory;
import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("scoreboard.precalc")
@Component
@Data
@Validated
public class PrecalcProperties {

  /**
   * The amount of time to wait after startup before the first recompute of each category.
   */
  @NotNull
  Duration initialDelay = Duration.ofSeconds(30);

  /**
   * Allowance for one processing cycle. A cached aggregate older than its category's
   * update interval plus this slack is reported as stale.
   */
  @NotNull
  Duration cycleSlack = Duration.ofMinutes(5);

  /**
   * Number of most recent results included in a student summary.
   */
  @Min(1)
  int studentWindow = 20;

  /**
   * Number of most recent completed results used for the improvement trend, split into a
   * recent half and an older half.
   */
  @Min(2)
  int trendWindow = 10;

  /**
   * Minimum number of results required in each half before a trend other than stable
   * is reported.
   */
  @Min(1)
  int trendMinimumPerHalf = 3;

  /**
   * Percentage points the recent half must differ from the older half to count as a trend.
   */
  double trendDeadband = 5.0;

  @Min(0)
  int recentActivityCount = 5;

  @Valid
  @NotNull
  Category examStats = new Category(Duration.ofMinutes(30), 10, Duration.ofHours(24));

  @Valid
  @NotNull
  Category studentSummaries = new Category(Duration.ofMinutes(60), 20, Duration.ofDays(30));

  @Valid
  @NotNull
  Category classRankings = new Category(Duration.ofMinutes(15), 5, Duration.ofHours(24));

  @Valid
  @NotNull
  Category subjectAnalytics = new Category(Duration.ofMinutes(45), 15, Duration.ofHours(24));

  public Category settingsFor(AggregateCategory category) {
    switch (category) {
      case EXAM_STATS:
        return examStats;
      case STUDENT_SUMMARIES:
        return studentSummaries;
      case CLASS_RANKINGS:
        return classRankings;
      case SUBJECT_ANALYTICS:
        return subjectAnalytics;
      default:
        throw new IllegalArgumentException("Unknown aggregate category " + category);
    }
  }

  /**
   * Maximum age at which a cached aggregate of the category is still treated as fresh.
   */
  public Duration freshnessWindow(AggregateCategory category) {
    return settingsFor(category).getUpdateInterval().plus(cycleSlack);
  }

  @Data
  public static class Category {

    boolean enabled = true;

    @NotNull
    Duration updateInterval;

    /**
     * Maximum number of active targets recomputed per tick.
     */
    @Min(1)
    int batchSize;

    /**
     * Targets with activity inside this window are considered active.
     */
    @NotNull
    Duration lookback;

    /**
     * Expiration of cached aggregates. When not set, twice the update interval is used.
     */
    Duration ttl;

    public Category() {
    }

    Category(Duration updateInterval, int batchSize, Duration lookback) {
      this.updateInterval = updateInterval;
      this.batchSize = batchSize;
      this.lookback = lookback;
    }

    public Duration effectiveTtl() {
      return ttl != null ? ttl : updateInterval.multipliedBy(2);
    }
  }
}
