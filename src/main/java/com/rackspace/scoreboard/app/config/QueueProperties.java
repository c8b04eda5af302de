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

import com.rackspace.scoreboard.app.model.JobType;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("scoreboard.queue")
@Component
@Data
@Validated
public class QueueProperties {

  /**
   * When disabled, this instance only enqueues and reports on jobs and never claims them.
   */
  boolean workersEnabled = true;

  /**
   * Number of workers polling the job lanes. Each worker processes one job at a time.
   */
  @Min(1)
  int workers = 4;

  /**
   * How long an idle worker waits before polling the lanes again.
   */
  @NotNull
  Duration pollInterval = Duration.ofMillis(250);

  /**
   * How long a worker waits before polling again after the job store itself failed.
   */
  @NotNull
  Duration errorBackoff = Duration.ofSeconds(5);

  /**
   * Per job-type retry ceiling. Types not listed use <code>default-max-retries</code>.
   */
  Map<JobType, Integer> maxRetries = defaultMaxRetries();

  @Min(0)
  int defaultMaxRetries = 3;

  /**
   * A submission batch job record is rewritten with its progress after this many items.
   */
  @Min(1)
  int progressUpdateInterval = 10;

  @Valid
  @NotNull
  Backoff backoff = new Backoff();

  public int maxRetriesFor(JobType type) {
    return maxRetries.getOrDefault(type, defaultMaxRetries);
  }

  private static Map<JobType, Integer> defaultMaxRetries() {
    final Map<JobType, Integer> defaults = new EnumMap<>(JobType.class);
    defaults.put(JobType.SUBMISSION_BATCH, 3);
    defaults.put(JobType.RESULT_CALCULATION, 3);
    defaults.put(JobType.RANKING_UPDATE, 2);
    defaults.put(JobType.ANALYTICS_REFRESH, 2);
    return defaults;
  }

  @Data
  public static class Backoff {

    /**
     * Delay before the first retry of a failed job.
     */
    @NotNull
    Duration initial = Duration.ofMinutes(1);

    @DecimalMin("1.0")
    double multiplier = 2.0;

    @NotNull
    Duration max = Duration.ofMinutes(15);

    /**
     * Computes the delay before the given retry, where <code>retryCount</code> starts at 1.
     * The result never decreases as <code>retryCount</code> grows.
     */
    public Duration delayFor(int retryCount) {
      final double factor = Math.pow(multiplier, Math.max(0, retryCount - 1));
      final double millis = initial.toMillis() * factor;
      if (millis >= max.toMillis()) {
        return max;
      }
      return Duration.ofMillis((long) millis);
    }
  }
}
