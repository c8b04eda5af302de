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

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("scoreboard")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Expiration applied to the record of a completed or failed job. A record that outlives its
   * retention sweep is still removed by Redis once this elapses. Queued and processing records
   * never expire.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration jobRecordTtl = Duration.ofHours(24);

  /**
   * Terminal jobs created before <code>now - terminal-job-retention</code> are deleted by the
   * retention sweep.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration terminalJobRetention = Duration.ofHours(24);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration retentionSweepInterval = Duration.ofHours(1);

  /**
   * Maximum number of terminal jobs deleted by one pass of the retention sweep.
   */
  @Min(1)
  int retentionSweepLimit = 1000;

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration rankingCacheTtl = Duration.ofMinutes(30);

  @Min(0)
  long examCacheSize = 10000;

  @NotNull
  Duration examCacheTtl = Duration.ofMinutes(10);

  @Min(0)
  long participantCacheSize = 100000;

  @NotNull
  Duration participantCacheTtl = Duration.ofHours(1);

  @NotNull
  RetrySpec retryInsertResult = new RetrySpec()
      .setMaxAttempts(5)
      .setMinBackoff(Duration.ofMillis(100));

  @NotNull
  RetrySpec retryQueryResults = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(100));

  @NotNull
  RetrySpec retryInsertCatalog = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(100));
}
