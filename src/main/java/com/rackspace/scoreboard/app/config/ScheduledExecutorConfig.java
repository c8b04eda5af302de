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
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScheduledExecutorConfig {

  private final QueueProperties queueProperties;

  public ScheduledExecutorConfig(QueueProperties queueProperties) {
    this.queueProperties = queueProperties;
  }

  /**
   * Shared by the job workers, one timer per aggregate category, and the retention sweep.
   */
  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService scheduledExecutorService() {
    return Executors.newScheduledThreadPool(
        queueProperties.getWorkers() + AggregateCategory.values().length + 1);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
