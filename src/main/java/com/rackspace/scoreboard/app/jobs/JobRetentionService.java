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

package com.rackspace.scoreboard.app.jobs;

import com.rackspace.scoreboard.app.config.AppProperties;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Periodically deletes completed and failed jobs once they are older than the retention
 * period. Queued and processing jobs are never touched.
 */
@Service
@Slf4j
public class JobRetentionService {

  private final JobQueueService jobQueueService;
  private final AppProperties appProperties;
  private final ScheduledExecutorService executor;

  @Autowired
  public JobRetentionService(JobQueueService jobQueueService,
                             AppProperties appProperties,
                             ScheduledExecutorService executor) {
    this.jobQueueService = jobQueueService;
    this.appProperties = appProperties;
    this.executor = executor;
  }

  @PostConstruct
  public void setupSchedulers() {
    final long interval = appProperties.getRetentionSweepInterval().toMillis();
    log.info("Removing terminal jobs older than {} every {}",
        appProperties.getTerminalJobRetention(), appProperties.getRetentionSweepInterval());
    executor.scheduleAtFixedRate(() -> cleanupOldJobs()
            .subscribe(
                removed -> log.debug("Job retention sweep removed {} jobs", removed),
                e -> log.error("Job retention sweep failed", e)),
        interval, interval, TimeUnit.MILLISECONDS);
  }

  public Mono<Long> cleanupOldJobs() {
    return jobQueueService.purgeTerminalJobs()
        .doOnNext(removed -> {
          if (removed > 0) {
            log.info("Removed {} terminal jobs older than {}", removed,
                appProperties.getTerminalJobRetention());
          }
        });
  }
}
