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

import com.rackspace.scoreboard.app.model.AnalyticsScope;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.payload.AnalyticsRefreshPayload;
import com.rackspace.scoreboard.app.precalc.AggregateCategory;
import com.rackspace.scoreboard.app.precalc.PrecalculatedResultsManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Refreshes the precalculated aggregate of one target right away, or every category when the
 * scope is global.
 */
@Component
@Slf4j
public class AnalyticsRefreshHandler extends AbstractJobHandler<AnalyticsRefreshPayload> {

  private final PrecalculatedResultsManager precalculatedResultsManager;

  @Autowired
  public AnalyticsRefreshHandler(PrecalculatedResultsManager precalculatedResultsManager) {
    super(JobType.ANALYTICS_REFRESH, AnalyticsRefreshPayload.class);
    this.precalculatedResultsManager = precalculatedResultsManager;
  }

  @Override
  protected Mono<Void> handle(Job job, AnalyticsRefreshPayload payload) {
    if (payload.getScope() == AnalyticsScope.GLOBAL) {
      return precalculatedResultsManager.forceRefresh()
          .doOnNext(counts -> log.info("Global analytics refresh job={} refreshed {}",
              job.getId(), counts))
          .then();
    }
    return precalculatedResultsManager
        .refreshTarget(categoryFor(payload.getScope()), payload.getTargetId())
        .then();
  }

  static AggregateCategory categoryFor(AnalyticsScope scope) {
    switch (scope) {
      case EXAM:
        return AggregateCategory.EXAM_STATS;
      case STUDENT:
        return AggregateCategory.STUDENT_SUMMARIES;
      case CLASS:
        return AggregateCategory.CLASS_RANKINGS;
      case SUBJECT:
        return AggregateCategory.SUBJECT_ANALYTICS;
      default:
        throw new IllegalArgumentException("No aggregate category for scope " + scope);
    }
  }
}
