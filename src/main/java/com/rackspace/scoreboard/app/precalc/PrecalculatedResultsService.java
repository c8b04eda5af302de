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

import static com.rackspace.scoreboard.app.precalc.PrecalculatedResultsManager.encodeAggregateKey;
import static com.rackspace.scoreboard.app.precalc.PrecalculatedResultsManager.encodeCategoryPrefix;

import com.rackspace.scoreboard.app.config.PrecalcProperties;
import com.rackspace.scoreboard.app.services.ResultCacheService;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Serves precalculated aggregates from the cache. A miss is reported as empty and is never
 * computed inline; the category's schedule fills it.
 */
@Service
@Slf4j
public class PrecalculatedResultsService {

  private final ResultCacheService resultCacheService;
  private final PrecalcProperties properties;
  private final Clock clock;

  @Autowired
  public PrecalculatedResultsService(ResultCacheService resultCacheService,
                                     PrecalcProperties properties,
                                     Clock clock) {
    this.resultCacheService = resultCacheService;
    this.properties = properties;
    this.clock = clock;
  }

  public Mono<CachedAggregate<ExamStatistics>> getExamStats(String examId) {
    return get(AggregateCategory.EXAM_STATS, examId, ExamStatistics.class);
  }

  public Mono<CachedAggregate<StudentSummary>> getStudentSummary(String participantId) {
    return get(AggregateCategory.STUDENT_SUMMARIES, participantId, StudentSummary.class);
  }

  public Mono<CachedAggregate<ClassRankings>> getClassRankings(String classId) {
    return get(AggregateCategory.CLASS_RANKINGS, classId, ClassRankings.class);
  }

  public Mono<CachedAggregate<SubjectAnalytics>> getSubjectAnalytics(String subjectId) {
    return get(AggregateCategory.SUBJECT_ANALYTICS, subjectId, SubjectAnalytics.class);
  }

  /**
   * Drops every cached aggregate of the category.
   */
  public Mono<Long> invalidate(AggregateCategory category) {
    log.info("Invalidating cached {}", category.getKey());
    return resultCacheService.deleteByPrefix(encodeCategoryPrefix(category));
  }

  <T> Mono<CachedAggregate<T>> get(AggregateCategory category, String targetId,
                                   Class<T> payloadType) {
    final Duration freshness = properties.freshnessWindow(category);
    return resultCacheService.<CachedAggregate<T>>get(
            encodeAggregateKey(category, targetId),
            resultCacheService.parametricType(CachedAggregate.class, payloadType))
        .map(aggregate -> aggregate.setStale(isStale(aggregate, freshness)));
  }

  private boolean isStale(CachedAggregate<?> aggregate, Duration freshness) {
    if (aggregate.getLastUpdated() == null) {
      return true;
    }
    return Duration.between(aggregate.getLastUpdated(), clock.instant()).compareTo(freshness) > 0;
  }
}
