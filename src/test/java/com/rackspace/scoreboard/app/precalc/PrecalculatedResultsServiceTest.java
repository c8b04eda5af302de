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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.scoreboard.app.config.PrecalcProperties;
import com.rackspace.scoreboard.app.services.ResultCacheService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class PrecalculatedResultsServiceTest {

  private static final Instant NOW = Instant.parse("2022-06-01T12:00:00Z");
  private static final String EXAM_KEY = "precalc|exam-stats|e-1";

  @Mock
  ResultCacheService resultCacheService;

  final JavaType examStatsType = new ObjectMapper().getTypeFactory()
      .constructParametricType(CachedAggregate.class, ExamStatistics.class);

  PrecalculatedResultsService service;

  @BeforeEach
  void setUp() {
    service = new PrecalculatedResultsService(resultCacheService, new PrecalcProperties(),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void freshAggregate() {
    givenCached(NOW.minus(Duration.ofMinutes(10)));

    StepVerifier.create(service.getExamStats("e-1"))
        .assertNext(aggregate -> {
          assertThat(aggregate.isStale()).isFalse();
          assertThat(aggregate.getPayload().getExamId()).isEqualTo("e-1");
        })
        .verifyComplete();
  }

  @Test
  void agedAtFreshnessWindowIsStillFresh() {
    // 30m interval plus 5m cycle slack
    givenCached(NOW.minus(Duration.ofMinutes(35)));

    StepVerifier.create(service.getExamStats("e-1").map(CachedAggregate::isStale))
        .expectNext(false)
        .verifyComplete();
  }

  @Test
  void olderThanFreshnessWindowIsStale() {
    givenCached(NOW.minus(Duration.ofMinutes(35)).minusSeconds(1));

    StepVerifier.create(service.getExamStats("e-1").map(CachedAggregate::isStale))
        .expectNext(true)
        .verifyComplete();
  }

  @Test
  void missIsEmpty() {
    when(resultCacheService.parametricType(CachedAggregate.class, ExamStatistics.class))
        .thenReturn(examStatsType);
    when(resultCacheService.<CachedAggregate<ExamStatistics>>get(EXAM_KEY, examStatsType))
        .thenReturn(Mono.empty());

    StepVerifier.create(service.getExamStats("e-1"))
        .verifyComplete();
  }

  @Test
  void invalidateDeletesCategoryPrefix() {
    when(resultCacheService.deleteByPrefix("precalc|student-summaries|"))
        .thenReturn(Mono.just(4L));

    StepVerifier.create(service.invalidate(AggregateCategory.STUDENT_SUMMARIES))
        .expectNext(4L)
        .verifyComplete();
  }

  private void givenCached(Instant lastUpdated) {
    final CachedAggregate<ExamStatistics> aggregate = new CachedAggregate<ExamStatistics>()
        .setCacheKey(EXAM_KEY)
        .setCategory(AggregateCategory.EXAM_STATS)
        .setTargetId("e-1")
        .setPayload(new ExamStatistics().setExamId("e-1"))
        .setLastUpdated(lastUpdated);
    when(resultCacheService.parametricType(CachedAggregate.class, ExamStatistics.class))
        .thenReturn(examStatsType);
    when(resultCacheService.<CachedAggregate<ExamStatistics>>get(EXAM_KEY, examStatsType))
        .thenReturn(Mono.just(aggregate));
  }
}
