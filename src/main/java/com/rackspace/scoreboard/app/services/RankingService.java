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

package com.rackspace.scoreboard.app.services;

import com.fasterxml.jackson.databind.JavaType;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.ranking.ParticipantRank;
import com.rackspace.scoreboard.app.ranking.RankedEntries;
import com.rackspace.scoreboard.app.ranking.RankedEntry;
import com.rackspace.scoreboard.app.ranking.RankingEngine;
import com.rackspace.scoreboard.app.ranking.Standing;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Computes leaderboards from stored results and serves them from the cache.
 */
@Service
@Slf4j
public class RankingService {

  static final String EXAM_RANKING_PREFIX = "rankings|exam|";
  static final String SUBJECT_RANKING_PREFIX = "rankings|subject|";

  private final ExamResultService examResultService;
  private final ExamCatalogService examCatalogService;
  private final ResultCacheService resultCacheService;
  private final AppProperties appProperties;
  private final JavaType leaderboardType;

  @Autowired
  public RankingService(ExamResultService examResultService,
                        ExamCatalogService examCatalogService,
                        ResultCacheService resultCacheService,
                        AppProperties appProperties) {
    this.examResultService = examResultService;
    this.examCatalogService = examCatalogService;
    this.resultCacheService = resultCacheService;
    this.appProperties = appProperties;
    this.leaderboardType = resultCacheService.listType(Standing.class);
  }

  /**
   * Ranks every result of the exam and caches the leaderboard.
   */
  public Mono<List<Standing>> refreshExamRanking(String examId) {
    return examResultService.getResultsForExam(examId)
        .collectList()
        .flatMap(results -> withRollNumbers(results,
            rollNumbers -> RankedEntries.forExam(results, rollNumbers::get)))
        .map(RankingEngine::leaderboard)
        .flatMap(leaderboard -> resultCacheService
            .put(encodeExamKey(examId), leaderboard, appProperties.getRankingCacheTtl())
            .thenReturn(leaderboard))
        .doOnNext(leaderboard -> log.debug("Ranked {} participants of exam={}",
            leaderboard.size(), examId));
  }

  /**
   * Ranks participants across every exam of the subject and caches the leaderboard.
   */
  public Mono<List<Standing>> refreshSubjectRanking(String subjectId) {
    return examResultService.getResultsForSubject(subjectId)
        .collectList()
        .flatMap(results -> withRollNumbers(results,
            rollNumbers -> RankedEntries.cumulative(results, rollNumbers::get)))
        .map(RankingEngine::leaderboard)
        .flatMap(leaderboard -> resultCacheService
            .put(encodeSubjectKey(subjectId), leaderboard, appProperties.getRankingCacheTtl())
            .thenReturn(leaderboard));
  }

  /**
   * Refreshes the exam leaderboard and the cumulative leaderboard of the exam's subject.
   */
  public Mono<List<Standing>> refreshRankingsForExam(String examId) {
    return refreshExamRanking(examId)
        .flatMap(leaderboard -> examCatalogService.getExam(examId)
            .filter(exam -> exam.getSubjectId() != null)
            .flatMap(exam -> refreshSubjectRanking(exam.getSubjectId()))
            .thenReturn(leaderboard));
  }

  public Mono<List<Standing>> getExamRanking(String examId) {
    return resultCacheService.get(encodeExamKey(examId), leaderboardType);
  }

  public Mono<List<Standing>> getSubjectRanking(String subjectId) {
    return resultCacheService.get(encodeSubjectKey(subjectId), leaderboardType);
  }

  /**
   * @return the participant's standing in the cached exam leaderboard, empty when the
   * leaderboard is not cached or does not contain the participant
   */
  public Mono<ParticipantRank> getParticipantRank(String examId, String participantId) {
    return getExamRanking(examId)
        .flatMap(leaderboard -> Mono.justOrEmpty(leaderboard.stream()
            .filter(standing -> participantId.equals(standing.getEntry().getParticipantId()))
            .findFirst()
            .map(standing -> new ParticipantRank()
                .setExamId(examId)
                .setParticipantId(participantId)
                .setRank(standing.getRank())
                .setOf(leaderboard.size()))));
  }

  /**
   * Drops cached leaderboards. With no ids given, every cached leaderboard is dropped.
   */
  public Mono<Long> invalidateRankings(String examId, String subjectId) {
    if (examId == null && subjectId == null) {
      return resultCacheService.deleteByPrefix("rankings|");
    }
    Mono<Long> deleted = Mono.just(0L);
    if (examId != null) {
      deleted = deleted.zipWith(resultCacheService.delete(encodeExamKey(examId)), Long::sum);
    }
    if (subjectId != null) {
      deleted = deleted.zipWith(resultCacheService.delete(encodeSubjectKey(subjectId)), Long::sum);
    }
    return deleted;
  }

  private Mono<List<RankedEntry>> withRollNumbers(
      List<ExamResult> results,
      Function<Map<String, String>, List<RankedEntry>> builder) {
    final List<String> participantIds = results.stream()
        .map(ExamResult::getParticipantId)
        .distinct()
        .collect(Collectors.toList());
    return examCatalogService.getRollNumbers(participantIds).map(builder);
  }

  static String encodeExamKey(String examId) {
    return EXAM_RANKING_PREFIX + examId;
  }

  static String encodeSubjectKey(String subjectId) {
    return SUBJECT_RANKING_PREFIX + subjectId;
  }
}
