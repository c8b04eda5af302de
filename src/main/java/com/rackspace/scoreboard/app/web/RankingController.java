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

package com.rackspace.scoreboard.app.web;

import com.rackspace.scoreboard.app.ranking.ParticipantRank;
import com.rackspace.scoreboard.app.ranking.Standing;
import com.rackspace.scoreboard.app.services.RankingService;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/rankings")
public class RankingController {

  private final RankingService rankingService;

  @Autowired
  public RankingController(RankingService rankingService) {
    this.rankingService = rankingService;
  }

  @GetMapping("/exams/{examId}")
  public Mono<ResponseEntity<Object>> getExamRanking(@PathVariable String examId) {
    return orNotAvailable(rankingService.getExamRanking(examId));
  }

  @GetMapping("/exams/{examId}/participants/{participantId}")
  public Mono<ResponseEntity<Object>> getParticipantRank(@PathVariable String examId,
                                                         @PathVariable String participantId) {
    return orNotAvailable(rankingService.getParticipantRank(examId, participantId));
  }

  @GetMapping("/subjects/{subjectId}")
  public Mono<ResponseEntity<Object>> getSubjectRanking(@PathVariable String subjectId) {
    return orNotAvailable(rankingService.getSubjectRanking(subjectId));
  }

  /**
   * Drops cached leaderboards of the given exam and/or subject, or all of them when neither
   * is given.
   */
  @DeleteMapping
  public Mono<Map<String, Long>> invalidate(@RequestParam(required = false) String examId,
                                            @RequestParam(required = false) String subjectId) {
    return rankingService.invalidateRankings(examId, subjectId)
        .map(deleted -> Map.of("deleted", deleted));
  }

  private static Mono<ResponseEntity<Object>> orNotAvailable(Mono<?> ranking) {
    return ranking
        .map(value -> ResponseEntity.ok().<Object>body(value))
        .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(PrecalculatedResultsController.NOT_AVAILABLE));
  }
}
