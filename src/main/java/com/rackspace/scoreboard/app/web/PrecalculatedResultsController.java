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

import com.rackspace.scoreboard.app.precalc.AggregateCategory;
import com.rackspace.scoreboard.app.precalc.CachedAggregate;
import com.rackspace.scoreboard.app.precalc.PrecalculatedResultsManager;
import com.rackspace.scoreboard.app.precalc.PrecalculatedResultsService;
import com.rackspace.scoreboard.app.precalc.ProcessingStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Serves the aggregates computed by the periodic sweeps. Nothing is computed on a read: an
 * aggregate that was not computed yet is reported as not available.
 */
@RestController
@RequestMapping("/api/precalc")
public class PrecalculatedResultsController {

  static final Map<String, String> NOT_AVAILABLE = Map.of("status", "not_available");

  private final PrecalculatedResultsService precalculatedResultsService;
  private final PrecalculatedResultsManager precalculatedResultsManager;

  @Autowired
  public PrecalculatedResultsController(PrecalculatedResultsService precalculatedResultsService,
                                        PrecalculatedResultsManager precalculatedResultsManager) {
    this.precalculatedResultsService = precalculatedResultsService;
    this.precalculatedResultsManager = precalculatedResultsManager;
  }

  @GetMapping("/exams/{examId}/stats")
  public Mono<ResponseEntity<Object>> getExamStats(@PathVariable String examId) {
    return orNotAvailable(precalculatedResultsService.getExamStats(examId));
  }

  @GetMapping("/students/{participantId}/summary")
  public Mono<ResponseEntity<Object>> getStudentSummary(@PathVariable String participantId) {
    return orNotAvailable(precalculatedResultsService.getStudentSummary(participantId));
  }

  @GetMapping("/classes/{classId}/rankings")
  public Mono<ResponseEntity<Object>> getClassRankings(@PathVariable String classId) {
    return orNotAvailable(precalculatedResultsService.getClassRankings(classId));
  }

  @GetMapping("/subjects/{subjectId}/analytics")
  public Mono<ResponseEntity<Object>> getSubjectAnalytics(@PathVariable String subjectId) {
    return orNotAvailable(precalculatedResultsService.getSubjectAnalytics(subjectId));
  }

  @PostMapping("/refresh")
  public Mono<Map<String, Integer>> forceRefresh() {
    return precalculatedResultsManager.forceRefresh()
        .map(counts -> {
          final Map<String, Integer> byKey = new LinkedHashMap<>();
          counts.forEach((category, count) -> byKey.put(category.getKey(), count));
          return byKey;
        });
  }

  @GetMapping("/status")
  public List<ProcessingStatus> getProcessingStatus() {
    return precalculatedResultsManager.getProcessingStatus();
  }

  @DeleteMapping("/{category}")
  public Mono<Map<String, Long>> invalidate(@PathVariable String category) {
    return precalculatedResultsService.invalidate(AggregateCategory.fromKey(category))
        .map(deleted -> Map.of("deleted", deleted));
  }

  private static Mono<ResponseEntity<Object>> orNotAvailable(
      Mono<? extends CachedAggregate<?>> aggregate) {
    return aggregate
        .map(value -> ResponseEntity.ok().<Object>body(value))
        .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND).body(NOT_AVAILABLE));
  }
}
