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

import com.rackspace.scoreboard.app.jobs.JobQueueService;
import com.rackspace.scoreboard.app.jobs.JobRetentionService;
import com.rackspace.scoreboard.app.model.AnalyticsRefreshRequest;
import com.rackspace.scoreboard.app.model.EnqueueResponse;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.QueueStats;
import com.rackspace.scoreboard.app.model.RankingUpdateRequest;
import com.rackspace.scoreboard.app.model.ResultCalculationRequest;
import com.rackspace.scoreboard.app.model.SubmissionBatchRequest;
import java.util.Map;
import javax.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
public class JobController {

  private final JobQueueService jobQueueService;
  private final JobRetentionService jobRetentionService;

  @Autowired
  public JobController(JobQueueService jobQueueService,
                       JobRetentionService jobRetentionService) {
    this.jobQueueService = jobQueueService;
    this.jobRetentionService = jobRetentionService;
  }

  @PostMapping("/submissions")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<EnqueueResponse> submitBatch(@RequestBody @Valid SubmissionBatchRequest request) {
    return jobQueueService.enqueueBatchSubmission(request.getExamId(), request.getSubmissions(),
            request.getPriority(), request.getOptions())
        .map(EnqueueResponse::new);
  }

  @PostMapping("/results")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<EnqueueResponse> calculateResult(
      @RequestBody @Valid ResultCalculationRequest request) {
    return jobQueueService.enqueueResultCalculation(request.getExamId(),
            request.getParticipantId(), request.getPriority())
        .map(EnqueueResponse::new);
  }

  @PostMapping("/rankings")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<EnqueueResponse> updateRanking(@RequestBody @Valid RankingUpdateRequest request) {
    return jobQueueService.enqueueRankingUpdate(request.getExamId(), request.getPriority())
        .map(EnqueueResponse::new);
  }

  @PostMapping("/analytics")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<EnqueueResponse> refreshAnalytics(
      @RequestBody @Valid AnalyticsRefreshRequest request) {
    return jobQueueService.enqueueAnalyticsRefresh(request.getScope(), request.getTargetId(),
            request.getPriority())
        .map(EnqueueResponse::new);
  }

  @GetMapping("/stats")
  public Mono<QueueStats> getQueueStats() {
    return jobQueueService.getQueueStats();
  }

  @GetMapping("/{jobId}")
  public Mono<ResponseEntity<Job>> getJob(@PathVariable String jobId) {
    return jobQueueService.getJobStatus(jobId)
        .map(ResponseEntity::ok)
        .defaultIfEmpty(ResponseEntity.notFound().build());
  }

  /**
   * Runs the terminal job retention sweep now rather than waiting for its schedule.
   */
  @DeleteMapping("/terminal")
  public Mono<Map<String, Long>> purgeTerminalJobs() {
    return jobRetentionService.cleanupOldJobs()
        .map(removed -> Map.of("removed", removed));
  }
}
