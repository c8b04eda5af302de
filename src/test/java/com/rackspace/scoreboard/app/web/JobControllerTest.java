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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.scoreboard.app.jobs.JobQueueService;
import com.rackspace.scoreboard.app.jobs.JobRetentionService;
import com.rackspace.scoreboard.app.model.AnalyticsScope;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobPriority;
import com.rackspace.scoreboard.app.model.JobProgress;
import com.rackspace.scoreboard.app.model.JobStatus;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.QueueStats;
import com.rackspace.scoreboard.app.model.payload.RankingUpdatePayload;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles("test")
@WebFluxTest(JobController.class)
public class JobControllerTest {

  @MockBean
  JobQueueService jobQueueService;

  @MockBean
  JobRetentionService jobRetentionService;

  @Autowired
  WebTestClient webTestClient;

  @Test
  public void testSubmitBatch() {
    when(jobQueueService.enqueueBatchSubmission(eq("e-1"), any(), eq(JobPriority.HIGH), isNull()))
        .thenReturn(Mono.just("batch_1_abcdefg"));

    webTestClient.post().uri("/api/jobs/submissions")
        .bodyValue(Map.of(
            "examId", "e-1",
            "priority", "high",
            "submissions", new Object[]{Map.of("participantId", "p-1",
                "answers", Map.of("q1", "a"))}
        ))
        .exchange()
        .expectStatus().isAccepted()
        .expectBody()
        .jsonPath("$.jobId").isEqualTo("batch_1_abcdefg");
  }

  @Test
  public void testSubmitBatch_missingExam() {
    webTestClient.post().uri("/api/jobs/submissions")
        .bodyValue(Map.of("submissions", new Object[]{Map.of("participantId", "p-1")}))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.message").value(message -> assertThat((String) message).contains("examId"));

    verifyNoInteractions(jobQueueService);
  }

  @Test
  public void testCalculateResult() {
    when(jobQueueService.enqueueResultCalculation("e-1", "p-1", null))
        .thenReturn(Mono.just("calc_1_abcdefg"));

    webTestClient.post().uri("/api/jobs/results")
        .bodyValue(Map.of("examId", "e-1", "participantId", "p-1"))
        .exchange()
        .expectStatus().isAccepted()
        .expectBody()
        .jsonPath("$.jobId").isEqualTo("calc_1_abcdefg");
  }

  @Test
  public void testUpdateRanking() {
    when(jobQueueService.enqueueRankingUpdate("e-1", JobPriority.CRITICAL))
        .thenReturn(Mono.just("ranking_1_abcdefg"));

    webTestClient.post().uri("/api/jobs/rankings")
        .bodyValue(Map.of("examId", "e-1", "priority", "critical"))
        .exchange()
        .expectStatus().isAccepted()
        .expectBody()
        .jsonPath("$.jobId").isEqualTo("ranking_1_abcdefg");
  }

  @Test
  public void testRefreshAnalytics_rejected() {
    when(jobQueueService.enqueueAnalyticsRefresh(AnalyticsScope.CLASS, null, null))
        .thenReturn(Mono.error(new IllegalArgumentException("targetId is required for scope CLASS")));

    webTestClient.post().uri("/api/jobs/analytics")
        .bodyValue(Map.of("scope", "class"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").isEqualTo("targetId is required for scope CLASS");
  }

  @Test
  public void testGetJob() {
    when(jobQueueService.getJobStatus("ranking_1_abcdefg")).thenReturn(Mono.just(new Job()
        .setId("ranking_1_abcdefg")
        .setType(JobType.RANKING_UPDATE)
        .setPriority(JobPriority.HIGH)
        .setStatus(JobStatus.FAILED)
        .setCreatedAt(Instant.parse("2022-01-01T00:00:00Z"))
        .setRetryCount(2)
        .setMaxRetries(2)
        .setLastError("boom")
        .setProgress(new JobProgress().setCurrent(0).setTotal(1))
        .setPayload(new RankingUpdatePayload().setExamId("e-1"))));

    webTestClient.get().uri("/api/jobs/ranking_1_abcdefg")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.type").isEqualTo("ranking_update")
        .jsonPath("$.status").isEqualTo("failed")
        .jsonPath("$.priority").isEqualTo("high")
        .jsonPath("$.retryCount").isEqualTo(2)
        .jsonPath("$.lastError").isEqualTo("boom")
        .jsonPath("$.payload.examId").isEqualTo("e-1")
        .jsonPath("$.startedAt").doesNotExist();
  }

  @Test
  public void testGetJob_unknown() {
    when(jobQueueService.getJobStatus("calc_1_missing")).thenReturn(Mono.empty());

    webTestClient.get().uri("/api/jobs/calc_1_missing")
        .exchange()
        .expectStatus().isNotFound();
  }

  @Test
  public void testGetQueueStats() {
    when(jobQueueService.getQueueStats()).thenReturn(Mono.just(new QueueStats()
        .setQueued(3)
        .setProcessing(1)
        .setCompleted(10)
        .setFailed(2)
        .setQueueLength(3)
        .setAverageProcessingTime(125.5)
        .setActiveWorkers(1)));

    webTestClient.get().uri("/api/jobs/stats")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.queued").isEqualTo(3)
        .jsonPath("$.failed").isEqualTo(2)
        .jsonPath("$.averageProcessingTime").isEqualTo(125.5)
        .jsonPath("$.activeWorkers").isEqualTo(1);
  }

  @Test
  public void testPurgeTerminalJobs() {
    when(jobRetentionService.cleanupOldJobs()).thenReturn(Mono.just(2L));

    webTestClient.delete().uri("/api/jobs/terminal")
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.removed").isEqualTo(2);

    verify(jobRetentionService).cleanupOldJobs();
  }
}
