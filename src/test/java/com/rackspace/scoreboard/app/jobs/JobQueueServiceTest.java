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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.scoreboard.app.MutableClock;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.config.QueueProperties;
import com.rackspace.scoreboard.app.config.RedisScriptConfig;
import com.rackspace.scoreboard.app.jobs.JobQueueServiceTest.TestConfig;
import com.rackspace.scoreboard.app.model.AnalyticsScope;
import com.rackspace.scoreboard.app.model.BatchOptions;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobPriority;
import com.rackspace.scoreboard.app.model.JobStatus;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.QueueStats;
import com.rackspace.scoreboard.app.model.Submission;
import com.rackspace.scoreboard.app.model.payload.RankingUpdatePayload;
import com.rackspace.scoreboard.app.model.payload.SubmissionBatchPayload;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

@SpringBootTest(classes = {
    TestConfig.class,
    RedisScriptConfig.class,
    JobQueueService.class,
    WorkerActivity.class
})
@EnableConfigurationProperties({QueueProperties.class, AppProperties.class})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JobQueueServiceTest {

  private static final int REDIS_PORT = 6379;
  private static final Instant START = Instant.parse("2022-05-02T08:00:00Z");

  @Container
  public static GenericContainer<?> redisContainer =
      new GenericContainer<>("redis:6.0")
          .withExposedPorts(REDIS_PORT);

  @TestConfiguration
  public static class TestConfig {

    @Bean
    ReactiveRedisConnectionFactory redisConnectionFactory() {
      return new LettuceConnectionFactory(
          redisContainer.getHost(),
          redisContainer.getFirstMappedPort()
      );
    }

    @Bean
    ReactiveStringRedisTemplate reactiveStringRedisTemplate(
        ReactiveRedisConnectionFactory connectionFactory) {
      return new ReactiveStringRedisTemplate(connectionFactory);
    }

    @Bean
    ObjectMapper objectMapper() {
      return Jackson2ObjectMapperBuilder.json().build();
    }

    @Bean
    MutableClock clock() {
      return new MutableClock(START);
    }

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Autowired
  JobQueueService jobQueueService;

  @Autowired
  ReactiveStringRedisTemplate redisTemplate;

  @Autowired
  MutableClock clock;

  @Autowired
  AppProperties appProperties;

  @BeforeEach
  void setUp() {
    clock.set(START);
    appProperties.setJobRecordTtl(Duration.ofHours(24))
        .setRetentionSweepLimit(1000);
  }

  @AfterEach
  void tearDown() {
    // prune between tests
    redisTemplate.delete(redisTemplate.scan())
        .block();
  }

  @Test
  void enqueueStoresQueuedJob() {
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", null).block();

    assertThat(jobId).matches("ranking_" + START.toEpochMilli() + "_[a-z0-9]{7}");
    StepVerifier.create(jobQueueService.getJobStatus(jobId))
        .assertNext(job -> {
          assertThat(job.getType()).isEqualTo(JobType.RANKING_UPDATE);
          assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
          assertThat(job.getPriority()).isEqualTo(JobPriority.NORMAL);
          assertThat(job.getCreatedAt()).isEqualTo(START);
          assertThat(job.getRetryCount()).isZero();
          assertThat(job.getMaxRetries()).isEqualTo(2);
          assertThat(job.getPayload()).isEqualTo(new RankingUpdatePayload().setExamId("e-1"));
        })
        .verifyComplete();
  }

  @Test
  void batchPayloadSurvivesStorage() {
    final Submission submission = new Submission()
        .setParticipantId("p-1")
        .setEndTime(START);
    final String jobId = jobQueueService.enqueueBatchSubmission("e-1", List.of(submission),
        JobPriority.CRITICAL, new BatchOptions().setSkipValidation(true)).block();

    StepVerifier.create(jobQueueService.getJobStatus(jobId))
        .assertNext(job -> {
          assertThat(job.getId()).startsWith("batch_");
          assertThat(job.getPriority()).isEqualTo(JobPriority.CRITICAL);
          assertThat(job.getPayload()).isInstanceOf(SubmissionBatchPayload.class);
          final SubmissionBatchPayload payload = (SubmissionBatchPayload) job.getPayload();
          assertThat(payload.getSubmissions()).containsExactly(submission);
          assertThat(payload.getOptions().isSkipValidation()).isTrue();
        })
        .verifyComplete();
  }

  @Test
  void analyticsDefaultsToLowPriority() {
    final String jobId = jobQueueService.enqueueAnalyticsRefresh(AnalyticsScope.GLOBAL, null, null)
        .block();

    StepVerifier.create(jobQueueService.getJobStatus(jobId).map(Job::getPriority))
        .expectNext(JobPriority.LOW)
        .verifyComplete();
  }

  @Test
  void analyticsRequiresTargetUnlessGlobal() {
    StepVerifier.create(jobQueueService.enqueueAnalyticsRefresh(AnalyticsScope.EXAM, null, null))
        .expectError(IllegalArgumentException.class)
        .verify();
  }

  @Test
  void unknownJob() {
    StepVerifier.create(jobQueueService.getJobStatus("calc_1_missing"))
        .verifyComplete();
  }

  @Test
  void claimsHigherLanesFirst() {
    final String low = jobQueueService.enqueueRankingUpdate("e-low", JobPriority.LOW).block();
    final String normal = jobQueueService.enqueueRankingUpdate("e-normal", null).block();
    final String critical = jobQueueService.enqueueRankingUpdate("e-critical", JobPriority.CRITICAL)
        .block();

    StepVerifier.create(jobQueueService.claimNext().map(Job::getId))
        .expectNext(critical)
        .verifyComplete();
    StepVerifier.create(jobQueueService.claimNext().map(Job::getId))
        .expectNext(normal)
        .verifyComplete();
    StepVerifier.create(jobQueueService.claimNext().map(Job::getId))
        .expectNext(low)
        .verifyComplete();
    StepVerifier.create(jobQueueService.claimNext())
        .verifyComplete();
  }

  @Test
  void claimsInCreationOrderWithinLane() {
    final String first = jobQueueService.enqueueRankingUpdate("e-1", null).block();
    clock.advance(Duration.ofMillis(5));
    final String second = jobQueueService.enqueueRankingUpdate("e-2", null).block();

    StepVerifier.create(jobQueueService.claimNext().map(Job::getId))
        .expectNext(first)
        .verifyComplete();
    StepVerifier.create(jobQueueService.claimNext().map(Job::getId))
        .expectNext(second)
        .verifyComplete();
  }

  @Test
  void claimMarksProcessing() {
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", null).block();
    clock.advance(Duration.ofSeconds(2));

    StepVerifier.create(jobQueueService.claimNext())
        .assertNext(job -> {
          assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
          assertThat(job.getStartedAt()).isEqualTo(START.plusSeconds(2));
        })
        .verifyComplete();
    StepVerifier.create(jobQueueService.getJobStatus(jobId).map(Job::getStatus))
        .expectNext(JobStatus.PROCESSING)
        .verifyComplete();
    StepVerifier.create(jobQueueService.getQueueStats())
        .assertNext(stats -> {
          assertThat(stats.getQueued()).isZero();
          assertThat(stats.getProcessing()).isEqualTo(1);
          assertThat(stats.getQueueLength()).isZero();
        })
        .verifyComplete();
  }

  @Test
  void completeRecordsProcessingTime() {
    jobQueueService.enqueueRankingUpdate("e-1", null).block();
    final Job claimed = jobQueueService.claimNext().block();
    clock.advance(Duration.ofMillis(1500));

    StepVerifier.create(jobQueueService.complete(claimed))
        .assertNext(job -> {
          assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
          assertThat(job.getCompletedAt()).isEqualTo(START.plusMillis(1500));
        })
        .verifyComplete();

    final QueueStats stats = jobQueueService.getQueueStats().block();
    assertThat(stats.getCompleted()).isEqualTo(1);
    assertThat(stats.getProcessing()).isZero();
    assertThat(stats.getAverageProcessingTime()).isEqualTo(1500.0);
  }

  @Test
  void failureIsRetriedWithBackoffThenFails() {
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", JobPriority.HIGH).block();

    // first attempt
    final Job firstAttempt = jobQueueService.claimNext().block();
    StepVerifier.create(jobQueueService.recordFailure(firstAttempt, new IllegalStateException("boom")))
        .assertNext(job -> {
          assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
          assertThat(job.getRetryCount()).isEqualTo(1);
          assertThat(job.getLastError()).isEqualTo("boom");
          assertThat(job.getNotBefore()).isEqualTo(START.plus(Duration.ofMinutes(1)));
        })
        .verifyComplete();

    // not ready until the back-off elapses
    StepVerifier.create(jobQueueService.claimNext())
        .verifyComplete();
    assertThat(jobQueueService.getQueueStats().block().getQueued()).isEqualTo(1);

    clock.advance(Duration.ofMinutes(1));
    final Job secondAttempt = jobQueueService.claimNext().block();
    assertThat(secondAttempt.getId()).isEqualTo(jobId);
    assertThat(secondAttempt.getPriority()).isEqualTo(JobPriority.HIGH);

    StepVerifier.create(jobQueueService.recordFailure(secondAttempt, new IllegalStateException("again")))
        .assertNext(job -> {
          assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
          assertThat(job.getRetryCount()).isEqualTo(2);
          assertThat(job.getLastError()).isEqualTo("again");
        })
        .verifyComplete();

    StepVerifier.create(jobQueueService.claimNext())
        .verifyComplete();
    final QueueStats stats = jobQueueService.getQueueStats().block();
    assertThat(stats.getFailed()).isEqualTo(1);
    assertThat(stats.getQueued()).isZero();
    // failed jobs do not count towards the average
    assertThat(stats.getAverageProcessingTime()).isZero();
  }

  @Test
  void finishingUnclaimedJobIsIgnored() {
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", null).block();
    final Job queued = jobQueueService.getJobStatus(jobId).block();

    StepVerifier.create(jobQueueService.complete(queued))
        .verifyComplete();
    StepVerifier.create(jobQueueService.recordFailure(queued, new IllegalStateException("x")))
        .verifyComplete();
    StepVerifier.create(jobQueueService.getJobStatus(jobId).map(Job::getStatus))
        .expectNext(JobStatus.QUEUED)
        .verifyComplete();
  }

  @Test
  void orphanedIdIsDiscarded() {
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", null).block();
    redisTemplate.delete(JobKeys.record(jobId)).block();

    StepVerifier.create(jobQueueService.claimNext())
        .verifyComplete();
    assertThat(jobQueueService.getQueueStats().block().getProcessing()).isZero();
  }

  @Test
  void purgeRemovesOnlyOldTerminalJobs() {
    jobQueueService.enqueueRankingUpdate("e-done", JobPriority.CRITICAL).block();
    final String waiting = jobQueueService.enqueueRankingUpdate("e-waiting", JobPriority.LOW)
        .block();
    final Job claimed = jobQueueService.claimNext().block();
    jobQueueService.complete(claimed).block();

    clock.advance(Duration.ofHours(1));
    StepVerifier.create(jobQueueService.purgeTerminalJobs())
        .expectNext(0L)
        .verifyComplete();

    clock.advance(Duration.ofHours(24));
    StepVerifier.create(jobQueueService.purgeTerminalJobs())
        .expectNext(1L)
        .verifyComplete();

    StepVerifier.create(jobQueueService.getJobStatus(claimed.getId()))
        .verifyComplete();
    StepVerifier.create(jobQueueService.getJobStatus(waiting).map(Job::getStatus))
        .expectNext(JobStatus.QUEUED)
        .verifyComplete();
    assertThat(jobQueueService.getQueueStats().block().getCompleted()).isZero();
  }

  @Test
  void pendingRecordsDoNotExpire() throws InterruptedException {
    appProperties.setJobRecordTtl(Duration.ofMillis(50));
    final String jobId = jobQueueService.enqueueRankingUpdate("e-1", null).block();

    StepVerifier.create(redisTemplate.getExpire(JobKeys.record(jobId)))
        .expectNext(Duration.ZERO)
        .verifyComplete();

    // well past the record ttl
    Thread.sleep(200);

    final Job claimed = jobQueueService.claimNext().block();
    assertThat(claimed).isNotNull();
    assertThat(claimed.getId()).isEqualTo(jobId);
    StepVerifier.create(redisTemplate.getExpire(JobKeys.record(jobId)))
        .expectNext(Duration.ZERO)
        .verifyComplete();

    Thread.sleep(200);

    StepVerifier.create(jobQueueService.complete(claimed).map(Job::getStatus))
        .expectNext(JobStatus.COMPLETED)
        .verifyComplete();
  }

  @Test
  void terminalRecordsExpire() {
    jobQueueService.enqueueRankingUpdate("e-1", null).block();
    final Job claimed = jobQueueService.claimNext().block();
    jobQueueService.complete(claimed).block();

    StepVerifier.create(redisTemplate.getExpire(JobKeys.record(claimed.getId())))
        .assertNext(ttl -> assertThat(ttl)
            .isPositive()
            .isLessThanOrEqualTo(Duration.ofHours(24)))
        .verifyComplete();
  }

  @Test
  void purgeSkipsPastStuckJobs() {
    appProperties.setRetentionSweepLimit(1);
    final String stuck = jobQueueService.enqueueRankingUpdate("e-stuck", JobPriority.CRITICAL)
        .block();
    clock.advance(Duration.ofMillis(5));
    final String done = jobQueueService.enqueueRankingUpdate("e-done", JobPriority.CRITICAL)
        .block();

    assertThat(jobQueueService.claimNext().map(Job::getId).block()).isEqualTo(stuck);
    final Job claimed = jobQueueService.claimNext().block();
    assertThat(claimed.getId()).isEqualTo(done);
    jobQueueService.complete(claimed).block();

    clock.advance(Duration.ofHours(25));
    StepVerifier.create(jobQueueService.purgeTerminalJobs())
        .expectNext(1L)
        .verifyComplete();

    StepVerifier.create(jobQueueService.getJobStatus(done))
        .verifyComplete();
    StepVerifier.create(jobQueueService.getJobStatus(stuck).map(Job::getStatus))
        .expectNext(JobStatus.PROCESSING)
        .verifyComplete();
  }
}
