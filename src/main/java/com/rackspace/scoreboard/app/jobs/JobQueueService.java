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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.config.QueueProperties;
import com.rackspace.scoreboard.app.model.AnalyticsScope;
import com.rackspace.scoreboard.app.model.BatchOptions;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobPriority;
import com.rackspace.scoreboard.app.model.JobStatus;
import com.rackspace.scoreboard.app.model.QueueStats;
import com.rackspace.scoreboard.app.model.Submission;
import com.rackspace.scoreboard.app.model.payload.AnalyticsRefreshPayload;
import com.rackspace.scoreboard.app.model.payload.JobPayload;
import com.rackspace.scoreboard.app.model.payload.RankingUpdatePayload;
import com.rackspace.scoreboard.app.model.payload.ResultCalculationPayload;
import com.rackspace.scoreboard.app.model.payload.SubmissionBatchPayload;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persists jobs in Redis and moves them through their lifecycle:
 * queued, processing, then completed, queued again for a retry, or failed.
 * Every transition is a single Lua script call.
 */
@Service
@Slf4j
public class JobQueueService {

  private final ReactiveStringRedisTemplate redisTemplate;
  private final RedisScript<Long> enqueueJobScript;
  private final RedisScript<String> claimJobScript;
  private final RedisScript<Long> finishJobScript;
  private final RedisScript<Long> purgeJobsScript;
  private final ObjectMapper objectMapper;
  private final QueueProperties queueProperties;
  private final AppProperties appProperties;
  private final WorkerActivity workerActivity;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Autowired
  public JobQueueService(ReactiveStringRedisTemplate redisTemplate,
                         @Qualifier("enqueueJobScript") RedisScript<Long> enqueueJobScript,
                         @Qualifier("claimJobScript") RedisScript<String> claimJobScript,
                         @Qualifier("finishJobScript") RedisScript<Long> finishJobScript,
                         @Qualifier("purgeJobsScript") RedisScript<Long> purgeJobsScript,
                         ObjectMapper objectMapper,
                         QueueProperties queueProperties,
                         AppProperties appProperties,
                         WorkerActivity workerActivity,
                         Clock clock,
                         MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.enqueueJobScript = enqueueJobScript;
    this.claimJobScript = claimJobScript;
    this.finishJobScript = finishJobScript;
    this.purgeJobsScript = purgeJobsScript;
    this.objectMapper = objectMapper;
    this.queueProperties = queueProperties;
    this.appProperties = appProperties;
    this.workerActivity = workerActivity;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public Mono<String> enqueueBatchSubmission(String examId, List<Submission> submissions,
                                             JobPriority priority, BatchOptions options) {
    if (StringUtils.isBlank(examId)) {
      return Mono.error(new IllegalArgumentException("examId is required"));
    }
    if (submissions == null || submissions.isEmpty()) {
      return Mono.error(new IllegalArgumentException("A submission batch needs at least one submission"));
    }
    return enqueue(new SubmissionBatchPayload()
            .setExamId(examId)
            .setSubmissions(submissions)
            .setOptions(options != null ? options : new BatchOptions()),
        priority);
  }

  public Mono<String> enqueueResultCalculation(String examId, String participantId,
                                               JobPriority priority) {
    if (StringUtils.isAnyBlank(examId, participantId)) {
      return Mono.error(new IllegalArgumentException("examId and participantId are required"));
    }
    return enqueue(new ResultCalculationPayload()
            .setExamId(examId)
            .setParticipantId(participantId),
        priority);
  }

  public Mono<String> enqueueRankingUpdate(String examId, JobPriority priority) {
    if (StringUtils.isBlank(examId)) {
      return Mono.error(new IllegalArgumentException("examId is required"));
    }
    return enqueue(new RankingUpdatePayload().setExamId(examId), priority);
  }

  public Mono<String> enqueueAnalyticsRefresh(AnalyticsScope scope, String targetId,
                                              JobPriority priority) {
    if (scope == null) {
      return Mono.error(new IllegalArgumentException("scope is required"));
    }
    if (scope != AnalyticsScope.GLOBAL && StringUtils.isBlank(targetId)) {
      return Mono.error(new IllegalArgumentException("targetId is required for scope " + scope));
    }
    return enqueue(new AnalyticsRefreshPayload().setScope(scope).setTargetId(targetId), priority);
  }

  /**
   * Enqueues the recomputations that depend on a changed result of the exam: a ranking update
   * at high priority and an exam analytics refresh at normal priority.
   */
  public Mono<Void> enqueueDependents(String examId) {
    return enqueueRankingUpdate(examId, JobPriority.HIGH)
        .then(Mono.defer(() ->
            enqueueAnalyticsRefresh(AnalyticsScope.EXAM, examId, JobPriority.NORMAL)))
        .then();
  }

  /**
   * Persists a new job and makes it visible to workers.
   *
   * @param priority requested priority, or null for the job type's default
   * @return the id of the new job
   */
  public Mono<String> enqueue(JobPayload payload, JobPriority priority) {
    return Mono.defer(() -> enqueueNow(payload, priority));
  }

  private Mono<String> enqueueNow(JobPayload payload, JobPriority priority) {
    final Instant now = clock.instant();
    final Job job = new Job()
        .setId(generateJobId(payload, now))
        .setType(payload.getJobType())
        .setPayload(payload)
        .setPriority(priority != null ? priority : payload.getJobType().getDefaultPriority())
        .setStatus(JobStatus.QUEUED)
        .setCreatedAt(now)
        .setNotBefore(now)
        .setMaxRetries(queueProperties.maxRetriesFor(payload.getJobType()));

    return writeQueued(job, false)
        .doOnNext(stored -> {
          log.debug("Enqueued job={} type={} priority={}", job.getId(), job.getType(),
              job.getPriority());
          meterRegistry.counter("scoreboard.jobs.enqueued", "type", job.getType().name())
              .increment();
        })
        .thenReturn(job.getId());
  }

  /**
   * @return the latest state of the job or empty when it is unknown or was swept
   */
  public Mono<Job> getJobStatus(String jobId) {
    return redisTemplate.opsForValue().get(JobKeys.record(jobId))
        .flatMap(this::deserialize);
  }

  public Mono<QueueStats> getQueueStats() {
    final Mono<Long> queueLength = Flux.fromIterable(JobKeys.lanes())
        .flatMap(lane -> redisTemplate.opsForZSet().size(lane))
        .reduce(0L, Long::sum);
    final Mono<Double> averageProcessingTime = redisTemplate.<String, String>opsForHash()
        .multiGet(JobKeys.METRICS, List.of(JobKeys.METRIC_PROCESSING_MS, JobKeys.METRIC_PROCESSED))
        .map(JobQueueService::average)
        .defaultIfEmpty(0.0);

    return Mono.zip(
            statusCount(JobStatus.QUEUED),
            statusCount(JobStatus.PROCESSING),
            statusCount(JobStatus.COMPLETED),
            statusCount(JobStatus.FAILED),
            queueLength,
            averageProcessingTime)
        .map(counts -> new QueueStats()
            .setQueued(counts.getT1())
            .setProcessing(counts.getT2())
            .setCompleted(counts.getT3())
            .setFailed(counts.getT4())
            .setQueueLength(counts.getT5())
            .setAverageProcessingTime(counts.getT6())
            .setActiveWorkers(workerActivity.getActiveWorkers()));
  }

  /**
   * Claims the first ready job of the highest priority lane that has one.
   *
   * @return the claimed job, now processing, or empty when no job is ready
   */
  public Mono<Job> claimNext() {
    final List<String> keys = new ArrayList<>(JobKeys.lanes());
    keys.add(JobKeys.statusSet(JobStatus.QUEUED));
    keys.add(JobKeys.statusSet(JobStatus.PROCESSING));

    return redisTemplate.execute(claimJobScript, keys, List.of(Long.toString(clock.millis())))
        .next()
        .flatMap(jobId -> getJobStatus(jobId)
            .switchIfEmpty(Mono.defer(() -> discardOrphan(jobId))))
        .flatMap(job -> {
          job.setStatus(JobStatus.PROCESSING)
              .setStartedAt(clock.instant());
          return save(job);
        });
  }

  /**
   * Rewrites the record of a job owned by the caller, such as after a progress change. The
   * record does not expire until the job reaches a terminal state.
   */
  public Mono<Job> save(Job job) {
    return serialize(job)
        .flatMap(json -> redisTemplate.opsForValue()
            .set(JobKeys.record(job.getId()), json))
        .thenReturn(job);
  }

  public Mono<Job> complete(Job job) {
    final Instant now = clock.instant();
    job.setStatus(JobStatus.COMPLETED)
        .setCompletedAt(now);
    final long processingMillis = job.getStartedAt() != null ?
        Duration.between(job.getStartedAt(), now).toMillis() : -1;
    log.debug("Completed job={} type={} in {}ms", job.getId(), job.getType(), processingMillis);
    return finish(job, processingMillis);
  }

  /**
   * Applies the retry policy to a job whose handler failed. The job is queued again with a
   * back-off delay while its retry count stays below its ceiling, otherwise it is failed
   * permanently with the error recorded.
   */
  public Mono<Job> recordFailure(Job job, Throwable error) {
    final Instant now = clock.instant();
    final int attempts = job.getRetryCount() + 1;
    job.setLastError(describe(error));

    if (attempts < job.getMaxRetries()) {
      final Duration delay = queueProperties.getBackoff().delayFor(attempts);
      job.setRetryCount(attempts)
          .setStatus(JobStatus.QUEUED)
          .setStartedAt(null)
          .setNotBefore(now.plus(delay));
      log.warn("Job={} type={} failed on attempt {}, retrying in {}: {}", job.getId(),
          job.getType(), attempts, delay, job.getLastError());
      return writeQueued(job, true)
          .flatMap(requeued -> {
            if (requeued) {
              return Mono.just(job);
            }
            log.warn("Job={} was not held by a worker, retry not queued", job.getId());
            return Mono.empty();
          });
    }

    job.setRetryCount(Math.min(attempts, job.getMaxRetries()))
        .setStatus(JobStatus.FAILED)
        .setCompletedAt(now);
    log.error("Job={} type={} failed permanently after {} attempts: {}", job.getId(),
        job.getType(), attempts, job.getLastError());
    return finish(job, -1);
  }

  /**
   * Deletes completed and failed jobs created before the retention period.
   *
   * @return number of jobs deleted
   */
  public Mono<Long> purgeTerminalJobs() {
    final long cutoff = clock.instant().minus(appProperties.getTerminalJobRetention())
        .toEpochMilli();
    return redisTemplate.execute(
            purgeJobsScript,
            List.of(JobKeys.TERMINAL_JOBS,
                JobKeys.statusSet(JobStatus.COMPLETED),
                JobKeys.statusSet(JobStatus.FAILED)),
            List.of(Long.toString(cutoff),
                Integer.toString(appProperties.getRetentionSweepLimit()),
                JobKeys.RECORD_PREFIX))
        .next()
        .defaultIfEmpty(0L);
  }

  private Mono<Boolean> writeQueued(Job job, boolean requeue) {
    return serialize(job)
        .flatMap(json -> redisTemplate.execute(
                enqueueJobScript,
                List.of(JobKeys.record(job.getId()),
                    JobKeys.lane(job.getPriority()),
                    JobKeys.statusSet(JobStatus.QUEUED),
                    JobKeys.statusSet(JobStatus.PROCESSING)),
                List.of(job.getId(),
                    json,
                    Long.toString(job.getNotBefore().toEpochMilli()),
                    requeue ? "1" : "0"))
            .next())
        .map(result -> result == 1L);
  }

  private Mono<Job> finish(Job job, long processingMillis) {
    return serialize(job)
        .flatMap(json -> redisTemplate.execute(
                finishJobScript,
                List.of(JobKeys.record(job.getId()),
                    JobKeys.statusSet(JobStatus.PROCESSING),
                    JobKeys.statusSet(job.getStatus()),
                    JobKeys.METRICS,
                    JobKeys.TERMINAL_JOBS),
                List.of(job.getId(),
                    json,
                    Long.toString(appProperties.getJobRecordTtl().toMillis()),
                    Long.toString(processingMillis),
                    Long.toString(job.getCreatedAt().toEpochMilli())))
            .next())
        .flatMap(moved -> {
          if (moved == 1L) {
            return Mono.just(job);
          }
          log.warn("Job={} was not held by a worker, final state {} not recorded", job.getId(),
              job.getStatus());
          return Mono.empty();
        });
  }

  private Mono<Job> discardOrphan(String jobId) {
    log.warn("Claimed job={} has no record, discarding it", jobId);
    return redisTemplate.opsForSet().remove(JobKeys.statusSet(JobStatus.PROCESSING), jobId)
        .then(Mono.empty());
  }

  private Mono<Long> statusCount(JobStatus status) {
    return redisTemplate.opsForSet().size(JobKeys.statusSet(status));
  }

  private Mono<String> serialize(Job job) {
    return Mono.fromCallable(() -> objectMapper.writeValueAsString(job));
  }

  private Mono<Job> deserialize(String json) {
    return Mono.fromCallable(() -> objectMapper.readValue(json, Job.class));
  }

  static String generateJobId(JobPayload payload, Instant now) {
    return String.format("%s_%d_%s", payload.getJobType().getIdPrefix(), now.toEpochMilli(),
        RandomStringUtils.randomAlphanumeric(7).toLowerCase(Locale.ROOT));
  }

  static String describe(Throwable error) {
    final String message = error.getMessage();
    return message != null ? message : error.getClass().getName();
  }

  private static double average(List<String> values) {
    if (values.size() < 2 || values.get(0) == null || values.get(1) == null) {
      return 0.0;
    }
    final long processed = Long.parseLong(values.get(1));
    return processed == 0 ? 0.0 : Long.parseLong(values.get(0)) / (double) processed;
  }
}
