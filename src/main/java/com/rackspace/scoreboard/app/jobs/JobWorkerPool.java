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

import com.rackspace.scoreboard.app.config.QueueProperties;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs a fixed number of workers. Each worker claims the next ready job, processes it to
 * completion or failure, and polls again right away; an idle worker sleeps for the poll
 * interval instead.
 */
@Service
@Slf4j
public class JobWorkerPool {

  private final JobQueueService jobQueueService;
  private final JobDispatcher jobDispatcher;
  private final WorkerActivity workerActivity;
  private final QueueProperties properties;
  private final ScheduledExecutorService executor;
  private final MeterRegistry meterRegistry;
  private volatile boolean stopped;

  @Autowired
  public JobWorkerPool(JobQueueService jobQueueService,
                       JobDispatcher jobDispatcher,
                       WorkerActivity workerActivity,
                       QueueProperties properties,
                       ScheduledExecutorService executor,
                       MeterRegistry meterRegistry) {
    this.jobQueueService = jobQueueService;
    this.jobDispatcher = jobDispatcher;
    this.workerActivity = workerActivity;
    this.properties = properties;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void startWorkers() {
    if (!properties.isWorkersEnabled()) {
      log.info("Job workers are disabled on this instance");
      return;
    }
    log.info("Starting {} job workers polling every {}", properties.getWorkers(),
        properties.getPollInterval());
    for (int worker = 0; worker < properties.getWorkers(); worker++) {
      scheduleNext(worker, Duration.ZERO);
    }
  }

  @PreDestroy
  public void stopWorkers() {
    stopped = true;
  }

  private void scheduleNext(int worker, Duration delay) {
    if (stopped) {
      return;
    }
    try {
      executor.schedule(() -> runOnce(worker)
              .subscribe(
                  next -> scheduleNext(worker, next),
                  e -> {
                    log.error("Worker {} stopped unexpectedly, restarting it", worker, e);
                    scheduleNext(worker, properties.getErrorBackoff());
                  }),
          delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Worker {} not rescheduled, executor is shutting down", worker);
    }
  }

  /**
   * Claims and processes at most one job.
   *
   * @return how long the worker should wait before polling again
   */
  public Mono<Duration> runOnce(int worker) {
    return jobQueueService.claimNext()
        .flatMap(job -> process(worker, job).thenReturn(Duration.ZERO))
        .defaultIfEmpty(properties.getPollInterval())
        .onErrorResume(e -> {
          log.warn("Worker {} failed to use the job store, backing off for {}", worker,
              properties.getErrorBackoff(), e);
          return Mono.just(properties.getErrorBackoff());
        });
  }

  private Mono<Job> process(int worker, Job job) {
    final String type = job.getType().name();
    log.info("Worker {} processing job={} type={} priority={} attempt={}", worker, job.getId(),
        job.getType(), job.getPriority(), job.getRetryCount() + 1);

    workerActivity.started();
    final Timer.Sample sample = Timer.start(meterRegistry);
    return jobDispatcher.dispatch(job)
        .thenReturn(true)
        .onErrorResume(e -> jobQueueService.recordFailure(job, e)
            .doOnNext(recorded -> meterRegistry.counter(
                    recorded.getStatus() == JobStatus.FAILED ?
                        "scoreboard.jobs.failed" : "scoreboard.jobs.retried",
                    "type", type)
                .increment())
            .thenReturn(false))
        .filter(Boolean::booleanValue)
        .flatMap(succeeded -> jobQueueService.complete(job))
        .doOnNext(completed -> {
          log.info("Worker {} completed job={} type={}", worker, job.getId(), job.getType());
          meterRegistry.counter("scoreboard.jobs.completed", "type", type).increment();
        })
        .doFinally(signal -> {
          workerActivity.finished();
          sample.stop(meterRegistry.timer("scoreboard.jobs.processing", "type", type));
        });
  }
}
