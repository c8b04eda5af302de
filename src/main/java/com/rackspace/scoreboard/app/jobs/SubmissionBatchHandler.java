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
import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.entities.ExamQuestion;
import com.rackspace.scoreboard.app.exceptions.ResultCalculationException;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.model.ItemFailure;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobProgress;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.Submission;
import com.rackspace.scoreboard.app.model.payload.SubmissionBatchPayload;
import com.rackspace.scoreboard.app.scoring.ResultCalculator;
import com.rackspace.scoreboard.app.services.ActivityTrackingService;
import com.rackspace.scoreboard.app.services.ExamCatalogService;
import com.rackspace.scoreboard.app.services.ExamResultService;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

/**
 * Scores and stores every submission of a batch. A submission that fails is recorded on the
 * job as an item failure and the rest of the batch carries on.
 */
@Component
@Slf4j
public class SubmissionBatchHandler extends AbstractJobHandler<SubmissionBatchPayload> {

  private final ExamCatalogService examCatalogService;
  private final ExamResultService examResultService;
  private final ResultCalculator resultCalculator;
  private final ActivityTrackingService activityTrackingService;
  private final JobQueueService jobQueueService;
  private final QueueProperties queueProperties;
  private final Clock clock;

  @Autowired
  public SubmissionBatchHandler(ExamCatalogService examCatalogService,
                                ExamResultService examResultService,
                                ResultCalculator resultCalculator,
                                ActivityTrackingService activityTrackingService,
                                JobQueueService jobQueueService,
                                QueueProperties queueProperties,
                                Clock clock) {
    super(JobType.SUBMISSION_BATCH, SubmissionBatchPayload.class);
    this.examCatalogService = examCatalogService;
    this.examResultService = examResultService;
    this.resultCalculator = resultCalculator;
    this.activityTrackingService = activityTrackingService;
    this.jobQueueService = jobQueueService;
    this.queueProperties = queueProperties;
    this.clock = clock;
  }

  @Override
  protected Mono<Void> handle(Job job, SubmissionBatchPayload payload) {
    final String examId = payload.getExamId();
    final List<Submission> submissions = payload.getSubmissions();
    final boolean skipValidation =
        payload.getOptions() != null && payload.getOptions().isSkipValidation();

    // a retry starts the batch over, the upserts make that safe
    final List<ItemFailure> failures = new ArrayList<>();
    job.setItemFailures(failures)
        .setProgress(progress(0, submissions.size()));

    final AtomicInteger processed = new AtomicInteger();
    final AtomicInteger succeeded = new AtomicInteger();

    return examCatalogService.getExam(examId)
        .switchIfEmpty(Mono.error(() -> new ResultCalculationException("Unknown exam " + examId)))
        .zipWith(examCatalogService.getAnswerKey(examId))
        .flatMapMany(examAndKey -> Flux.range(0, submissions.size())
            .concatMap(index -> processItem(examAndKey, submissions.get(index), skipValidation)
                .doOnNext(result -> succeeded.incrementAndGet())
                .onErrorResume(e -> {
                  final Submission submission = submissions.get(index);
                  log.debug("Submission {} of batch job={} failed: {}", index, job.getId(),
                      e.getMessage());
                  failures.add(new ItemFailure()
                      .setIndex(index)
                      .setParticipantId(submission != null ? submission.getParticipantId() : null)
                      .setMessage(JobQueueService.describe(e)));
                  return Mono.empty();
                })
                .then(Mono.defer(() -> reportProgress(job, processed.incrementAndGet())))))
        .then(Mono.defer(() -> {
          job.setProgress(progress(submissions.size(), submissions.size()));
          log.info("Batch job={} for exam={} stored {} of {} submissions", job.getId(), examId,
              succeeded.get(), submissions.size());
          return succeeded.get() > 0 ? jobQueueService.enqueueDependents(examId) : Mono.empty();
        }));
  }

  private Mono<ExamResult> processItem(Tuple2<Exam, List<ExamQuestion>> examAndKey,
                                       Submission submission, boolean skipValidation) {
    return Mono.defer(() -> {
      if (submission == null) {
        return Mono.error(new IllegalArgumentException("Submission is missing"));
      }
      if (!skipValidation) {
        resultCalculator.validate(submission, examAndKey.getT2());
      }
      final Exam exam = examAndKey.getT1();
      return examResultService.upsertAttempt(
              resultCalculator.toAttempt(exam.getExamId(), submission, clock.instant()))
          .map(attempt ->
              resultCalculator.calculate(exam, examAndKey.getT2(), attempt, clock.instant()))
          .flatMap(examResultService::upsertResult)
          .flatMap(result -> activityTrackingService.recordResult(result).thenReturn(result));
    });
  }

  private Mono<Void> reportProgress(Job job, int processed) {
    final int total = job.getProgress().getTotal();
    job.setProgress(progress(processed, total));
    if (processed < total && processed % queueProperties.getProgressUpdateInterval() == 0) {
      return jobQueueService.save(job).then();
    }
    return Mono.empty();
  }

  private static JobProgress progress(int current, int total) {
    return new JobProgress()
        .setCurrent(current)
        .setTotal(total)
        .setMessage(String.format("Processed %d of %d submissions", current, total));
  }
}
