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

import com.rackspace.scoreboard.app.exceptions.ResultCalculationException;
import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.payload.ResultCalculationPayload;
import com.rackspace.scoreboard.app.scoring.ResultCalculator;
import com.rackspace.scoreboard.app.services.ActivityTrackingService;
import com.rackspace.scoreboard.app.services.ExamCatalogService;
import com.rackspace.scoreboard.app.services.ExamResultService;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Recalculates one participant's result from the stored attempt, such as after the answer key
 * of the exam was corrected.
 */
@Component
@Slf4j
public class ResultCalculationHandler extends AbstractJobHandler<ResultCalculationPayload> {

  private final ExamCatalogService examCatalogService;
  private final ExamResultService examResultService;
  private final ResultCalculator resultCalculator;
  private final ActivityTrackingService activityTrackingService;
  private final JobQueueService jobQueueService;
  private final Clock clock;

  @Autowired
  public ResultCalculationHandler(ExamCatalogService examCatalogService,
                                  ExamResultService examResultService,
                                  ResultCalculator resultCalculator,
                                  ActivityTrackingService activityTrackingService,
                                  JobQueueService jobQueueService,
                                  Clock clock) {
    super(JobType.RESULT_CALCULATION, ResultCalculationPayload.class);
    this.examCatalogService = examCatalogService;
    this.examResultService = examResultService;
    this.resultCalculator = resultCalculator;
    this.activityTrackingService = activityTrackingService;
    this.jobQueueService = jobQueueService;
    this.clock = clock;
  }

  @Override
  protected Mono<Void> handle(Job job, ResultCalculationPayload payload) {
    final String examId = payload.getExamId();
    final String participantId = payload.getParticipantId();

    return Mono.zip(
            examCatalogService.getExam(examId)
                .switchIfEmpty(Mono.error(() ->
                    new ResultCalculationException("Unknown exam " + examId))),
            examCatalogService.getAnswerKey(examId),
            examResultService.getAttempt(examId, participantId)
                .switchIfEmpty(Mono.error(() -> new ResultCalculationException(
                    String.format("No attempt of participant %s for exam %s", participantId,
                        examId))))
        )
        .map(loaded -> resultCalculator.calculate(
            loaded.getT1(), loaded.getT2(), loaded.getT3(), clock.instant()))
        .flatMap(examResultService::upsertResult)
        .flatMap(result -> {
          log.debug("Recalculated result of participant={} exam={}: {} ({})", participantId,
              examId, result.getScore(), result.getGrade());
          return activityTrackingService.recordResult(result);
        })
        .then(Mono.defer(() -> jobQueueService.enqueueDependents(examId)));
  }
}
