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

import static com.rackspace.scoreboard.app.services.ResultTablesStatements.*;
import static org.springframework.data.cassandra.core.query.Criteria.where;
import static org.springframework.data.cassandra.core.query.Query.query;

import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.entities.ExamAttempt;
import com.rackspace.scoreboard.app.model.ExamResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.ReactiveCassandraTemplate;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Authoritative storage of exam attempts and results. Every write is an upsert keyed by
 * exam and participant, so re-running a job leaves a single row with the latest values.
 */
@Service
@Slf4j
public class ExamResultService {

  private final ReactiveCqlTemplate cqlTemplate;
  private final ReactiveCassandraTemplate cassandraTemplate;
  private final ExamCatalogService examCatalogService;
  private final AppProperties appProperties;
  private final Counter writeDbOperationErrorsCounter;
  private final Counter readDbOperationErrorsCounter;

  @Autowired
  public ExamResultService(ReactiveCqlTemplate cqlTemplate,
                           ReactiveCassandraTemplate cassandraTemplate,
                           ExamCatalogService examCatalogService,
                           AppProperties appProperties,
                           MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.cassandraTemplate = cassandraTemplate;
    this.examCatalogService = examCatalogService;
    this.appProperties = appProperties;
    writeDbOperationErrorsCounter = meterRegistry.counter("scoreboard.db.operation.errors",
        "type", "write");
    readDbOperationErrorsCounter = meterRegistry.counter("scoreboard.db.operation.errors",
        "type", "read");
  }

  /**
   * Writes the result to both result tables in one logged batch.
   */
  public Mono<ExamResult> upsertResult(ExamResult result) {
    log.trace("Upserting result exam={} participant={}", result.getExamId(),
        result.getParticipantId());
    final Object[] values = {
        // EXAM_ID, PARTICIPANT_ID, SUBJECT_ID, CLASS_ID, SCORE, TOTAL_MARKS, PERCENTAGE,
        // GRADE, START_TIME, END_TIME, COMPLETED, UPDATED_AT
        result.getExamId(),
        result.getParticipantId(),
        result.getSubjectId(),
        result.getClassId(),
        result.getScore(),
        result.getTotalMarks(),
        result.getPercentage(),
        result.getGrade(),
        result.getStartTime(),
        result.getEndTime(),
        result.isCompleted(),
        result.getUpdatedAt()
    };
    final BatchStatementBuilder batchStatementBuilder = new BatchStatementBuilder(BatchType.LOGGED);
    batchStatementBuilder.addStatement(SimpleStatement.newInstance(UPSERT_BY_EXAM, values));
    batchStatementBuilder.addStatement(SimpleStatement.newInstance(UPSERT_BY_PARTICIPANT, values));

    return cqlTemplate.execute(batchStatementBuilder.build())
        .retryWhen(appProperties.getRetryInsertResult().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment())
        .checkpoint()
        .thenReturn(result);
  }

  public Mono<ExamResult> getResult(String examId, String participantId) {
    return cqlTemplate.queryForObject(SELECT_ONE, ExamResultService::mapRow, examId, participantId)
        .retryWhen(appProperties.getRetryQueryResults().build())
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Flux<ExamResult> getResultsForExam(String examId) {
    return cqlTemplate.query(SELECT_BY_EXAM, ExamResultService::mapRow, examId)
        .name("resultsForExam")
        .metrics()
        .retryWhen(appProperties.getRetryQueryResults().build())
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Flux<ExamResult> getResultsForParticipant(String participantId) {
    return cqlTemplate.query(SELECT_BY_PARTICIPANT, ExamResultService::mapRow, participantId)
        .name("resultsForParticipant")
        .metrics()
        .retryWhen(appProperties.getRetryQueryResults().build())
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Flux<ExamResult> getResultsForSubject(String subjectId) {
    return examCatalogService.getExamIdsForSubject(subjectId)
        .concatMap(this::getResultsForExam);
  }

  public Flux<ExamResult> getResultsForClass(String classId) {
    return examCatalogService.getExamIdsForClass(classId)
        .concatMap(this::getResultsForExam);
  }

  public Mono<ExamAttempt> upsertAttempt(ExamAttempt attempt) {
    return cassandraTemplate.insert(attempt)
        .retryWhen(appProperties.getRetryInsertResult().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment());
  }

  public Mono<ExamAttempt> getAttempt(String examId, String participantId) {
    return cassandraTemplate.selectOne(
            query(
                where(EXAM_ID).is(examId),
                where(PARTICIPANT_ID).is(participantId)
            ),
            ExamAttempt.class
        )
        .retryWhen(appProperties.getRetryQueryResults().build())
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  static ExamResult mapRow(Row row, int rowNum) {
    return new ExamResult()
        .setExamId(row.getString(EXAM_ID))
        .setParticipantId(row.getString(PARTICIPANT_ID))
        .setSubjectId(row.getString(SUBJECT_ID))
        .setClassId(row.getString(CLASS_ID))
        .setScore(row.getDouble(SCORE))
        .setTotalMarks(row.getDouble(TOTAL_MARKS))
        .setPercentage(row.getDouble(PERCENTAGE))
        .setGrade(row.getString(GRADE))
        .setStartTime(row.getInstant(START_TIME))
        .setEndTime(row.getInstant(END_TIME))
        .setCompleted(row.getBoolean(COMPLETED))
        .setUpdatedAt(row.getInstant(UPDATED_AT));
  }
}
