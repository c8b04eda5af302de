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

import static org.springframework.data.cassandra.core.query.Criteria.where;
import static org.springframework.data.cassandra.core.query.Query.query;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.entities.ClassEnrollment;
import com.rackspace.scoreboard.app.entities.EnrollmentStatus;
import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.entities.ExamByClass;
import com.rackspace.scoreboard.app.entities.ExamBySubject;
import com.rackspace.scoreboard.app.entities.ExamQuestion;
import com.rackspace.scoreboard.app.entities.Participant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.ReactiveCassandraTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to exams, answer keys, participants and class enrollment. Exams, answer keys
 * and participants are cached locally since every submission consults them.
 */
@Service
@Slf4j
public class ExamCatalogService {

  private static final String COL_EXAM_ID = "exam_id";
  private static final String COL_SUBJECT_ID = "subject_id";
  private static final String COL_CLASS_ID = "class_id";

  private final ReactiveCassandraTemplate cassandraTemplate;
  private final AsyncCache<String, Exam> examCache;
  private final AsyncCache<String, List<ExamQuestion>> answerKeyCache;
  private final AsyncCache<String, Participant> participantCache;
  private final AppProperties appProperties;
  private final Counter readDbOperationErrorsCounter;
  private final Counter writeDbOperationErrorsCounter;

  @Autowired
  public ExamCatalogService(ReactiveCassandraTemplate cassandraTemplate,
                            AsyncCache<String, Exam> examCache,
                            AsyncCache<String, List<ExamQuestion>> answerKeyCache,
                            AsyncCache<String, Participant> participantCache,
                            AppProperties appProperties,
                            MeterRegistry meterRegistry) {
    this.cassandraTemplate = cassandraTemplate;
    this.examCache = examCache;
    this.answerKeyCache = answerKeyCache;
    this.participantCache = participantCache;
    this.appProperties = appProperties;
    readDbOperationErrorsCounter = meterRegistry.counter("scoreboard.db.operation.errors",
        "type", "read");
    writeDbOperationErrorsCounter = meterRegistry.counter("scoreboard.db.operation.errors",
        "type", "write");
  }

  /**
   * @return the exam or empty when it does not exist
   */
  public Mono<Exam> getExam(String examId) {
    return Mono.fromFuture(examCache.get(examId, (key, executor) ->
        cassandraTemplate.selectOneById(key, Exam.class)
            .retryWhen(appProperties.getRetryQueryResults().build())
            .doOnError(e -> readDbOperationErrorsCounter.increment())
            .toFuture()
    ));
  }

  public Mono<List<ExamQuestion>> getAnswerKey(String examId) {
    return Mono.fromFuture(answerKeyCache.get(examId, (key, executor) ->
        cassandraTemplate.select(query(where(COL_EXAM_ID).is(key)), ExamQuestion.class)
            .collectList()
            .retryWhen(appProperties.getRetryQueryResults().build())
            .doOnError(e -> readDbOperationErrorsCounter.increment())
            .toFuture()
    ));
  }

  public Mono<Participant> getParticipant(String participantId) {
    return Mono.fromFuture(participantCache.get(participantId, (key, executor) ->
        cassandraTemplate.selectOneById(key, Participant.class)
            .retryWhen(appProperties.getRetryQueryResults().build())
            .doOnError(e -> readDbOperationErrorsCounter.increment())
            .toFuture()
    ));
  }

  /**
   * Resolves roll numbers. Participants that are unknown or have no roll number are absent
   * from the returned map.
   */
  public Mono<Map<String, String>> getRollNumbers(Collection<String> participantIds) {
    return Flux.fromIterable(participantIds)
        .flatMap(this::getParticipant)
        .filter(participant -> participant.getRollNumber() != null)
        .collectMap(Participant::getParticipantId, Participant::getRollNumber);
  }

  public Flux<String> getActiveParticipants(String classId) {
    return cassandraTemplate.select(query(where(COL_CLASS_ID).is(classId)), ClassEnrollment.class)
        .filter(enrollment -> enrollment.getStatus() == EnrollmentStatus.ACTIVE)
        .map(ClassEnrollment::getParticipantId)
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Flux<String> getExamIdsForSubject(String subjectId) {
    return cassandraTemplate.select(query(where(COL_SUBJECT_ID).is(subjectId)), ExamBySubject.class)
        .map(ExamBySubject::getExamId)
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Flux<String> getExamIdsForClass(String classId) {
    return cassandraTemplate.select(query(where(COL_CLASS_ID).is(classId)), ExamByClass.class)
        .map(ExamByClass::getExamId)
        .doOnError(e -> readDbOperationErrorsCounter.increment());
  }

  public Mono<Exam> saveExam(Exam exam) {
    final Mono<?> bySubject = exam.getSubjectId() == null ? Mono.empty() :
        cassandraTemplate.insert(new ExamBySubject()
            .setSubjectId(exam.getSubjectId())
            .setExamId(exam.getExamId()));
    final Mono<?> byClass = exam.getClassId() == null ? Mono.empty() :
        cassandraTemplate.insert(new ExamByClass()
            .setClassId(exam.getClassId())
            .setExamId(exam.getExamId()));

    return cassandraTemplate.insert(exam)
        .and(bySubject)
        .and(byClass)
        .retryWhen(appProperties.getRetryInsertCatalog().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment())
        .doOnSuccess(v -> examCache.synchronous().invalidate(exam.getExamId()))
        .thenReturn(exam);
  }

  public Mono<List<ExamQuestion>> saveAnswerKey(String examId, List<ExamQuestion> questions) {
    return Flux.fromIterable(questions)
        .map(question -> question.setExamId(examId))
        .concatMap(question -> cassandraTemplate.insert(question))
        .retryWhen(appProperties.getRetryInsertCatalog().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment())
        .then(Mono.fromRunnable(() -> answerKeyCache.synchronous().invalidate(examId)))
        .thenReturn(questions);
  }

  public Mono<Participant> saveParticipant(Participant participant) {
    return cassandraTemplate.insert(participant)
        .retryWhen(appProperties.getRetryInsertCatalog().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment())
        .doOnSuccess(p -> participantCache.synchronous().invalidate(participant.getParticipantId()));
  }

  public Mono<ClassEnrollment> enroll(ClassEnrollment enrollment) {
    return cassandraTemplate.insert(enrollment)
        .retryWhen(appProperties.getRetryInsertCatalog().build())
        .doOnError(e -> writeDbOperationErrorsCounter.increment());
  }
}
