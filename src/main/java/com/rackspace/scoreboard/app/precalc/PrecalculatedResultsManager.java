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

package com.rackspace.scoreboard.app.precalc;

import com.rackspace.scoreboard.app.config.PrecalcProperties;
import com.rackspace.scoreboard.app.config.PrecalcProperties.Category;
import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.services.ActivityTrackingService;
import com.rackspace.scoreboard.app.services.ExamCatalogService;
import com.rackspace.scoreboard.app.services.ExamResultService;
import com.rackspace.scoreboard.app.services.ResultCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Periodically recomputes the aggregate views of recently active targets and writes them to
 * the cache. Every category has its own timer and a guard that skips a tick while the
 * previous run of that category is still going.
 */
@Service
@Slf4j
public class PrecalculatedResultsManager {

  private final PrecalcProperties properties;
  private final ActivityTrackingService activityTrackingService;
  private final ExamResultService examResultService;
  private final ExamCatalogService examCatalogService;
  private final ResultCacheService resultCacheService;
  private final AggregateComputations computations;
  private final ScheduledExecutorService executor;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Map<AggregateCategory, CategoryState> states = new EnumMap<>(AggregateCategory.class);

  @Autowired
  public PrecalculatedResultsManager(PrecalcProperties properties,
                                     ActivityTrackingService activityTrackingService,
                                     ExamResultService examResultService,
                                     ExamCatalogService examCatalogService,
                                     ResultCacheService resultCacheService,
                                     AggregateComputations computations,
                                     ScheduledExecutorService executor,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
    this.properties = properties;
    this.activityTrackingService = activityTrackingService;
    this.examResultService = examResultService;
    this.examCatalogService = examCatalogService;
    this.resultCacheService = resultCacheService;
    this.computations = computations;
    this.executor = executor;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    for (AggregateCategory category : AggregateCategory.values()) {
      states.put(category, new CategoryState());
    }
  }

  @PostConstruct
  public void setupSchedulers() {
    final long initialDelay = properties.getInitialDelay().toMillis();
    for (AggregateCategory category : AggregateCategory.values()) {
      final Category settings = properties.settingsFor(category);
      if (!settings.isEnabled()) {
        log.info("Precalculation of {} is disabled", category.getKey());
        continue;
      }
      log.info("Precalculating {} every {} for up to {} targets active within {}",
          category.getKey(), settings.getUpdateInterval(), settings.getBatchSize(),
          settings.getLookback());
      executor.scheduleAtFixedRate(() -> runScheduled(category),
          initialDelay, settings.getUpdateInterval().toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void runScheduled(AggregateCategory category) {
    refreshCategory(category)
        .subscribe(
            count -> log.debug("Precalculated {} for {} targets", category.getKey(), count),
            e -> log.error("Precalculation of {} failed", category.getKey(), e)
        );
  }

  /**
   * Recomputes the active targets of the category.
   *
   * @return the number of targets recomputed, or empty when a run of the category was
   * already in progress and this one was skipped
   */
  public Mono<Integer> refreshCategory(AggregateCategory category) {
    final CategoryState state = states.get(category);
    if (!state.running.compareAndSet(false, true)) {
      state.skipped.incrementAndGet();
      meterRegistry.counter("scoreboard.precalc.skipped", "category", category.getKey())
          .increment();
      log.warn("Skipping {} recompute, previous run still in progress", category.getKey());
      return Mono.empty();
    }

    final Category settings = properties.settingsFor(category);
    state.lastStarted = clock.instant();
    return activityTrackingService.getActiveTargets(
            category.getTargetKind(), settings.getLookback(), settings.getBatchSize())
        .concatMap(targetId -> refreshTarget(category, targetId)
            .thenReturn(targetId)
            .onErrorResume(e -> {
              // the target stays active, so the next tick retries it
              log.error("Failed to precalculate {} of {}", category.getKey(), targetId, e);
              return Mono.empty();
            }))
        .count()
        .map(Long::intValue)
        .name("scoreboard.precalc.sweep")
        .tag("category", category.getKey())
        .metrics()
        .doOnNext(count -> state.lastTargetCount = count)
        .doFinally(signal -> {
          state.lastFinished = clock.instant();
          state.running.set(false);
        });
  }

  /**
   * Runs every category once, in order, and waits for them. Categories already running are
   * skipped and absent from the returned map.
   */
  public Mono<Map<AggregateCategory, Integer>> forceRefresh() {
    log.info("Forced refresh of all precalculated results");
    return Flux.fromArray(AggregateCategory.values())
        .concatMap(category -> refreshCategory(category)
            .map(count -> Map.entry(category, count)))
        .collectMap(Map.Entry::getKey, Map.Entry::getValue,
            () -> new EnumMap<>(AggregateCategory.class));
  }

  /**
   * Recomputes a single target of the category and caches the result.
   */
  public Mono<CachedAggregate<?>> refreshTarget(AggregateCategory category, String targetId) {
    final Mono<?> payload;
    switch (category) {
      case EXAM_STATS:
        payload = computeExamStatistics(targetId);
        break;
      case STUDENT_SUMMARIES:
        payload = computeStudentSummary(targetId);
        break;
      case CLASS_RANKINGS:
        payload = computeClassRankings(targetId);
        break;
      case SUBJECT_ANALYTICS:
        payload = computeSubjectAnalytics(targetId);
        break;
      default:
        return Mono.error(new IllegalArgumentException("Unknown aggregate category " + category));
    }
    return payload.flatMap(value -> store(category, targetId, value));
  }

  public List<ProcessingStatus> getProcessingStatus() {
    return Arrays.stream(AggregateCategory.values())
        .map(category -> {
          final Category settings = properties.settingsFor(category);
          final CategoryState state = states.get(category);
          return new ProcessingStatus()
              .setCategory(category)
              .setEnabled(settings.isEnabled())
              .setUpdateInterval(settings.getUpdateInterval())
              .setBatchSize(settings.getBatchSize())
              .setRunning(state.running.get())
              .setLastStarted(state.lastStarted)
              .setLastFinished(state.lastFinished)
              .setLastTargetCount(state.lastTargetCount)
              .setSkippedTicks(state.skipped.get());
        })
        .collect(Collectors.toList());
  }

  private Mono<CachedAggregate<?>> store(AggregateCategory category, String targetId,
                                         Object payload) {
    final CachedAggregate<Object> aggregate = new CachedAggregate<>()
        .setCacheKey(encodeAggregateKey(category, targetId))
        .setCategory(category)
        .setTargetId(targetId)
        .setPayload(payload)
        .setLastUpdated(clock.instant());
    return resultCacheService.put(aggregate.getCacheKey(), aggregate,
            properties.settingsFor(category).effectiveTtl())
        .thenReturn(aggregate);
  }

  private Mono<ExamStatistics> computeExamStatistics(String examId) {
    return Mono.zip(
            examCatalogService.getExam(examId).map(Optional::of).defaultIfEmpty(Optional.empty()),
            examResultService.getResultsForExam(examId).collectList())
        .map(tuple -> computations.examStatistics(examId, tuple.getT1().orElse(null),
            tuple.getT2()));
  }

  private Mono<StudentSummary> computeStudentSummary(String participantId) {
    return examResultService.getResultsForParticipant(participantId)
        .collectList()
        .flatMap(results -> loadExams(results.stream()
                .map(ExamResult::getExamId)
                .collect(Collectors.toSet()))
            .map(exams -> computations.studentSummary(participantId, results, exams)));
  }

  private Mono<ClassRankings> computeClassRankings(String classId) {
    return Mono.zip(
            examResultService.getResultsForClass(classId).collectList(),
            examCatalogService.getActiveParticipants(classId).collect(Collectors.toSet()))
        .flatMap(tuple -> examCatalogService.getRollNumbers(tuple.getT2())
            .map(rollNumbers -> computations.classRankings(
                classId, tuple.getT1(), tuple.getT2(), rollNumbers)));
  }

  private Mono<SubjectAnalytics> computeSubjectAnalytics(String subjectId) {
    return examCatalogService.getExamIdsForSubject(subjectId)
        .collect(Collectors.toSet())
        .flatMap(examIds -> Mono.zip(
            loadExams(examIds),
            Flux.fromIterable(examIds)
                .concatMap(examResultService::getResultsForExam)
                .collectList()))
        .map(tuple -> computations.subjectAnalytics(subjectId, tuple.getT2(), tuple.getT1()));
  }

  private Mono<Map<String, Exam>> loadExams(Collection<String> examIds) {
    return Flux.fromIterable(new HashSet<>(examIds))
        .flatMap(examCatalogService::getExam)
        .collectMap(Exam::getExamId);
  }

  public static String encodeAggregateKey(AggregateCategory category, String targetId) {
    return encodeCategoryPrefix(category) + targetId;
  }

  public static String encodeCategoryPrefix(AggregateCategory category) {
    return String.format("precalc|%s|", category.getKey());
  }

  private static class CategoryState {
    final AtomicBoolean running = new AtomicBoolean();
    final AtomicLong skipped = new AtomicLong();
    volatile Instant lastStarted;
    volatile Instant lastFinished;
    volatile int lastTargetCount;
  }
}
