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

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsLast;

import com.google.common.math.Quantiles;
import com.google.common.math.Stats;
import com.rackspace.scoreboard.app.config.PrecalcProperties;
import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.precalc.StudentSummary.RecentActivity;
import com.rackspace.scoreboard.app.precalc.SubjectAnalytics.ClassPerformance;
import com.rackspace.scoreboard.app.ranking.RankedEntries;
import com.rackspace.scoreboard.app.ranking.RankingEngine;
import com.rackspace.scoreboard.app.scoring.Grades;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Computes the precalculated aggregate views from result rows. No I/O.
 */
@Component
public class AggregateComputations {

  /**
   * Lower bounds, in percent, of the grade distribution buckets. Scores below the last bound
   * land in the final bucket.
   */
  private static final int[] BUCKET_LOWER_BOUNDS = {95, 90, 85, 80, 75, 70, 65, 60};
  static final String BELOW_LOWEST_BUCKET = "0-59";

  private static final Comparator<ExamResult> MOST_RECENT_FIRST =
      comparing(AggregateComputations::activityTime, nullsLast(Comparator.<Instant>reverseOrder()));

  private final PrecalcProperties properties;

  @Autowired
  public AggregateComputations(PrecalcProperties properties) {
    this.properties = properties;
  }

  public ExamStatistics examStatistics(String examId, Exam exam, List<ExamResult> results) {
    final double[] scores = completed(results).stream()
        .mapToDouble(ExamResult::getPercentage)
        .toArray();

    final ExamStatistics statistics = new ExamStatistics()
        .setExamId(examId)
        .setExamTitle(exam != null ? exam.getTitle() : null)
        .setTotalStudents(results.size())
        .setSubmittedCount(scores.length)
        .setCompletionRate(results.isEmpty() ? 0 : scores.length * 100.0 / results.size())
        .setGradeDistribution(gradeDistribution(scores));

    if (scores.length > 0) {
      final Stats stats = Stats.of(scores);
      statistics
          .setAverageScore(stats.mean())
          .setMedianScore(Quantiles.median().compute(scores))
          .setHighestScore(stats.max())
          .setLowestScore(stats.min())
          .setStandardDeviation(stats.populationStandardDeviation());
    }
    return statistics;
  }

  /**
   * @param exams exams referenced by the results, used for activity titles
   */
  public StudentSummary studentSummary(String participantId, List<ExamResult> results,
                                       Map<String, Exam> exams) {
    final List<ExamResult> window = results.stream()
        .sorted(MOST_RECENT_FIRST)
        .limit(properties.getStudentWindow())
        .collect(Collectors.toList());
    final List<ExamResult> completedWindow = completed(window);

    final double average = mean(completedWindow);
    return new StudentSummary()
        .setParticipantId(participantId)
        .setTotalExams(results.size())
        .setCompletedExams(completed(results).size())
        .setAverageScore(average)
        .setOverallGrade(completedWindow.isEmpty() ? "N/A" : Grades.forAverage(average))
        .setTrend(trend(completedWindow))
        .setSubjectAverages(subjectAverages(completedWindow))
        .setRecentActivity(completedWindow.stream()
            .limit(properties.getRecentActivityCount())
            .map(result -> new RecentActivity()
                .setExamId(result.getExamId())
                .setExamTitle(exams.containsKey(result.getExamId()) ?
                    exams.get(result.getExamId()).getTitle() : null)
                .setScore(result.getScore())
                .setPercentage(result.getPercentage())
                .setDate(activityTime(result)))
            .collect(Collectors.toList()));
  }

  /**
   * Ranks the active participants of a class across every exam of the class.
   */
  public ClassRankings classRankings(String classId, List<ExamResult> results,
                                     Set<String> activeParticipants,
                                     Map<String, String> rollNumbers) {
    final List<ExamResult> enrolled = results.stream()
        .filter(result -> activeParticipants.contains(result.getParticipantId()))
        .collect(Collectors.toList());
    return new ClassRankings()
        .setClassId(classId)
        .setTotalParticipants(activeParticipants.size())
        .setStandings(RankingEngine.leaderboard(
            RankedEntries.cumulative(enrolled, rollNumbers::get)));
  }

  /**
   * @param exams exams of the subject, used to order exams when computing the difficulty trend
   */
  public SubjectAnalytics subjectAnalytics(String subjectId, List<ExamResult> results,
                                           Map<String, Exam> exams) {
    final List<ExamResult> completed = completed(results);
    final double[] scores = completed.stream().mapToDouble(ExamResult::getPercentage).toArray();

    final SubjectAnalytics analytics = new SubjectAnalytics()
        .setSubjectId(subjectId)
        .setExamCount((int) results.stream().map(ExamResult::getExamId)
            .filter(examId -> !exams.containsKey(examId))
            .distinct()
            .count() + exams.size())
        .setResultCount(completed.size())
        .setPerformanceByClass(performanceByClass(completed))
        .setDifficultyTrend(difficultyTrend(completed, exams));
    if (scores.length > 0) {
      final Stats stats = Stats.of(scores);
      analytics
          .setAverageScore(stats.mean())
          .setHighestScore(stats.max())
          .setLowestScore(stats.min());
    }
    return analytics;
  }

  static Map<String, Integer> gradeDistribution(double[] scores) {
    final Map<String, Integer> buckets = new LinkedHashMap<>();
    for (int i = 0; i < BUCKET_LOWER_BOUNDS.length; i++) {
      buckets.put(bucketLabel(i), 0);
    }
    buckets.put(BELOW_LOWEST_BUCKET, 0);

    for (double score : scores) {
      buckets.merge(bucketFor(score), 1, Integer::sum);
    }
    return buckets;
  }

  static String bucketFor(double score) {
    for (int i = 0; i < BUCKET_LOWER_BOUNDS.length; i++) {
      if (score >= BUCKET_LOWER_BOUNDS[i]) {
        return bucketLabel(i);
      }
    }
    return BELOW_LOWEST_BUCKET;
  }

  private static String bucketLabel(int index) {
    final int upper = index == 0 ? 100 : BUCKET_LOWER_BOUNDS[index - 1] - 1;
    return BUCKET_LOWER_BOUNDS[index] + "-" + upper;
  }

  /**
   * Compares the mean of the most recent half of the trend window with the older half.
   *
   * @param completedWindow completed results, most recent first
   */
  Trend trend(List<ExamResult> completedWindow) {
    final int size = Math.min(properties.getTrendWindow(), completedWindow.size());
    final int recentCount = size / 2;
    final List<ExamResult> recent = completedWindow.subList(0, recentCount);
    final List<ExamResult> older = completedWindow.subList(recentCount, size);
    if (recent.size() < properties.getTrendMinimumPerHalf()
        || older.size() < properties.getTrendMinimumPerHalf()) {
      return Trend.STABLE;
    }

    final double difference = mean(recent) - mean(older);
    if (difference > properties.getTrendDeadband()) {
      return Trend.IMPROVING;
    } else if (difference < -properties.getTrendDeadband()) {
      return Trend.DECLINING;
    }
    return Trend.STABLE;
  }

  private DifficultyTrend difficultyTrend(List<ExamResult> completed, Map<String, Exam> exams) {
    final Map<String, List<ExamResult>> byExam = completed.stream()
        .collect(Collectors.groupingBy(ExamResult::getExamId));
    if (byExam.size() < 2) {
      return DifficultyTrend.STABLE;
    }

    // oldest exam first
    final List<Double> examAverages = byExam.entrySet().stream()
        .sorted(comparing(entry -> examTime(exams.get(entry.getKey()), entry.getValue()),
            nullsLast(naturalOrder())))
        .map(entry -> mean(entry.getValue()))
        .collect(Collectors.toList());
    final int olderCount = examAverages.size() / 2;
    final double difference =
        Stats.meanOf(examAverages.subList(olderCount, examAverages.size()))
            - Stats.meanOf(examAverages.subList(0, olderCount));

    if (difference > properties.getTrendDeadband()) {
      return DifficultyTrend.EASIER;
    } else if (difference < -properties.getTrendDeadband()) {
      return DifficultyTrend.HARDER;
    }
    return DifficultyTrend.STABLE;
  }

  private static Instant examTime(Exam exam, List<ExamResult> results) {
    if (exam != null && exam.getStartTime() != null) {
      return exam.getStartTime();
    }
    return results.stream()
        .map(AggregateComputations::activityTime)
        .filter(time -> time != null)
        .min(naturalOrder())
        .orElse(null);
  }

  private static List<ClassPerformance> performanceByClass(List<ExamResult> completed) {
    final Map<String, List<ExamResult>> byClass = new TreeMap<>(completed.stream()
        .filter(result -> result.getClassId() != null)
        .collect(Collectors.groupingBy(ExamResult::getClassId)));
    final List<ClassPerformance> performance = new ArrayList<>(byClass.size());
    byClass.forEach((classId, classResults) -> performance.add(new ClassPerformance()
        .setClassId(classId)
        .setResultCount(classResults.size())
        .setAverageScore(mean(classResults))));
    return performance;
  }

  private static Map<String, Double> subjectAverages(List<ExamResult> completed) {
    return new TreeMap<>(completed.stream()
        .filter(result -> result.getSubjectId() != null)
        .collect(Collectors.groupingBy(ExamResult::getSubjectId,
            Collectors.averagingDouble(ExamResult::getPercentage))));
  }

  private static List<ExamResult> completed(List<ExamResult> results) {
    return results.stream().filter(ExamResult::isCompleted).collect(Collectors.toList());
  }

  private static double mean(Collection<ExamResult> results) {
    if (results.isEmpty()) {
      return 0;
    }
    return Stats.meanOf(results.stream().mapToDouble(ExamResult::getPercentage).toArray());
  }

  static Instant activityTime(ExamResult result) {
    return result.getEndTime() != null ? result.getEndTime() : result.getUpdatedAt();
  }
}
