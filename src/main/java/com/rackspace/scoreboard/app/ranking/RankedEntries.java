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

package com.rackspace.scoreboard.app.ranking;

import com.rackspace.scoreboard.app.model.ExamResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds ranking input from result rows.
 */
public final class RankedEntries {

  private RankedEntries() {
  }

  /**
   * One entry per result of a single exam. Recent performance is the exam's own percentage
   * and the completion duration is the time between start and end.
   *
   * @param tiebreakKeys resolves the tie-break key of a participant, may return null
   */
  public static List<RankedEntry> forExam(Collection<ExamResult> results,
                                          Function<String, String> tiebreakKeys) {
    final List<RankedEntry> entries = new ArrayList<>(results.size());
    for (ExamResult result : results) {
      entries.add(new RankedEntry()
          .setParticipantId(result.getParticipantId())
          .setTotalMarks(result.getScore())
          .setMaxMarks(result.getTotalMarks())
          .setPercentage(result.getPercentage())
          .setRecentPerformance(result.getPercentage())
          .setCompletionDurationMs(completionDuration(result.getStartTime(), result.getEndTime()))
          .setTiebreakKey(tiebreakKeys.apply(result.getParticipantId()))
          .setExamsCounted(1));
    }
    return entries;
  }

  /**
   * One entry per participant across many exams. Marks are summed, percentage is the mean,
   * and recent performance is the percentage of the result with the latest end time.
   * Cumulative entries carry no completion duration.
   */
  public static List<RankedEntry> cumulative(Collection<ExamResult> results,
                                             Function<String, String> tiebreakKeys) {
    final Map<String, Accumulator> byParticipant = new LinkedHashMap<>();
    for (ExamResult result : results) {
      byParticipant.computeIfAbsent(result.getParticipantId(), id -> new Accumulator())
          .add(result);
    }

    final List<RankedEntry> entries = new ArrayList<>(byParticipant.size());
    byParticipant.forEach((participantId, acc) -> entries.add(new RankedEntry()
        .setParticipantId(participantId)
        .setTotalMarks(acc.score)
        .setMaxMarks(acc.totalMarks)
        .setPercentage(acc.count > 0 ? acc.percentageSum / acc.count : 0)
        .setRecentPerformance(acc.recent)
        .setTiebreakKey(tiebreakKeys.apply(participantId))
        .setExamsCounted(acc.count)));
    return entries;
  }

  static Long completionDuration(Instant start, Instant end) {
    if (start == null || end == null) {
      return null;
    }
    return Duration.between(start, end).toMillis();
  }

  private static class Accumulator {
    double score;
    double totalMarks;
    double percentageSum;
    int count;
    Double recent;
    Instant latestEnd;

    void add(ExamResult result) {
      score += result.getScore();
      totalMarks += result.getTotalMarks();
      percentageSum += result.getPercentage();
      count++;
      if (result.getEndTime() != null
          && (latestEnd == null || result.getEndTime().isAfter(latestEnd))) {
        latestEnd = result.getEndTime();
        recent = result.getPercentage();
      }
    }
  }
}
