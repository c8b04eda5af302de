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

import java.util.Map;
import lombok.Data;

/**
 * Score statistics of one exam. Scores are percentages.
 */
@Data
public class ExamStatistics {
  String examId;
  String examTitle;
  int totalStudents;
  int submittedCount;
  double completionRate;
  double averageScore;
  double medianScore;
  double highestScore;
  double lowestScore;
  /**
   * Population standard deviation of the completed scores.
   */
  double standardDeviation;
  /**
   * Bucket label to count, ordered from the highest bucket to the lowest.
   */
  Map<String, Integer> gradeDistribution;
}
