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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class StudentSummary {
  String participantId;
  int totalExams;
  int completedExams;
  /**
   * Mean percentage of the completed results inside the window.
   */
  double averageScore;
  String overallGrade;
  Trend trend;
  /**
   * Subject id to mean percentage.
   */
  Map<String, Double> subjectAverages;
  List<RecentActivity> recentActivity;

  @Data
  public static class RecentActivity {
    String examId;
    String examTitle;
    double score;
    double percentage;
    Instant date;
  }
}
