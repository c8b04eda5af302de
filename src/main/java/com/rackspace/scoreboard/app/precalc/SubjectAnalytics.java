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

import java.util.List;
import lombok.Data;

@Data
public class SubjectAnalytics {
  String subjectId;
  int examCount;
  int resultCount;
  double averageScore;
  double highestScore;
  double lowestScore;
  List<ClassPerformance> performanceByClass;
  DifficultyTrend difficultyTrend;

  @Data
  public static class ClassPerformance {
    String classId;
    int resultCount;
    double averageScore;
  }
}
