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

package com.rackspace.scoreboard.app.scoring;

/**
 * Letter grades from percentage scores.
 */
public final class Grades {

  private Grades() {
  }

  /**
   * Grade of a single result: A+ from 90, A from 80, B+ from 75, B from 70, C from 60,
   * D from 50, otherwise F.
   */
  public static String forResult(double percentage) {
    if (percentage >= 90) {
      return "A+";
    } else if (percentage >= 80) {
      return "A";
    } else if (percentage >= 75) {
      return "B+";
    } else if (percentage >= 70) {
      return "B";
    } else if (percentage >= 60) {
      return "C";
    } else if (percentage >= 50) {
      return "D";
    }
    return "F";
  }

  /**
   * Coarse grade of an average over many results, used by student summaries.
   */
  public static String forAverage(double averagePercentage) {
    if (averagePercentage >= 90) {
      return "A+";
    } else if (averagePercentage >= 80) {
      return "A";
    } else if (averagePercentage >= 70) {
      return "B";
    } else if (averagePercentage >= 60) {
      return "C";
    } else if (averagePercentage >= 50) {
      return "D";
    }
    return "F";
  }
}
