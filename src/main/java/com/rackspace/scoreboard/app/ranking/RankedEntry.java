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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.Data;

/**
 * A participant's standing input. Built transiently from result rows; only ranked sequences
 * of entries are cached.
 */
@Data
@JsonInclude(Include.NON_NULL)
public class RankedEntry {
  String participantId;
  /**
   * Marks obtained, summed over every result the entry covers. Primary ranking key.
   */
  double totalMarks;
  /**
   * Marks available, summed over every result the entry covers.
   */
  double maxMarks;
  /**
   * Exam percentage, or the mean percentage for cumulative entries.
   */
  double percentage;
  /**
   * Percentage of the most recently completed result. Missing counts as zero when ranking.
   */
  Double recentPerformance;
  Long completionDurationMs;
  /**
   * Stable secondary identifier, the roll number.
   */
  String tiebreakKey;
  int examsCounted;
}
