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

package com.rackspace.scoreboard.app.model;

import java.time.Instant;
import java.util.Map;
import lombok.Data;

/**
 * One participant's answers to an exam, as delivered in a submission batch.
 */
@Data
public class Submission {
  String participantId;
  /**
   * Question id to the selected option id.
   */
  Map<String, String> answers;
  /**
   * Question id to marks awarded by a grader. Positive values override the answer key.
   */
  Map<String, Double> marksAwarded;
  Instant startTime;
  Instant endTime;
}
