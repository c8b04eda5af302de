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

package com.rackspace.scoreboard.app.entities;

import java.time.Instant;
import java.util.Map;
import lombok.Data;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * The answers a participant submitted for an exam. Keyed by exam and participant, so a
 * resubmission replaces the earlier attempt.
 */
@Table("exam_attempts")
@Data
public class ExamAttempt {
  @PrimaryKeyColumn(value = "exam_id", type = PrimaryKeyType.PARTITIONED, ordinal = 0)
  String examId;

  @PrimaryKeyColumn(value = "participant_id", type = PrimaryKeyType.CLUSTERED, ordinal = 1)
  String participantId;

  /**
   * Question id to the selected option id.
   */
  @Column("selected_options")
  Map<String, String> selectedOptions;

  /**
   * Question id to marks awarded by a grader, which take precedence over the answer key.
   */
  @Column("marks_awarded")
  Map<String, Double> marksAwarded;

  @Column("start_time")
  Instant startTime;

  @Column("end_time")
  Instant endTime;

  @Column("submitted_at")
  Instant submittedAt;
}
