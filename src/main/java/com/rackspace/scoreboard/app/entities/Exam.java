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
import lombok.Data;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("exams")
@Data
public class Exam {
  @PrimaryKey("exam_id")
  String examId;

  String title;

  @Column("subject_id")
  String subjectId;

  @Column("class_id")
  String classId;

  @Column("college_id")
  String collegeId;

  /**
   * Marks available in the exam. When absent or not positive, the sum of the question marks
   * is used instead.
   */
  @Column("total_marks")
  Double totalMarks;

  @Column("passing_marks")
  Double passingMarks;

  @Column("start_time")
  Instant startTime;

  @Column("end_time")
  Instant endTime;
}
