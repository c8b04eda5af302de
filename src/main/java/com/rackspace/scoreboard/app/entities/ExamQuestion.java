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

import lombok.Data;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Answer key entry of one question of an exam.
 */
@Table("exam_questions")
@Data
public class ExamQuestion {
  @PrimaryKeyColumn(value = "exam_id", type = PrimaryKeyType.PARTITIONED, ordinal = 0)
  String examId;

  @PrimaryKeyColumn(value = "question_id", type = PrimaryKeyType.CLUSTERED, ordinal = 1)
  String questionId;

  double marks;

  @Column("correct_option_id")
  String correctOptionId;
}
