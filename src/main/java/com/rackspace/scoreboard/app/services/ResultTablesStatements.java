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

package com.rackspace.scoreboard.app.services;

/**
 * Column names and statements of the result tables. Results are written to two tables, one
 * partitioned by exam and one by participant, so that both read paths are single-partition
 * queries.
 */
public final class ResultTablesStatements {

  public static final String TABLE_BY_EXAM = "exam_results";
  public static final String TABLE_BY_PARTICIPANT = "results_by_participant";

  public static final String EXAM_ID = "exam_id";
  public static final String PARTICIPANT_ID = "participant_id";
  public static final String SUBJECT_ID = "subject_id";
  public static final String CLASS_ID = "class_id";
  public static final String SCORE = "score";
  public static final String TOTAL_MARKS = "total_marks";
  public static final String PERCENTAGE = "percentage";
  public static final String GRADE = "grade";
  public static final String START_TIME = "start_time";
  public static final String END_TIME = "end_time";
  public static final String COMPLETED = "completed";
  public static final String UPDATED_AT = "updated_at";

  private static final String COLUMNS = String.join(",",
      EXAM_ID, PARTICIPANT_ID, SUBJECT_ID, CLASS_ID, SCORE, TOTAL_MARKS, PERCENTAGE, GRADE,
      START_TIME, END_TIME, COMPLETED, UPDATED_AT);

  // INSERT replaces the row with the same primary key
  public static final String UPSERT_BY_EXAM = String.format(
      "INSERT INTO %s (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", TABLE_BY_EXAM, COLUMNS);
  public static final String UPSERT_BY_PARTICIPANT = String.format(
      "INSERT INTO %s (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", TABLE_BY_PARTICIPANT,
      COLUMNS);

  public static final String SELECT_BY_EXAM = String.format(
      "SELECT %s FROM %s WHERE %s = ?", COLUMNS, TABLE_BY_EXAM, EXAM_ID);
  public static final String SELECT_BY_PARTICIPANT = String.format(
      "SELECT %s FROM %s WHERE %s = ?", COLUMNS, TABLE_BY_PARTICIPANT, PARTICIPANT_ID);
  public static final String SELECT_ONE = String.format(
      "SELECT %s FROM %s WHERE %s = ? AND %s = ?", COLUMNS, TABLE_BY_EXAM, EXAM_ID,
      PARTICIPANT_ID);

  private ResultTablesStatements() {
  }
}
