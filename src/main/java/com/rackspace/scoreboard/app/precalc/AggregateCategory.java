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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Categories of precalculated aggregates. Each is recomputed on its own schedule for the
 * targets of its kind that had recent activity.
 */
public enum AggregateCategory {
  EXAM_STATS("exam-stats", TargetKind.EXAM),
  STUDENT_SUMMARIES("student-summaries", TargetKind.PARTICIPANT),
  CLASS_RANKINGS("class-rankings", TargetKind.CLASS),
  SUBJECT_ANALYTICS("subject-analytics", TargetKind.SUBJECT);

  private final String key;
  private final TargetKind targetKind;

  AggregateCategory(String key, TargetKind targetKind) {
    this.key = key;
    this.targetKind = targetKind;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  public TargetKind getTargetKind() {
    return targetKind;
  }

  public static AggregateCategory fromKey(String key) {
    return Arrays.stream(values())
        .filter(category -> category.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown aggregate category: " + key));
  }

  public enum TargetKind {
    EXAM("exam"),
    PARTICIPANT("participant"),
    CLASS("class"),
    SUBJECT("subject");

    private final String key;

    TargetKind(String key) {
      this.key = key;
    }

    public String getKey() {
      return key;
    }
  }
}
