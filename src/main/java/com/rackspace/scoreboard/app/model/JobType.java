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

import com.fasterxml.jackson.annotation.JsonProperty;

public enum JobType {
  @JsonProperty("submission_batch")
  SUBMISSION_BATCH("batch", JobPriority.NORMAL),
  @JsonProperty("result_calculation")
  RESULT_CALCULATION("calc", JobPriority.NORMAL),
  @JsonProperty("ranking_update")
  RANKING_UPDATE("ranking", JobPriority.NORMAL),
  @JsonProperty("analytics_refresh")
  ANALYTICS_REFRESH("analytics", JobPriority.LOW);

  private final String idPrefix;
  private final JobPriority defaultPriority;

  JobType(String idPrefix, JobPriority defaultPriority) {
    this.idPrefix = idPrefix;
    this.defaultPriority = defaultPriority;
  }

  public String getIdPrefix() {
    return idPrefix;
  }

  /**
   * Priority used when the caller does not request one.
   */
  public JobPriority getDefaultPriority() {
    return defaultPriority;
  }
}
