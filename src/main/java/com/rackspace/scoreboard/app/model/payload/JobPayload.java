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

package com.rackspace.scoreboard.app.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.rackspace.scoreboard.app.model.JobType;

/**
 * Typed payload of a job. Each job type carries exactly one payload subtype.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SubmissionBatchPayload.class, name = "submission_batch"),
    @JsonSubTypes.Type(value = ResultCalculationPayload.class, name = "result_calculation"),
    @JsonSubTypes.Type(value = RankingUpdatePayload.class, name = "ranking_update"),
    @JsonSubTypes.Type(value = AnalyticsRefreshPayload.class, name = "analytics_refresh")
})
public abstract class JobPayload {

  @JsonIgnore
  public abstract JobType getJobType();
}
