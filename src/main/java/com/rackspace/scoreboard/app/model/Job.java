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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.rackspace.scoreboard.app.model.payload.JobPayload;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A unit of asynchronous work. The record is created by an enqueue call and afterwards only
 * mutated by the worker that claimed it. Once completed or failed it is no longer changed.
 */
@Data
@JsonInclude(Include.NON_NULL)
public class Job {
  String id;
  JobType type;
  JobPayload payload;
  JobPriority priority;
  JobStatus status;
  Instant createdAt;
  Instant startedAt;
  Instant completedAt;
  /**
   * Earliest time a worker may claim the job. Later than <code>createdAt</code> for retries.
   */
  Instant notBefore;
  int retryCount;
  int maxRetries;
  String lastError;
  JobProgress progress;
  List<ItemFailure> itemFailures = new ArrayList<>();
}
