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

import lombok.Data;

@Data
public class QueueStats {
  long queued;
  long processing;
  long completed;
  long failed;
  /**
   * Jobs waiting in any lane, including retries whose back-off has not elapsed.
   */
  long queueLength;
  /**
   * Mean processing time of completed jobs, in milliseconds.
   */
  double averageProcessingTime;
  /**
   * Workers of this instance currently processing a job.
   */
  int activeWorkers;
}
