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

package com.rackspace.scoreboard.app.jobs;

import com.rackspace.scoreboard.app.model.JobPriority;
import com.rackspace.scoreboard.app.model.JobStatus;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Redis keys of the job store. All of them share one hash tag so that each job script
 * touches a single cluster slot.
 */
final class JobKeys {

  static final String HASH_TAG = "{scoreboard}";
  static final String RECORD_PREFIX = HASH_TAG + "|job|";
  static final String TERMINAL_JOBS = HASH_TAG + "|jobs|terminal";
  static final String METRICS = HASH_TAG + "|jobs|metrics";

  static final String METRIC_PROCESSING_MS = "processing_ms";
  static final String METRIC_PROCESSED = "processed";

  private JobKeys() {
  }

  static String record(String jobId) {
    return RECORD_PREFIX + jobId;
  }

  static String lane(JobPriority priority) {
    return String.format("%s|queue|%s", HASH_TAG, priority.lane());
  }

  static String statusSet(JobStatus status) {
    return String.format("%s|status|%s", HASH_TAG, status.setName());
  }

  /**
   * Lanes in the order they are polled.
   */
  static List<String> lanes() {
    return Arrays.stream(JobPriority.values())
        .map(JobKeys::lane)
        .collect(Collectors.toList());
  }
}
