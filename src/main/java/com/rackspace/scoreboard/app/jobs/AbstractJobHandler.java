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

import com.rackspace.scoreboard.app.model.Job;
import com.rackspace.scoreboard.app.model.JobType;
import com.rackspace.scoreboard.app.model.payload.JobPayload;
import reactor.core.publisher.Mono;

public abstract class AbstractJobHandler<P extends JobPayload> implements JobHandler {

  private final JobType jobType;
  private final Class<P> payloadType;

  protected AbstractJobHandler(JobType jobType, Class<P> payloadType) {
    this.jobType = jobType;
    this.payloadType = payloadType;
  }

  @Override
  public JobType getJobType() {
    return jobType;
  }

  @Override
  public Mono<Void> handle(Job job) {
    if (!payloadType.isInstance(job.getPayload())) {
      return Mono.error(new IllegalArgumentException(
          String.format("Job %s of type %s has an unexpected payload", job.getId(), jobType)));
    }
    return handle(job, payloadType.cast(job.getPayload()));
  }

  protected abstract Mono<Void> handle(Job job, P payload);
}
