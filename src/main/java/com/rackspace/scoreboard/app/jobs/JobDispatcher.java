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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Routes a claimed job to the handler registered for its type.
 */
@Component
@Slf4j
public class JobDispatcher {

  private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

  @Autowired
  public JobDispatcher(List<JobHandler> handlers) {
    for (JobHandler handler : handlers) {
      final JobHandler previous = this.handlers.put(handler.getJobType(), handler);
      if (previous != null) {
        throw new IllegalStateException(String.format("Both %s and %s handle %s",
            previous.getClass().getSimpleName(), handler.getClass().getSimpleName(),
            handler.getJobType()));
      }
    }
    log.debug("Registered job handlers for {}", this.handlers.keySet());
  }

  public Mono<Void> dispatch(Job job) {
    return Mono.defer(() -> {
      final JobHandler handler = handlers.get(job.getType());
      if (handler == null) {
        return Mono.error(new IllegalStateException("No handler for job type " + job.getType()));
      }
      return handler.handle(job);
    });
  }
}
