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
import reactor.core.publisher.Mono;

/**
 * Performs the work of one job type. A handler signals success by completing and failure by
 * erroring; the worker pool applies the retry policy.
 */
public interface JobHandler {

  JobType getJobType();

  Mono<Void> handle(Job job);
}
