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

package com.rackspace.scoreboard.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Lua scripts that keep each job store and activity mutation atomic.
 */
@Configuration
public class RedisScriptConfig {

  @Bean
  public RedisScript<Long> enqueueJobScript() {
    return RedisScript.of(new ClassPathResource("scripts/enqueue-job.lua"), Long.class);
  }

  @Bean
  public RedisScript<String> claimJobScript() {
    return RedisScript.of(new ClassPathResource("scripts/claim-job.lua"), String.class);
  }

  @Bean
  public RedisScript<Long> finishJobScript() {
    return RedisScript.of(new ClassPathResource("scripts/finish-job.lua"), Long.class);
  }

  @Bean
  public RedisScript<Long> purgeJobsScript() {
    return RedisScript.of(new ClassPathResource("scripts/purge-jobs.lua"), Long.class);
  }

  @Bean
  public RedisScript<Long> touchActivityScript() {
    return RedisScript.of(new ClassPathResource("scripts/touch-activity.lua"), Long.class);
  }
}
