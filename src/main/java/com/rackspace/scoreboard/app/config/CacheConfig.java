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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.scoreboard.app.entities.Exam;
import com.rackspace.scoreboard.app.entities.ExamQuestion;
import com.rackspace.scoreboard.app.entities.Participant;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local caches of catalog data read on every submission.
 */
@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final AppProperties appProperties;

  public CacheConfig(MeterRegistry meterRegistry, AppProperties appProperties) {
    this.meterRegistry = meterRegistry;
    this.appProperties = appProperties;
  }

  @Bean
  public AsyncCache<String, Exam> examCache() {
    final AsyncCache<String, Exam> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getExamCacheSize())
        .expireAfterWrite(appProperties.getExamCacheTtl())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "examCache");
    return cache;
  }

  @Bean
  public AsyncCache<String, List<ExamQuestion>> answerKeyCache() {
    final AsyncCache<String, List<ExamQuestion>> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getExamCacheSize())
        .expireAfterWrite(appProperties.getExamCacheTtl())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "answerKeyCache");
    return cache;
  }

  @Bean
  public AsyncCache<String, Participant> participantCache() {
    final AsyncCache<String, Participant> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getParticipantCacheSize())
        .expireAfterWrite(appProperties.getParticipantCacheTtl())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "participantCache");
    return cache;
  }
}
