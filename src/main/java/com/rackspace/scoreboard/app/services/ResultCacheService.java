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

package com.rackspace.scoreboard.app.services;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * JSON values with expiration in Redis, shared by cached leaderboards and precalculated
 * aggregates. Writes are last-writer-wins.
 */
@Service
@Slf4j
public class ResultCacheService {

  private final ReactiveStringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;

  @Autowired
  public ResultCacheService(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  public Mono<Boolean> put(String key, Object value, Duration ttl) {
    return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
        .flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
        .doOnNext(stored -> log.trace("Cached key={} ttl={}", key, ttl));
  }

  /**
   * @return the cached value or empty when absent or expired
   */
  public <T> Mono<T> get(String key, JavaType type) {
    return redisTemplate.opsForValue().get(key)
        .flatMap(json -> Mono.fromCallable(() -> objectMapper.<T>readValue(json, type)));
  }

  public JavaType parametricType(Class<?> container, Class<?> parameter) {
    return objectMapper.getTypeFactory().constructParametricType(container, parameter);
  }

  public JavaType listType(Class<?> element) {
    return objectMapper.getTypeFactory().constructCollectionType(List.class, element);
  }

  public Mono<Long> delete(String key) {
    return redisTemplate.delete(key);
  }

  /**
   * Deletes every key starting with the prefix.
   */
  public Mono<Long> deleteByPrefix(String prefix) {
    return redisTemplate.delete(
            redisTemplate.scan(ScanOptions.scanOptions().match(prefix + "*").count(500).build())
        )
        .doOnNext(count -> log.debug("Deleted {} keys with prefix {}", count, prefix));
  }
}
