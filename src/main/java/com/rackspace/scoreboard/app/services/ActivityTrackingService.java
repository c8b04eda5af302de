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

import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.precalc.AggregateCategory.TargetKind;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Range;
import org.springframework.data.domain.Range.Bound;
import org.springframework.data.redis.connection.RedisZSetCommands.Limit;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tracks which exams, participants, classes and subjects had results recently. Each kind is
 * a sorted set scored by the epoch millis at which a result for the target was last
 * processed. Scores only move forward.
 */
@Service
@Slf4j
public class ActivityTrackingService {

  private final ReactiveStringRedisTemplate redisTemplate;
  private final RedisScript<Long> touchActivityScript;
  private final Clock clock;

  @Autowired
  public ActivityTrackingService(ReactiveStringRedisTemplate redisTemplate,
                                 @Qualifier("touchActivityScript") RedisScript<Long> touchActivityScript,
                                 Clock clock) {
    this.redisTemplate = redisTemplate;
    this.touchActivityScript = touchActivityScript;
    this.clock = clock;
  }

  /**
   * Marks the targets of a result as active at the current time, whenever the attempt ended.
   */
  public Mono<Void> recordResult(ExamResult result) {
    final long activityMillis = clock.millis();

    final List<Mono<Long>> updates = new ArrayList<>(4);
    updates.add(touch(TargetKind.EXAM, result.getExamId(), activityMillis));
    updates.add(touch(TargetKind.PARTICIPANT, result.getParticipantId(), activityMillis));
    if (result.getClassId() != null) {
      updates.add(touch(TargetKind.CLASS, result.getClassId(), activityMillis));
    }
    if (result.getSubjectId() != null) {
      updates.add(touch(TargetKind.SUBJECT, result.getSubjectId(), activityMillis));
    }
    return Mono.when(updates);
  }

  /**
   * Returns the most recently active targets of a kind, newest first, and prunes the ones
   * whose last activity fell out of the lookback window.
   */
  public Flux<String> getActiveTargets(TargetKind kind, Duration lookback, int limit) {
    final double cutoff = clock.instant().minus(lookback).toEpochMilli();
    final String key = encodeActivityKey(kind);
    return redisTemplate.opsForZSet()
        .removeRangeByScore(key, Range.of(Bound.unbounded(), Bound.exclusive(cutoff)))
        .doOnNext(pruned -> {
          if (pruned > 0) {
            log.debug("Pruned {} inactive {} targets", pruned, kind.getKey());
          }
        })
        .thenMany(redisTemplate.opsForZSet().reverseRangeByScore(
            key,
            Range.of(Bound.inclusive(cutoff), Bound.unbounded()),
            Limit.limit().count(limit)
        ));
  }

  private Mono<Long> touch(TargetKind kind, String targetId, long activityMillis) {
    return redisTemplate.execute(
            touchActivityScript,
            List.of(encodeActivityKey(kind)),
            List.of(targetId, Long.toString(activityMillis)))
        .next();
  }

  static String encodeActivityKey(TargetKind kind) {
    return String.format("activity|%s", kind.getKey());
  }
}
