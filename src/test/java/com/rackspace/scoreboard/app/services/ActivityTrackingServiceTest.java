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

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.scoreboard.app.MutableClock;
import com.rackspace.scoreboard.app.config.RedisScriptConfig;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.precalc.AggregateCategory.TargetKind;
import com.rackspace.scoreboard.app.services.ActivityTrackingServiceTest.TestConfig;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

@SpringBootTest(classes = {
    TestConfig.class,
    RedisScriptConfig.class,
    ActivityTrackingService.class
})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ActivityTrackingServiceTest {

  private static final int REDIS_PORT = 6379;
  private static final Instant NOW = Instant.parse("2022-05-02T12:00:00Z");
  private static final Duration LOOKBACK = Duration.ofHours(24);

  @Container
  public static GenericContainer<?> redisContainer =
      new GenericContainer<>("redis:6.0")
          .withExposedPorts(REDIS_PORT);

  @TestConfiguration
  public static class TestConfig {

    @Bean
    ReactiveRedisConnectionFactory redisConnectionFactory() {
      return new LettuceConnectionFactory(
          redisContainer.getHost(),
          redisContainer.getFirstMappedPort()
      );
    }

    @Bean
    ReactiveStringRedisTemplate reactiveStringRedisTemplate(
        ReactiveRedisConnectionFactory connectionFactory) {
      return new ReactiveStringRedisTemplate(connectionFactory);
    }

    @Bean
    MutableClock clock() {
      return new MutableClock(NOW);
    }
  }

  @Autowired
  ActivityTrackingService activityTrackingService;

  @Autowired
  ReactiveStringRedisTemplate redisTemplate;

  @Autowired
  MutableClock clock;

  @BeforeEach
  void setUp() {
    clock.set(NOW);
  }

  @AfterEach
  void tearDown() {
    redisTemplate.delete(redisTemplate.scan())
        .block();
  }

  @Test
  void recordsEveryTargetOfResult() {
    activityTrackingService.recordResult(result("e-1", "p-1", NOW)).block();

    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.EXAM, LOOKBACK, 10))
        .expectNext("e-1")
        .verifyComplete();
    StepVerifier.create(
            activityTrackingService.getActiveTargets(TargetKind.PARTICIPANT, LOOKBACK, 10))
        .expectNext("p-1")
        .verifyComplete();
    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.CLASS, LOOKBACK, 10))
        .expectNext("c-1")
        .verifyComplete();
    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.SUBJECT, LOOKBACK, 10))
        .expectNext("math")
        .verifyComplete();
  }

  @Test
  void lateResultCountsAsCurrentActivity() {
    // attempt ended well outside the lookback, result processed now
    activityTrackingService.recordResult(result("e-1", "p-1", NOW.minus(Duration.ofDays(3))))
        .block();

    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.CLASS, LOOKBACK, 10))
        .expectNext("c-1")
        .verifyComplete();
    StepVerifier.create(redisTemplate.opsForZSet()
            .score(ActivityTrackingService.encodeActivityKey(TargetKind.EXAM), "e-1"))
        .expectNext((double) NOW.toEpochMilli())
        .verifyComplete();
  }

  @Test
  void activityNeverMovesBackwards() {
    activityTrackingService.recordResult(result("e-1", "p-1", NOW)).block();

    // an instance with a lagging clock records the same targets
    clock.set(NOW.minus(Duration.ofHours(30)));
    activityTrackingService.recordResult(result("e-1", "p-2", NOW)).block();

    clock.set(NOW.plus(Duration.ofHours(1)));
    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.EXAM, LOOKBACK, 10))
        .expectNext("e-1")
        .verifyComplete();
    StepVerifier.create(
            activityTrackingService.getActiveTargets(TargetKind.PARTICIPANT, LOOKBACK, 10))
        .expectNext("p-1")
        .verifyComplete();
  }

  @Test
  void newestFirstWithinLimitAndInactivePruned() {
    activityTrackingService.recordResult(result("e-old", "p-1", NOW)).block();
    clock.advance(Duration.ofHours(2));
    activityTrackingService.recordResult(result("e-mid", "p-1", NOW)).block();
    clock.advance(Duration.ofHours(1));
    activityTrackingService.recordResult(result("e-new", "p-1", NOW)).block();

    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.EXAM, LOOKBACK, 2))
        .expectNext("e-new", "e-mid")
        .verifyComplete();

    clock.set(NOW.plus(Duration.ofHours(25)));
    StepVerifier.create(activityTrackingService.getActiveTargets(TargetKind.EXAM, LOOKBACK, 10))
        .expectNext("e-new", "e-mid")
        .verifyComplete();
    StepVerifier.create(redisTemplate.opsForZSet()
            .size(ActivityTrackingService.encodeActivityKey(TargetKind.EXAM)))
        .expectNext(2L)
        .verifyComplete();
  }

  private static ExamResult result(String examId, String participantId, Instant endTime) {
    return new ExamResult()
        .setExamId(examId)
        .setParticipantId(participantId)
        .setClassId("c-1")
        .setSubjectId("math")
        .setEndTime(endTime)
        .setUpdatedAt(endTime);
  }
}
