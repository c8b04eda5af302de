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

import com.datastax.oss.driver.api.core.cql.Row;
import com.rackspace.scoreboard.app.CassandraContainerSetup;
import com.rackspace.scoreboard.app.config.AppProperties;
import com.rackspace.scoreboard.app.config.CassandraConfig;
import com.rackspace.scoreboard.app.config.ResultTablesPopulator;
import com.rackspace.scoreboard.app.entities.ExamAttempt;
import com.rackspace.scoreboard.app.model.ExamResult;
import com.rackspace.scoreboard.app.services.ExamResultServiceTest.TestConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration;
import org.springframework.boot.autoconfigure.data.cassandra.CassandraDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.cassandra.CassandraReactiveDataAutoConfiguration;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

@SpringBootTest(classes = {
    TestConfig.class,
    CassandraConfig.class,
    ResultTablesPopulator.class,
    ExamResultService.class
})
@ImportAutoConfiguration({
    CassandraAutoConfiguration.class,
    CassandraDataAutoConfiguration.class,
    CassandraReactiveDataAutoConfiguration.class
})
@EnableConfigurationProperties(AppProperties.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ExamResultServiceTest {

  @Container
  public static CassandraContainer<?> cassandraContainer = new CassandraContainer<>(
      CassandraContainerSetup.DOCKER_IMAGE);

  @DynamicPropertySource
  static void cassandraProperties(DynamicPropertyRegistry registry) {
    CassandraContainerSetup.registerProperties(registry, cassandraContainer);
  }

  @TestConfiguration
  @Import(CassandraContainerSetup.class)
  @EntityScan(basePackageClasses = ExamAttempt.class)
  public static class TestConfig {
    @Bean
    CassandraContainer<?> cassandraContainer() {
      return cassandraContainer;
    }

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @MockBean
  ExamCatalogService examCatalogService;

  @Autowired
  ExamResultService examResultService;

  @Autowired
  ReactiveCqlTemplate cqlTemplate;

  @Nested
  class upsertResult {

    @Test
    void repeatedDeliveryKeepsOneRowPerTable() {
      final String examId = RandomStringUtils.randomAlphanumeric(10);
      final String participantId = RandomStringUtils.randomAlphanumeric(10);

      examResultService.upsertResult(
          result(examId, participantId, 40.0, "F", Instant.parse("2022-05-02T08:00:00.123Z"))
      ).block();
      examResultService.upsertResult(
          result(examId, participantId, 70.0, "B", Instant.parse("2022-05-02T09:30:00.456Z"))
      ).block();

      assertSingleRow(
          "SELECT participant_id, score, grade, updated_at FROM exam_results WHERE exam_id = ?",
          examId, participantId);
      assertSingleRow(
          "SELECT exam_id, score, grade, updated_at FROM results_by_participant"
              + " WHERE participant_id = ?",
          participantId, examId);

      StepVerifier.create(examResultService.getResult(examId, participantId))
          .assertNext(stored -> {
            assertThat(stored.getScore()).isEqualTo(70.0);
            assertThat(stored.getPercentage()).isEqualTo(70.0);
            assertThat(stored.getSubjectId()).isEqualTo("math");
            assertThat(stored.isCompleted()).isTrue();
          })
          .verifyComplete();
    }

    @Test
    void readsByExamAndParticipant() {
      final String examId = RandomStringUtils.randomAlphanumeric(10);
      final String participant1 = RandomStringUtils.randomAlphanumeric(10);
      final String participant2 = RandomStringUtils.randomAlphanumeric(10);
      final Instant now = Instant.parse("2022-05-02T08:00:00Z");

      examResultService.upsertResult(result(examId, participant1, 55.0, "D", now)).block();
      examResultService.upsertResult(result(examId, participant2, 90.0, "A", now)).block();

      StepVerifier.create(examResultService.getResultsForExam(examId)
              .map(ExamResult::getParticipantId)
              .collectList())
          .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder(participant1, participant2))
          .verifyComplete();
      StepVerifier.create(examResultService.getResultsForParticipant(participant2))
          .assertNext(stored -> {
            assertThat(stored.getExamId()).isEqualTo(examId);
            assertThat(stored.getGrade()).isEqualTo("A");
          })
          .verifyComplete();
    }

    private void assertSingleRow(String cql, String partitionKey, String clusteringKey) {
      final List<Row> rows = cqlTemplate.queryForRows(cql, partitionKey)
          .collectList().block();

      assertThat(rows).isNotNull();
      assertThat(rows).hasSize(1);
      assertThat(rows.get(0).getString(0)).isEqualTo(clusteringKey);
      assertThat(rows.get(0).getDouble(1)).isEqualTo(70.0);
      assertThat(rows.get(0).getString(2)).isEqualTo("B");
      // only millisecond resolution retained by cassandra
      assertThat(rows.get(0).getInstant(3)).isEqualTo("2022-05-02T09:30:00.456Z");
    }
  }

  @Nested
  class upsertAttempt {

    @Test
    void resubmissionReplacesAttempt() {
      final String examId = RandomStringUtils.randomAlphanumeric(10);
      final String participantId = RandomStringUtils.randomAlphanumeric(10);

      examResultService.upsertAttempt(new ExamAttempt()
          .setExamId(examId)
          .setParticipantId(participantId)
          .setSelectedOptions(Map.of("q1", "a"))
      ).block();
      examResultService.upsertAttempt(new ExamAttempt()
          .setExamId(examId)
          .setParticipantId(participantId)
          .setSelectedOptions(Map.of("q1", "b", "q2", "c"))
      ).block();

      final List<Row> rows = cqlTemplate.queryForRows(
          "SELECT participant_id FROM exam_attempts WHERE exam_id = ?", examId
      ).collectList().block();
      assertThat(rows).hasSize(1);

      StepVerifier.create(examResultService.getAttempt(examId, participantId))
          .assertNext(attempt -> assertThat(attempt.getSelectedOptions())
              .containsExactlyInAnyOrderEntriesOf(Map.of("q1", "b", "q2", "c")))
          .verifyComplete();
    }
  }

  private static ExamResult result(String examId, String participantId, double score,
                                   String grade, Instant updatedAt) {
    return new ExamResult()
        .setExamId(examId)
        .setParticipantId(participantId)
        .setSubjectId("math")
        .setClassId("c-1")
        .setScore(score)
        .setTotalMarks(100.0)
        .setPercentage(score)
        .setGrade(grade)
        .setStartTime(updatedAt.minusSeconds(3600))
        .setEndTime(updatedAt)
        .setCompleted(true)
        .setUpdatedAt(updatedAt);
  }
}
