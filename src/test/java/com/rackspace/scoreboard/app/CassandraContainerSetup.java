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

package com.rackspace.scoreboard.app;

import com.datastax.oss.driver.api.core.CqlSession;
import org.springframework.boot.autoconfigure.cassandra.CqlSessionBuilderCustomizer;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.containers.CassandraContainer;

/**
 * To be imported from a unit test that <code>@Testcontainers</code> activated. For example:
 * <pre>
 &#64;Container
 public static CassandraContainer&lt;?&gt; cassandraContainer =
     new CassandraContainer&lt;&gt;(CassandraContainerSetup.DOCKER_IMAGE);
 &#64;DynamicPropertySource
 static void cassandraProperties(DynamicPropertyRegistry registry) {
   CassandraContainerSetup.registerProperties(registry, cassandraContainer);
 }
 &#64;TestConfiguration
 &#64;Import(CassandraContainerSetup.class)
 public static class TestConfig {
   &#64;Bean
   CassandraContainer&lt;?&gt; cassandraContainer() {
     return cassandraContainer;
   }
 }
 * </pre>
 */
@TestConfiguration
public class CassandraContainerSetup {

  public static final String DOCKER_IMAGE = "cassandra:4.1";
  public static final String KEYSPACE = "scoreboard";

  @Bean
  public CqlSessionBuilderCustomizer keyspaceCreatingCustomizer(
      CassandraContainer<?> cassandraContainer) {
    return cqlSessionBuilder -> createKeyspace(cassandraContainer);
  }

  public static void registerProperties(DynamicPropertyRegistry registry,
                                        CassandraContainer<?> cassandraContainer) {
    registry.add("spring.data.cassandra.contact-points",
        () -> cassandraContainer.getHost() + ":"
            + cassandraContainer.getMappedPort(CassandraContainer.CQL_PORT));
    registry.add("spring.data.cassandra.local-datacenter", cassandraContainer::getLocalDatacenter);
    registry.add("spring.data.cassandra.keyspace-name", () -> KEYSPACE);
  }

  private static void createKeyspace(CassandraContainer<?> cassandraContainer) {
    try (CqlSession session = CqlSession.builder()
        .addContactPoint(cassandraContainer.getContactPoint())
        .withLocalDatacenter(cassandraContainer.getLocalDatacenter())
        .build()) {
      session.execute("CREATE KEYSPACE IF NOT EXISTS " + KEYSPACE
          + "    WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 1}");
    }
  }
}
