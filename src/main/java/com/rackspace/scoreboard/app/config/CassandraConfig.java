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

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.metadata.NodeStateListenerBase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.cassandra.CqlSessionBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.cassandra.ReactiveSessionFactory;
import org.springframework.data.cassandra.config.SchemaAction;
import org.springframework.data.cassandra.config.SessionFactoryFactoryBean;
import org.springframework.data.cassandra.core.convert.CassandraConverter;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;

@Configuration
@Slf4j
public class CassandraConfig {

  /**
   * Used by {@link com.rackspace.scoreboard.app.services.ExamResultService} for the result
   * tables, which have no mapped entities.
   */
  @Bean
  public ReactiveCqlTemplate cqlTemplate(ReactiveSessionFactory reactiveSessionFactory) {
    return new ReactiveCqlTemplate(reactiveSessionFactory);
  }

  @Bean
  public CqlSessionBuilderCustomizer scoreboardSessionCustomizer(
      @Value("${spring.application.name:scoreboard}") String applicationName) {
    return builder -> builder
        .withApplicationName(applicationName)
        .withNodeStateListener(new NodeStateListenerBase() {
          @Override
          public void onUp(Node node) {
            log.info("Cassandra node={} is up", node.getEndPoint());
          }

          @Override
          public void onDown(Node node) {
            log.warn("Cassandra node={} is down, results may be retried", node.getEndPoint());
          }
        });
  }

  /**
   * Catalog tables are created from the mapped entities, result tables by the populator.
   */
  @Bean
  public SessionFactoryFactoryBean cassandraSessionFactory(CqlSession session,
                                                           CassandraConverter converter,
                                                           ResultTablesPopulator resultTablesPopulator) {
    final SessionFactoryFactoryBean sessionFactory = new SessionFactoryFactoryBean();
    sessionFactory.setSession(session);
    sessionFactory.setConverter(converter);
    sessionFactory.setKeyspacePopulator(resultTablesPopulator);
    sessionFactory.setSchemaAction(SchemaAction.CREATE_IF_NOT_EXISTS);
    return sessionFactory;
  }
}
