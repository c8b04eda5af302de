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

import static com.rackspace.scoreboard.app.services.ResultTablesStatements.*;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.type.DataTypes;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.cassandra.core.cql.generator.CreateTableCqlGenerator;
import org.springframework.data.cassandra.core.cql.keyspace.CreateTableSpecification;
import org.springframework.data.cassandra.core.cql.session.init.KeyspacePopulator;
import org.springframework.data.cassandra.core.cql.session.init.ScriptException;
import org.springframework.stereotype.Component;

/**
 * Creates the result tables, which are accessed through CQL statements rather than mapped
 * entities.
 * @see com.rackspace.scoreboard.app.services.ResultTablesStatements
 */
@Component
@Slf4j
public class ResultTablesPopulator implements KeyspacePopulator {

  @Override
  public void populate(CqlSession session) throws ScriptException {
    tableSpecifications().forEach(spec -> createTable(spec, session));
  }

  List<CreateTableSpecification> tableSpecifications() {
    return List.of(
        resultTableSpec(TABLE_BY_EXAM, EXAM_ID, PARTICIPANT_ID),
        resultTableSpec(TABLE_BY_PARTICIPANT, PARTICIPANT_ID, EXAM_ID)
    );
  }

  private void createTable(CreateTableSpecification createTableSpec, CqlSession session) {
    final String cql = CreateTableCqlGenerator.toCql(createTableSpec);
    log.debug("Creating result table: {}", cql);
    // Cassandra doesn't like reactive version of create table
    session.execute(cql);
  }

  private CreateTableSpecification resultTableSpec(String table, String partitionColumn,
                                                   String clusteringColumn) {
    return CreateTableSpecification
        .createTable(table)
        .ifNotExists()
        .partitionKeyColumn(partitionColumn, DataTypes.TEXT)
        .clusteredKeyColumn(clusteringColumn, DataTypes.TEXT)
        .column(SUBJECT_ID, DataTypes.TEXT)
        .column(CLASS_ID, DataTypes.TEXT)
        .column(SCORE, DataTypes.DOUBLE)
        .column(TOTAL_MARKS, DataTypes.DOUBLE)
        .column(PERCENTAGE, DataTypes.DOUBLE)
        .column(GRADE, DataTypes.TEXT)
        .column(START_TIME, DataTypes.TIMESTAMP)
        .column(END_TIME, DataTypes.TIMESTAMP)
        .column(COMPLETED, DataTypes.BOOLEAN)
        .column(UPDATED_AT, DataTypes.TIMESTAMP);
  }
}
