/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.starflow.source.extractor.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.io.Closer;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.source.EntitySource;
import org.apache.starflow.source.extractor.DataRecordException;
import org.apache.starflow.util.jdbc.DataSourceBuilder;
import org.apache.starflow.util.jdbc.JdbcDataSource;


/**
 * An {@link EntitySource} over a JDBC store, reading each entity through a {@link JdbcEntityExtractor} on a
 * connection borrowed from a pooled {@link JdbcDataSource}.
 *
 * <p>
 *   The physical table of an entity defaults to the entity's table name and can be overridden with
 *   {@code source.entity.<table name>.table}.
 * </p>
 */
@Slf4j
public class JdbcEntitySource implements EntitySource {

  private final State state;
  private final JdbcDataSource dataSource;
  private final int queryTimeoutSeconds;
  private final int fetchSize;

  public JdbcEntitySource(State state) {
    this(state, DataSourceBuilder.fromState(state).build());
  }

  public JdbcEntitySource(State state, JdbcDataSource dataSource) {
    this.state = state;
    this.dataSource = dataSource;
    this.queryTimeoutSeconds = state.getPropAsInt(ConfigurationKeys.SOURCE_QUERY_TIMEOUT_SECONDS,
        ConfigurationKeys.DEFAULT_SOURCE_QUERY_TIMEOUT_SECONDS);
    this.fetchSize = state.getPropAsInt(ConfigurationKeys.SOURCE_QUERY_FETCH_SIZE,
        ConfigurationKeys.DEFAULT_SOURCE_QUERY_FETCH_SIZE);
  }

  /**
   * @return the physical table the entity is read from.
   */
  public String getTable(StarSchemaEntity entity) {
    return this.state.getProp(ConfigurationKeys.SOURCE_ENTITY_PREFIX + entity.getTableName()
        + ConfigurationKeys.SOURCE_ENTITY_TABLE_SUFFIX, entity.getTableName());
  }

  @Override
  public RowSet extract(StarSchemaEntity entity) throws IOException {
    Preconditions.checkArgument(entity.isSource(), "%s is not a source entity", entity);
    String table = getTable(entity);
    Stopwatch stopwatch = Stopwatch.createStarted();

    Closer closer = Closer.create();
    try {
      Connection connection;
      try {
        connection = this.dataSource.getConnection();
      } catch (SQLException se) {
        throw JdbcErrors.connectionFailure(this.dataSource.getUrl(), se);
      }
      closer.register(() -> closeConnection(connection));

      JdbcEntityExtractor extractor;
      try {
        extractor = new JdbcEntityExtractor(entity, table, connection, this.queryTimeoutSeconds, this.fetchSize);
      } catch (SQLException se) {
        throw JdbcErrors.queryFailure(entity, table, se);
      }
      closer.register(extractor);

      List<GenericRecord> rows = new ArrayList<>();
      GenericRecord record;
      while ((record = extractor.readRecord()) != null) {
        rows.add(record);
      }
      log.info("Extracted {} rows of {} from table {} in {}", rows.size(), entity.getTableName(), table, stopwatch);
      return new RowSet(entity, rows);
    } catch (DataRecordException dre) {
      throw closer.rethrow(new IOException(dre.getMessage(), dre));
    } catch (Throwable t) {
      throw closer.rethrow(t);
    } finally {
      closer.close();
    }
  }

  private static void closeConnection(Connection connection) throws IOException {
    try {
      connection.close();
    } catch (SQLException se) {
      throw new IOException("Failed to release connection", se);
    }
  }

  @Override
  public void close() throws IOException {
    try {
      this.dataSource.close();
    } catch (SQLException se) {
      throw new IOException("Failed to close data source " + this.dataSource.getUrl(), se);
    }
  }
}
