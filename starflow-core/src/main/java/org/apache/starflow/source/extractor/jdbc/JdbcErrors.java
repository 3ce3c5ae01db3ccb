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
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

import com.google.common.collect.ImmutableSet;

import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.source.SourceUnavailableException;


/**
 * Maps {@link SQLException}s onto the failures the rest of the pipeline understands.
 *
 * <ul>
 *   <li>SQL state class {@code 08} (connection exception), query timeouts and cancellations:
 *   {@link SourceUnavailableException}</li>
 *   <li>SQL state class {@code 42} (syntax error or access rule violation, e.g. an unknown table or column):
 *   {@link SchemaMismatchException}</li>
 *   <li>anything else: a plain {@link IOException}</li>
 * </ul>
 */
public class JdbcErrors {

  private static final String CONNECTION_EXCEPTION_CLASS = "08";
  private static final String SYNTAX_OR_ACCESS_CLASS = "42";
  /** Statement cancelled or timed out: SQL standard, Derby, PostgreSQL and ODBC flavours. */
  private static final ImmutableSet<String> TIMEOUT_STATES = ImmutableSet.of("HYT00", "HYT01", "XCL52", "57014");

  private JdbcErrors() {
  }

  /**
   * Translate a failure to reach the store at all. Every such failure is transient from the pipeline's view.
   */
  public static SourceUnavailableException connectionFailure(String url, SQLException se) {
    return new SourceUnavailableException(String.format("Cannot connect to %s: %s (SQLState %s)", url,
        se.getMessage(), se.getSQLState()), se);
  }

  /**
   * Translate a failure of the query reading <code>table</code>.
   *
   * @throws SchemaMismatchException if the store reports an unknown table or column
   */
  public static IOException queryFailure(StarSchemaEntity entity, String table, SQLException se) {
    String state = se.getSQLState() == null ? "" : se.getSQLState();
    String message = String.format("Failed to read %s from table %s: %s (SQLState %s)", entity.getTableName(), table,
        se.getMessage(), se.getSQLState());
    if (se instanceof SQLSyntaxErrorException || state.startsWith(SYNTAX_OR_ACCESS_CLASS)) {
      throw new SchemaMismatchException(entity, message, se);
    }
    if (se instanceof SQLTimeoutException || se instanceof SQLTransientException
        || se instanceof SQLNonTransientConnectionException || state.startsWith(CONNECTION_EXCEPTION_CLASS)
        || TIMEOUT_STATES.contains(state)) {
      return new SourceUnavailableException(message, se);
    }
    return new IOException(message, se);
  }
}
