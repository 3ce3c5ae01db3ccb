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
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.schema.AvroSchemas;
import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.SchemaViolation;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.source.extractor.DataRecordException;
import org.apache.starflow.source.extractor.Extractor;


/**
 * An {@link Extractor} that reads every row of one source entity over JDBC, in primary key order, as Avro
 * {@link GenericRecord}s of the entity's schema.
 *
 * <p>
 *   The query is {@code SELECT * FROM <table> ORDER BY <primary key>}. Before the first row is read, the columns of
 *   the result set are matched against the fields of the schema by case-insensitive name; a missing column or a
 *   column whose JDBC type cannot carry the field's type fails with a {@link SchemaMismatchException}.
 *   Extra columns are ignored. Decimals are read as {@link BigDecimal} and dates as {@link java.time.LocalDate}.
 * </p>
 *
 * <p>
 *   The extractor does not own the {@link Connection}; closing it closes the statement and result set only.
 * </p>
 */
@Slf4j
public class JdbcEntityExtractor implements Extractor<Schema, GenericRecord> {

  private static final String TABLE_NAME_PATTERN = "[A-Za-z_][A-Za-z0-9_.$]*";

  private static final ImmutableSet<Integer> STRING_TYPES = ImmutableSet.of(Types.CHAR, Types.VARCHAR,
      Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB);
  private static final ImmutableSet<Integer> INT_TYPES = ImmutableSet.of(Types.TINYINT, Types.SMALLINT, Types.INTEGER);
  private static final ImmutableSet<Integer> LONG_TYPES =
      ImmutableSet.of(Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT);
  private static final ImmutableSet<Integer> DECIMAL_TYPES = ImmutableSet.of(Types.DECIMAL, Types.NUMERIC);
  private static final ImmutableSet<Integer> DATE_TYPES = ImmutableSet.of(Types.DATE, Types.TIMESTAMP);
  private static final ImmutableSet<Integer> DOUBLE_TYPES =
      ImmutableSet.of(Types.FLOAT, Types.REAL, Types.DOUBLE, Types.DECIMAL, Types.NUMERIC);
  private static final ImmutableSet<Integer> BOOLEAN_TYPES = ImmutableSet.of(Types.BIT, Types.BOOLEAN);

  private final StarSchemaEntity entity;
  private final String table;
  private final Schema schema;
  private final Statement statement;
  private final ResultSet resultSet;
  /** Column index in the result set of each schema field, in schema field order. */
  private final int[] columnIndexes;
  private long recordsRead = 0;

  /**
   * Run the query and check the shape of its result.
   *
   * @throws SQLException if the query fails
   * @throws SchemaMismatchException if the result set does not carry the entity's fields
   */
  public JdbcEntityExtractor(StarSchemaEntity entity, String table, Connection connection, int queryTimeoutSeconds,
      int fetchSize) throws SQLException {
    Preconditions.checkArgument(table.matches(TABLE_NAME_PATTERN), "Illegal table name %s", table);
    this.entity = entity;
    this.table = table;
    this.schema = entity.getSchema();

    String query = String.format("SELECT * FROM %s ORDER BY %s", table, Joiner.on(", ").join(entity.getPrimaryKey()));
    log.debug("Extracting {} with query: {}", entity.getTableName(), query);
    this.statement = connection.createStatement();
    try {
      this.statement.setQueryTimeout(queryTimeoutSeconds);
      this.statement.setFetchSize(fetchSize);
      this.resultSet = this.statement.executeQuery(query);
      this.columnIndexes = mapColumns(this.resultSet.getMetaData());
    } catch (SQLException | RuntimeException e) {
      try {
        this.statement.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  private int[] mapColumns(ResultSetMetaData metaData) throws SQLException {
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      columns.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), i);
    }

    List<SchemaViolation> violations = new ArrayList<>();
    int[] indexes = new int[this.schema.getFields().size()];
    for (Schema.Field field : this.schema.getFields()) {
      Integer index = columns.get(field.name().toLowerCase(Locale.ROOT));
      if (index == null) {
        violations.add(new SchemaViolation(this.entity, null, field.name(), SchemaViolation.Type.MISSING_FIELD,
            "table " + this.table + " has no column " + field.name()));
        continue;
      }
      int jdbcType = metaData.getColumnType(index);
      if (!compatibleTypes(field.schema()).contains(jdbcType)) {
        violations.add(new SchemaViolation(this.entity, null, field.name(), SchemaViolation.Type.TYPE_MISMATCH,
            String.format("column %s.%s of type %s cannot hold %s", this.table, metaData.getColumnLabel(index),
                metaData.getColumnTypeName(index), AvroSchemas.describe(field.schema()))));
        continue;
      }
      indexes[field.pos()] = index;
    }
    if (!violations.isEmpty()) {
      throw new SchemaMismatchException(this.entity, violations);
    }
    return indexes;
  }

  private static ImmutableSet<Integer> compatibleTypes(Schema fieldSchema) {
    if (AvroSchemas.isDecimal(fieldSchema)) {
      return DECIMAL_TYPES;
    }
    if (AvroSchemas.isDate(fieldSchema)) {
      return DATE_TYPES;
    }
    switch (AvroSchemas.nonNull(fieldSchema).getType()) {
      case STRING:
        return STRING_TYPES;
      case INT:
        return INT_TYPES;
      case LONG:
        return LONG_TYPES;
      case DOUBLE:
        return DOUBLE_TYPES;
      case BOOLEAN:
        return BOOLEAN_TYPES;
      default:
        throw new IllegalArgumentException("Unsupported field type " + fieldSchema);
    }
  }

  @Override
  public Schema getSchema() {
    return this.schema;
  }

  /**
   * {@inheritDoc}
   *
   * @throws IOException wrapping the {@link SQLException} of a failed fetch, see {@link JdbcErrors}
   */
  @Override
  public GenericRecord readRecord() throws DataRecordException, IOException {
    try {
      if (!this.resultSet.next()) {
        log.debug("Read {} rows of {} from {}", this.recordsRead, this.entity.getTableName(), this.table);
        return null;
      }
      GenericRecord record = new GenericData.Record(this.schema);
      for (Schema.Field field : this.schema.getFields()) {
        record.put(field.pos(), readValue(field, this.columnIndexes[field.pos()]));
      }
      this.recordsRead++;
      return record;
    } catch (SQLException se) {
      throw JdbcErrors.queryFailure(this.entity, this.table, se);
    } catch (ArithmeticException | IllegalArgumentException e) {
      throw new DataRecordException(String.format("Cannot convert row %d of %s", this.recordsRead + 1, this.table), e);
    }
  }

  private Object readValue(Schema.Field field, int index) throws SQLException {
    Schema type = AvroSchemas.nonNull(field.schema());
    if (AvroSchemas.isDecimal(type)) {
      BigDecimal value = this.resultSet.getBigDecimal(index);
      return value == null ? null : rescale(value, AvroSchemas.decimal(type));
    }
    if (AvroSchemas.isDate(type)) {
      Date value = this.resultSet.getDate(index);
      return value == null ? null : value.toLocalDate();
    }
    Object value;
    switch (type.getType()) {
      case STRING:
        value = this.resultSet.getString(index);
        break;
      case INT:
        value = this.resultSet.getInt(index);
        break;
      case LONG:
        value = this.resultSet.getLong(index);
        break;
      case DOUBLE:
        value = this.resultSet.getDouble(index);
        break;
      case BOOLEAN:
        value = this.resultSet.getBoolean(index);
        break;
      default:
        throw new IllegalArgumentException("Unsupported field type " + type);
    }
    return this.resultSet.wasNull() ? null : value;
  }

  /**
   * Bring a decimal to the scale of the field when that loses nothing; otherwise the value is kept as read and
   * left for schema validation to reject.
   */
  private static BigDecimal rescale(BigDecimal value, LogicalTypes.Decimal decimal) {
    if (value.scale() == decimal.getScale()) {
      return value;
    }
    BigDecimal stripped = value.stripTrailingZeros();
    return stripped.scale() <= decimal.getScale() ? value.setScale(decimal.getScale(), RoundingMode.UNNECESSARY)
        : value;
  }

  @Override
  public long getExpectedRecordCount() {
    return -1;
  }

  public long getRecordsRead() {
    return this.recordsRead;
  }

  @Override
  public void close() throws IOException {
    try {
      try {
        this.resultSet.close();
      } finally {
        this.statement.close();
      }
    } catch (SQLException se) {
      throw new IOException("Failed to close query on " + this.table, se);
    }
  }
}
