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

package org.apache.starflow.schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import com.google.common.collect.Lists;

import lombok.extern.slf4j.Slf4j;


/**
 * Checks row sets against the shape and key contract of their {@link StarSchemaEntity}.
 *
 * <p>
 *   The validator has no side effects and never throws for data problems: every problem found is returned as a
 *   {@link SchemaViolation}. Callers decide which violations fail a run (see {@link SchemaViolation#isFatal()}).
 * </p>
 */
@Slf4j
public class SchemaValidator {

  /**
   * Validate the rows of an entity against its schema and primary key.
   *
   * <p>
   *   Reports fields the rows do not carry, values whose Java type does not match the field's Avro type, nulls in
   *   non-nullable fields, decimals that do not fit the declared precision and scale, and duplicate primary keys.
   * </p>
   */
  public List<SchemaViolation> validate(RowSet rowSet) {
    StarSchemaEntity entity = rowSet.getEntity();
    Schema schema = entity.getSchema();
    Set<String> keyFields = new HashSet<>(entity.getPrimaryKey());
    List<SchemaViolation> violations = new ArrayList<>();
    Set<String> missingFields = new LinkedHashSet<>();
    Set<RecordKey> seenKeys = new HashSet<>();

    for (GenericRecord record : rowSet.getRows()) {
      boolean shapeOk = true;
      for (Schema.Field field : schema.getFields()) {
        if (record.getSchema().getField(field.name()) == null) {
          missingFields.add(field.name());
          shapeOk = false;
        }
      }
      if (!shapeOk) {
        continue;
      }

      RecordKey key = entity.keyOf(record);
      String renderedKey = key.toString();
      for (Schema.Field field : schema.getFields()) {
        Object value = record.get(field.name());
        if (value == null) {
          if (keyFields.contains(field.name())) {
            violations.add(new SchemaViolation(entity, renderedKey, field.name(), SchemaViolation.Type.NULL_KEY,
                "primary key field is null"));
          } else if (!AvroSchemas.isNullable(field.schema())) {
            violations.add(new SchemaViolation(entity, renderedKey, field.name(), SchemaViolation.Type.NULL_VALUE,
                "null in non-nullable field of type " + AvroSchemas.describe(field.schema())));
          }
          continue;
        }
        SchemaViolation violation = checkValue(entity, renderedKey, field, value);
        if (violation != null) {
          violations.add(violation);
        }
      }

      if (!key.hasNull() && !seenKeys.add(key)) {
        violations.add(new SchemaViolation(entity, renderedKey, null, SchemaViolation.Type.DUPLICATE_KEY,
            "primary key appears more than once"));
      }
    }

    for (String missing : missingFields) {
      violations.add(new SchemaViolation(entity, null, missing, SchemaViolation.Type.MISSING_FIELD,
          "field declared by " + schema.getFullName() + " is not present in the rows"));
    }

    if (!violations.isEmpty()) {
      log.debug("{} violation(s) found in {}", violations.size(), rowSet);
    }
    return violations;
  }

  /**
   * Report rows of the given source entities whose foreign keys reference no row of the referenced entity.
   * References to an entity absent from {@code rowSets} are not checked; null references are not dangling.
   */
  public List<SchemaViolation> validateReferences(Map<StarSchemaEntity, RowSet> rowSets) {
    List<SchemaViolation> violations = Lists.newArrayList();
    for (StarSchemaEntity entity : StarSchemaEntity.sources()) {
      RowSet rowSet = rowSets.get(entity);
      if (rowSet == null) {
        continue;
      }
      for (ForeignKey foreignKey : entity.getForeignKeys()) {
        RowSet referenced = rowSets.get(foreignKey.getReferenced());
        if (referenced == null) {
          continue;
        }
        Set<RecordKey> referencedKeys = new HashSet<>();
        for (GenericRecord row : referenced.getRows()) {
          referencedKeys.add(foreignKey.getReferenced().keyOf(row));
        }
        for (GenericRecord row : rowSet.getRows()) {
          RecordKey reference = RecordKey.of(row, foreignKey.getFields());
          if (!reference.hasNull() && !referencedKeys.contains(reference)) {
            violations.add(new SchemaViolation(entity, entity.keyOf(row).toString(),
                String.join(",", foreignKey.getFields()), SchemaViolation.Type.DANGLING_REFERENCE,
                String.format("%s has no row %s", foreignKey.getReferenced().getTableName(), reference)));
          }
        }
      }
    }
    return violations;
  }

  /**
   * @return the fatal violations among {@code violations}.
   */
  public static List<SchemaViolation> fatal(List<SchemaViolation> violations) {
    List<SchemaViolation> fatal = new ArrayList<>();
    for (SchemaViolation violation : violations) {
      if (violation.isFatal()) {
        fatal.add(violation);
      }
    }
    return fatal;
  }

  private static SchemaViolation checkValue(StarSchemaEntity entity, String key, Schema.Field field, Object value) {
    Schema type = AvroSchemas.nonNull(field.schema());
    if (AvroSchemas.isDecimal(type)) {
      if (!(value instanceof BigDecimal)) {
        return typeMismatch(entity, key, field, value);
      }
      return checkDecimal(entity, key, field, (BigDecimal) value, AvroSchemas.decimal(type));
    }
    if (AvroSchemas.isDate(type)) {
      return value instanceof LocalDate ? null : typeMismatch(entity, key, field, value);
    }
    boolean ok;
    switch (type.getType()) {
      case STRING:
        ok = value instanceof CharSequence;
        break;
      case INT:
        ok = value instanceof Integer;
        break;
      case LONG:
        ok = value instanceof Long;
        break;
      case DOUBLE:
        ok = value instanceof Double;
        break;
      case BOOLEAN:
        ok = value instanceof Boolean;
        break;
      default:
        ok = true;
    }
    return ok ? null : typeMismatch(entity, key, field, value);
  }

  private static SchemaViolation checkDecimal(StarSchemaEntity entity, String key, Schema.Field field,
      BigDecimal value, LogicalTypes.Decimal decimal) {
    BigDecimal scaled;
    try {
      scaled = value.setScale(decimal.getScale(), RoundingMode.UNNECESSARY);
    } catch (ArithmeticException ae) {
      return new SchemaViolation(entity, key, field.name(), SchemaViolation.Type.PRECISION_OVERFLOW,
          String.format("%s has more than %d fraction digits", value.toPlainString(), decimal.getScale()));
    }
    if (scaled.precision() > decimal.getPrecision()) {
      return new SchemaViolation(entity, key, field.name(), SchemaViolation.Type.PRECISION_OVERFLOW,
          String.format("%s does not fit decimal(%d,%d)", value.toPlainString(), decimal.getPrecision(),
              decimal.getScale()));
    }
    return null;
  }

  private static SchemaViolation typeMismatch(StarSchemaEntity entity, String key, Schema.Field field, Object value) {
    return new SchemaViolation(entity, key, field.name(), SchemaViolation.Type.TYPE_MISMATCH,
        String.format("expected %s but found %s", AvroSchemas.describe(field.schema()),
            value.getClass().getSimpleName()));
  }
}
