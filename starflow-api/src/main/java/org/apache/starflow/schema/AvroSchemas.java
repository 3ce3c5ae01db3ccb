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

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;


/**
 * Helpers for the subset of Avro the star schema uses: primitives, nullable unions with {@code null},
 * {@code decimal} over bytes and {@code date} over int.
 */
public class AvroSchemas {

  private AvroSchemas() {
  }

  public static boolean isNullable(Schema schema) {
    if (schema.getType() == Schema.Type.NULL) {
      return true;
    }
    if (schema.getType() != Schema.Type.UNION) {
      return false;
    }
    for (Schema branch : schema.getTypes()) {
      if (branch.getType() == Schema.Type.NULL) {
        return true;
      }
    }
    return false;
  }

  /**
   * Get the non-null branch of a nullable union, or the schema itself if it is not a union.
   */
  public static Schema nonNull(Schema schema) {
    if (schema.getType() != Schema.Type.UNION) {
      return schema;
    }
    for (Schema branch : schema.getTypes()) {
      if (branch.getType() != Schema.Type.NULL) {
        return branch;
      }
    }
    throw new IllegalArgumentException("Union has no non-null branch: " + schema);
  }

  public static boolean isDecimal(Schema schema) {
    return nonNull(schema).getLogicalType() instanceof LogicalTypes.Decimal;
  }

  public static LogicalTypes.Decimal decimal(Schema schema) {
    LogicalType logicalType = nonNull(schema).getLogicalType();
    if (!(logicalType instanceof LogicalTypes.Decimal)) {
      throw new IllegalArgumentException("Not a decimal schema: " + schema);
    }
    return (LogicalTypes.Decimal) logicalType;
  }

  public static boolean isDate(Schema schema) {
    return nonNull(schema).getLogicalType() instanceof LogicalTypes.Date;
  }

  /**
   * Render the type of a field schema for messages, e.g. {@code decimal(10,2)} or {@code string?}.
   */
  public static String describe(Schema schema) {
    Schema type = nonNull(schema);
    String name;
    if (isDecimal(type)) {
      LogicalTypes.Decimal decimal = decimal(type);
      name = String.format("decimal(%d,%d)", decimal.getPrecision(), decimal.getScale());
    } else if (isDate(type)) {
      name = "date";
    } else {
      name = type.getType().getName();
    }
    return isNullable(schema) ? name + "?" : name;
  }
}
