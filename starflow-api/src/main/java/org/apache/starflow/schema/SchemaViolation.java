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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * A single row or column of an entity that breaks the entity's schema or key contract.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class SchemaViolation {

  public enum Type {
    MISSING_FIELD(true),
    TYPE_MISMATCH(true),
    NULL_VALUE(true),
    NULL_KEY(true),
    DUPLICATE_KEY(true),
    PRECISION_OVERFLOW(true),
    DANGLING_REFERENCE(false);

    private final boolean fatal;

    Type(boolean fatal) {
      this.fatal = fatal;
    }

    /**
     * @return true if a violation of this type breaks the data contract, false if the row can be excluded and counted.
     */
    public boolean isFatal() {
      return this.fatal;
    }
  }

  private final StarSchemaEntity entity;
  /** Rendered primary key of the offending row, null for column level violations. */
  private final String key;
  /** Offending field, null for row level violations. */
  private final String field;
  private final Type type;
  private final String reason;

  public boolean isFatal() {
    return this.type.isFatal();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(this.entity.getTableName()).append(": ").append(this.type);
    if (this.key != null) {
      sb.append(" [").append(this.key).append("]");
    }
    if (this.field != null) {
      sb.append(" field ").append(this.field);
    }
    return sb.append(": ").append(this.reason).toString();
  }
}
