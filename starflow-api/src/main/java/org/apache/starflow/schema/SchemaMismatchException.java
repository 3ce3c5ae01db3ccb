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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import org.apache.starflow.exception.NonTransientException;


/**
 * Thrown when fetched or derived data does not have the shape its {@link StarSchemaEntity} declares.
 *
 * <p>
 *   This is a data contract violation: it is never retried and fails the run.
 * </p>
 */
public class SchemaMismatchException extends NonTransientException {
  private static final long serialVersionUID = 4153626707935580311L;

  private static final int MAX_VIOLATIONS_IN_MESSAGE = 10;

  private final StarSchemaEntity entity;
  private final List<SchemaViolation> violations;

  public SchemaMismatchException(StarSchemaEntity entity, List<SchemaViolation> violations) {
    super(buildMessage(entity, violations));
    this.entity = entity;
    this.violations = ImmutableList.copyOf(violations);
  }

  public SchemaMismatchException(StarSchemaEntity entity, String message, Throwable cause) {
    super(String.format("Schema mismatch on %s: %s", entity.getTableName(), message), cause);
    this.entity = entity;
    this.violations = ImmutableList.of();
  }

  public StarSchemaEntity getEntity() {
    return this.entity;
  }

  public List<SchemaViolation> getViolations() {
    return this.violations;
  }

  private static String buildMessage(StarSchemaEntity entity, List<SchemaViolation> violations) {
    List<SchemaViolation> shown = violations.subList(0, Math.min(violations.size(), MAX_VIOLATIONS_IN_MESSAGE));
    String message = String.format("Schema mismatch on %s, %d violation(s): %s", entity.getTableName(),
        violations.size(), Joiner.on("; ").join(shown));
    return violations.size() > shown.size() ? message + "; ..." : message;
  }
}
