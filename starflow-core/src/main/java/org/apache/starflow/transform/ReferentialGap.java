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

package org.apache.starflow.transform;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import org.apache.starflow.schema.StarSchemaEntity;


/**
 * A source row that could not be carried into a target table because something it references is absent.
 * The row is excluded and counted; the run still succeeds.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class ReferentialGap {

  /** The target table the row was excluded from. */
  private final StarSchemaEntity table;
  /** Rendered key of the excluded source row. */
  private final String sourceKey;
  /** The entity the unresolved reference points to. */
  private final StarSchemaEntity missing;
  /** Rendered unresolved reference. */
  private final String reference;

  @Override
  public String toString() {
    return String.format("%s excludes %s: no %s row %s", this.table.getTableName(), this.sourceKey,
        this.missing.getTableName(), this.reference);
  }
}
