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

import org.apache.avro.generic.GenericRecord;

import com.google.common.collect.ImmutableList;

import lombok.Getter;


/**
 * The complete, ordered rows of one entity. Row order is the order in which the rows were extracted or derived.
 */
@Getter
public class RowSet {

  private final StarSchemaEntity entity;
  private final List<GenericRecord> rows;

  public RowSet(StarSchemaEntity entity, List<GenericRecord> rows) {
    this.entity = entity;
    this.rows = ImmutableList.copyOf(rows);
  }

  public int size() {
    return this.rows.size();
  }

  @Override
  public String toString() {
    return String.format("RowSet[%s, %d rows]", this.entity.getTableName(), this.rows.size());
  }
}
