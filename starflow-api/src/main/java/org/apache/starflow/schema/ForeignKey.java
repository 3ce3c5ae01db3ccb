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

import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * A reference from the {@link #getFields()} of one entity to the primary key of another entity.
 */
@Getter
@EqualsAndHashCode
public class ForeignKey {

  private final StarSchemaEntity entity;
  private final List<String> fields;
  private final StarSchemaEntity referenced;

  public ForeignKey(StarSchemaEntity entity, List<String> fields, StarSchemaEntity referenced) {
    this.entity = entity;
    this.fields = ImmutableList.copyOf(fields);
    this.referenced = referenced;
  }

  @Override
  public String toString() {
    return String.format("%s%s -> %s%s", this.entity.getTableName(), this.fields, this.referenced.getTableName(),
        this.referenced.getPrimaryKey());
  }
}
