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

import java.util.EnumMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.StarSchemaEntity;


/**
 * The row sets of all five source entities as extracted by one run.
 */
public class SourceSnapshot {

  private final ImmutableMap<StarSchemaEntity, RowSet> rowSets;

  private SourceSnapshot(Map<StarSchemaEntity, RowSet> rowSets) {
    this.rowSets = Maps.immutableEnumMap(rowSets);
  }

  /**
   * @throws IllegalArgumentException if a source entity is missing or a row set belongs to a target entity
   */
  public static SourceSnapshot of(Map<StarSchemaEntity, RowSet> rowSets) {
    for (StarSchemaEntity entity : StarSchemaEntity.sources()) {
      Preconditions.checkArgument(rowSets.containsKey(entity), "Snapshot has no rows for %s", entity.getTableName());
    }
    for (Map.Entry<StarSchemaEntity, RowSet> entry : rowSets.entrySet()) {
      Preconditions.checkArgument(entry.getKey().isSource(), "%s is not a source entity", entry.getKey());
      Preconditions.checkArgument(entry.getValue().getEntity() == entry.getKey(), "Row set %s filed under %s",
          entry.getValue(), entry.getKey());
    }
    return new SourceSnapshot(new EnumMap<>(rowSets));
  }

  public static Builder builder() {
    return new Builder();
  }

  public RowSet get(StarSchemaEntity entity) {
    return this.rowSets.get(entity);
  }

  public Map<StarSchemaEntity, RowSet> asMap() {
    return this.rowSets;
  }

  public long totalRows() {
    long total = 0;
    for (RowSet rowSet : this.rowSets.values()) {
      total += rowSet.size();
    }
    return total;
  }

  public static class Builder {
    private final Map<StarSchemaEntity, RowSet> rowSets = new EnumMap<>(StarSchemaEntity.class);

    public Builder add(RowSet rowSet) {
      this.rowSets.put(rowSet.getEntity(), rowSet);
      return this;
    }

    public SourceSnapshot build() {
      return of(this.rowSets);
    }
  }
}
