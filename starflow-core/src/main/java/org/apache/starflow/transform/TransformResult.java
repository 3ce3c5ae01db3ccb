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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import lombok.Getter;

import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.StarSchemaEntity;


/**
 * The four target tables derived by one run together with the accounting of what was left out of them.
 */
@Getter
public class TransformResult {

  private final Map<StarSchemaEntity, RowSet> tables;
  private final Map<StarSchemaEntity, Long> rowsSkipped;
  private final List<LocationConflict> locationConflicts;
  /** Product codes whose product line could not be resolved. */
  private final List<String> unresolvedReferences;
  /** The first gaps found, bounded by the configured sample size. */
  private final List<ReferentialGap> referentialGaps;
  private final long referentialGapCount;

  TransformResult(Map<StarSchemaEntity, RowSet> tables, Map<StarSchemaEntity, Long> rowsSkipped,
      List<LocationConflict> locationConflicts, List<String> unresolvedReferences,
      List<ReferentialGap> referentialGaps, long referentialGapCount) {
    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      Preconditions.checkArgument(tables.containsKey(target), "Result has no table %s", target.getTableName());
    }
    this.tables = Maps.immutableEnumMap(tables);
    Map<StarSchemaEntity, Long> skipped = new EnumMap<>(StarSchemaEntity.class);
    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      skipped.put(target, rowsSkipped.getOrDefault(target, 0L));
    }
    this.rowsSkipped = Maps.immutableEnumMap(skipped);
    this.locationConflicts = ImmutableList.copyOf(locationConflicts);
    this.unresolvedReferences = ImmutableList.copyOf(unresolvedReferences);
    this.referentialGaps = ImmutableList.copyOf(referentialGaps);
    this.referentialGapCount = referentialGapCount;
  }

  public RowSet getTable(StarSchemaEntity target) {
    return this.tables.get(target);
  }

  public long getRowsSkipped(StarSchemaEntity target) {
    return this.rowsSkipped.get(target);
  }

  /**
   * @return one human readable line per location conflict and unresolved product line.
   */
  public List<String> getWarnings() {
    List<String> warnings = new ArrayList<>();
    for (LocationConflict conflict : this.locationConflicts) {
      warnings.add(conflict.toString());
    }
    warnings.addAll(this.unresolvedReferences);
    return warnings;
  }
}
