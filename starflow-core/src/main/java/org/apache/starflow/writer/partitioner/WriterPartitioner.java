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

package org.apache.starflow.writer.partitioner;

import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Optional;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.schema.StarSchemaEntity;


/**
 * Partitions records in the writer phase.
 *
 * @param <D> data record type
 */
public interface WriterPartitioner<D> {

  /**
   * Returns the relative directory of the partition that the input record belongs to. Two records belong to the
   * same partition iff their partition paths are equal.
   *
   * @param record input to compute partition for.
   */
  String partitionForRecord(D record);

  /**
   * Get the partitioner configured for a table through {@code writer.partitioner.<table>.column} and
   * {@code writer.partitioner.<table>.granularity}, absent when the table is not partitioned.
   */
  static Optional<WriterPartitioner<GenericRecord>> forTable(State state, StarSchemaEntity entity) {
    String prefix = ConfigurationKeys.WRITER_PARTITIONER_PREFIX + entity.getTableName();
    String column = state.getProp(prefix + ConfigurationKeys.WRITER_PARTITIONER_COLUMN_SUFFIX);
    if (column == null) {
      return Optional.absent();
    }
    DatePartitioner.Granularity granularity = DatePartitioner.Granularity.valueOf(
        state.getProp(prefix + ConfigurationKeys.WRITER_PARTITIONER_GRANULARITY_SUFFIX,
            DatePartitioner.DEFAULT_GRANULARITY.name()).toUpperCase());
    return Optional.<WriterPartitioner<GenericRecord>>of(new DatePartitioner(entity.getSchema(), column, granularity));
  }
}
