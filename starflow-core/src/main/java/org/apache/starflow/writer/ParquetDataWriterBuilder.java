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

package org.apache.starflow.writer;

import java.io.IOException;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileSystem;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.apache.starflow.configuration.ConfigurationKeys;


/**
 * A {@link DataWriterBuilder} for {@link ParquetDataWriter}s.
 *
 * <p>
 *   The table state must carry {@link ConfigurationKeys#WRITER_STAGING_DIR} and
 *   {@link ConfigurationKeys#WRITER_OUTPUT_DIR}.
 * </p>
 */
public class ParquetDataWriterBuilder extends DataWriterBuilder<Schema, GenericRecord> {

  private FileSystem fs;

  public ParquetDataWriterBuilder withFileSystem(FileSystem fs) {
    this.fs = fs;
    return this;
  }

  public FileSystem getFileSystem() {
    return this.fs;
  }

  /**
   * A copy of this builder writing the partition at <code>partitionPath</code>.
   */
  public ParquetDataWriterBuilder forPartition(String partitionPath) {
    ParquetDataWriterBuilder copy = new ParquetDataWriterBuilder().withFileSystem(this.fs);
    copy.forTable(this.tableState).withWriterId(this.writerId).withSchema(this.schema)
        .withPartitionPath(partitionPath);
    return copy;
  }

  @Override
  public ParquetDataWriter build() throws IOException {
    Preconditions.checkNotNull(this.fs, "File system is not set");
    Preconditions.checkNotNull(this.tableState, "Table is not set");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(this.writerId), "Writer id is not set");
    Preconditions.checkNotNull(this.schema, "Schema is not set");
    Preconditions.checkArgument(this.tableState.contains(ConfigurationKeys.WRITER_STAGING_DIR),
        "Missing %s for table %s", ConfigurationKeys.WRITER_STAGING_DIR, this.tableState.getTableName());
    Preconditions.checkArgument(this.tableState.contains(ConfigurationKeys.WRITER_OUTPUT_DIR),
        "Missing %s for table %s", ConfigurationKeys.WRITER_OUTPUT_DIR, this.tableState.getTableName());
    return new ParquetDataWriter(this);
  }
}
