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
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Optional;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.io.Closer;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.writer.partitioner.WriterPartitioner;


/**
 * A {@link DataWriter} that fans records out to one {@link ParquetDataWriter} per partition.
 *
 * <p>
 *   Without a partitioner, a single writer is created up front so that even an empty table gets a Parquet file
 *   carrying its schema.
 * </p>
 */
@Slf4j
public class PartitionedParquetWriter implements DataWriter<GenericRecord> {

  private static final String NON_PARTITIONED_WRITER_KEY = "";

  private final Optional<WriterPartitioner<GenericRecord>> partitioner;
  private final LoadingCache<String, DataWriter<GenericRecord>> partitionWriters;
  private final Closer closer = Closer.create();

  public PartitionedParquetWriter(final ParquetDataWriterBuilder builder,
      Optional<WriterPartitioner<GenericRecord>> partitioner) throws IOException {
    this.partitioner = partitioner;
    this.partitionWriters = CacheBuilder.newBuilder().build(new CacheLoader<String, DataWriter<GenericRecord>>() {
      @Override
      public DataWriter<GenericRecord> load(String partitionPath) throws Exception {
        log.debug("Creating writer for partition {} of {}", partitionPath, builder.getTableState().getTableName());
        return PartitionedParquetWriter.this.closer.register(builder.forPartition(partitionPath).build());
      }
    });
    if (!partitioner.isPresent()) {
      try {
        this.partitionWriters.get(NON_PARTITIONED_WRITER_KEY);
      } catch (ExecutionException ee) {
        throw new IOException("Failed to create writer", ee.getCause());
      }
    }
  }

  @Override
  public void write(GenericRecord record) throws IOException {
    String partition = this.partitioner.isPresent()
        ? this.partitioner.get().partitionForRecord(record) : NON_PARTITIONED_WRITER_KEY;
    try {
      this.partitionWriters.get(partition).write(record);
    } catch (ExecutionException ee) {
      throw new IOException("Failed to create writer for partition " + partition, ee.getCause());
    }
  }

  @Override
  public void commit() throws IOException {
    int writersCommitted = 0;
    for (Map.Entry<String, DataWriter<GenericRecord>> entry : this.partitionWriters.asMap().entrySet()) {
      try {
        entry.getValue().commit();
        writersCommitted++;
      } catch (IOException ioe) {
        log.error(String.format("Failed to commit writer for partition %s.", entry.getKey()), ioe);
      }
    }
    if (writersCommitted < this.partitionWriters.asMap().size()) {
      throw new IOException("Failed to commit all writers.");
    }
  }

  @Override
  public void cleanup() throws IOException {
    int writersCleanedUp = 0;
    for (Map.Entry<String, DataWriter<GenericRecord>> entry : this.partitionWriters.asMap().entrySet()) {
      try {
        entry.getValue().cleanup();
        writersCleanedUp++;
      } catch (IOException ioe) {
        log.error(String.format("Failed to cleanup writer for partition %s.", entry.getKey()), ioe);
      }
    }
    if (writersCleanedUp < this.partitionWriters.asMap().size()) {
      throw new IOException("Failed to clean up all writers.");
    }
  }

  @Override
  public long recordsWritten() {
    long totalRecords = 0;
    for (DataWriter<GenericRecord> writer : this.partitionWriters.asMap().values()) {
      totalRecords += writer.recordsWritten();
    }
    return totalRecords;
  }

  @Override
  public long bytesWritten() throws IOException {
    long totalBytes = 0;
    for (DataWriter<GenericRecord> writer : this.partitionWriters.asMap().values()) {
      totalBytes += writer.bytesWritten();
    }
    return totalBytes;
  }

  public int getPartitionCount() {
    return this.partitionWriters.asMap().size();
  }

  @Override
  public void close() throws IOException {
    this.closer.close();
  }
}
