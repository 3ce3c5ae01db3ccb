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
import java.util.concurrent.atomic.AtomicLong;

import org.apache.avro.Conversions;
import org.apache.avro.Schema;
import org.apache.avro.data.TimeConversions;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import com.google.common.base.Optional;
import com.google.common.io.Closer;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.TableState;
import org.apache.starflow.util.HadoopUtils;


/**
 * A {@link DataWriter} that writes Avro {@link GenericRecord}s into a single Parquet file.
 *
 * <p>
 *   Records are written to a staging file under {@link ConfigurationKeys#WRITER_STAGING_DIR}. {@link #commit()}
 *   moves the finished file into {@link ConfigurationKeys#WRITER_OUTPUT_DIR}, under the writer's partition path.
 *   The compression codec is taken from {@link ConfigurationKeys#WRITER_CODEC_TYPE}, SNAPPY by default.
 *   Decimal and date logical types are written as Parquet {@code DECIMAL} and {@code DATE}.
 * </p>
 */
@Slf4j
public class ParquetDataWriter implements DataWriter<GenericRecord> {

  public static final String FILE_EXTENSION = ".parquet";

  private final TableState properties;
  private final FileSystem fs;
  private final Schema schema;
  private final Path stagingFile;
  private final Path outputFile;
  private final ParquetWriter<GenericRecord> writer;
  private final Closer closer = Closer.create();
  private final AtomicLong count = new AtomicLong(0);
  private Optional<Long> bytesWritten = Optional.absent();
  private boolean closed = false;

  public ParquetDataWriter(ParquetDataWriterBuilder builder) throws IOException {
    this.properties = builder.getTableState();
    this.fs = builder.getFileSystem();
    this.schema = builder.getSchema();

    String fileName = this.properties.getProp(ConfigurationKeys.WRITER_FILE_NAME_PREFIX,
        ConfigurationKeys.DEFAULT_WRITER_FILE_NAME_PREFIX) + "-" + builder.getWriterId() + FILE_EXTENSION;
    Path stagingDir = withPartition(new Path(this.properties.getProp(ConfigurationKeys.WRITER_STAGING_DIR)),
        builder.getPartitionPath());
    Path outputDir = withPartition(new Path(this.properties.getProp(ConfigurationKeys.WRITER_OUTPUT_DIR)),
        builder.getPartitionPath());
    this.stagingFile = new Path(stagingDir, fileName);
    this.outputFile = new Path(outputDir, fileName);

    // A staging file left over by an earlier failed attempt would block this one
    if (this.fs.exists(this.stagingFile)) {
      log.warn(String.format("Staging file %s already exists, deleting it", this.stagingFile));
      HadoopUtils.deletePath(this.fs, this.stagingFile, false);
    }
    this.writer = this.closer.register(buildParquetWriter());
  }

  private static Path withPartition(Path dir, String partitionPath) {
    return partitionPath == null || partitionPath.isEmpty() ? dir : new Path(dir, partitionPath);
  }

  /**
   * The data model the writer converts logical types with.
   */
  public static GenericData dataModel() {
    GenericData model = new GenericData();
    model.addLogicalTypeConversion(new Conversions.DecimalConversion());
    model.addLogicalTypeConversion(new TimeConversions.DateConversion());
    return model;
  }

  private ParquetWriter<GenericRecord> buildParquetWriter() throws IOException {
    int pageSize = this.properties.getPropAsInt(ConfigurationKeys.WRITER_PARQUET_PAGE_SIZE,
        ParquetWriter.DEFAULT_PAGE_SIZE);
    int blockSize = this.properties.getPropAsInt(ConfigurationKeys.WRITER_PARQUET_BLOCK_SIZE,
        ParquetWriter.DEFAULT_BLOCK_SIZE);
    boolean enableDictionary = this.properties.getPropAsBoolean(ConfigurationKeys.WRITER_PARQUET_DICTIONARY,
        ParquetWriter.DEFAULT_IS_DICTIONARY_ENABLED);
    boolean validate = this.properties.getPropAsBoolean(ConfigurationKeys.WRITER_PARQUET_VALIDATE,
        ParquetWriter.DEFAULT_IS_VALIDATING_ENABLED);

    return AvroParquetWriter.<GenericRecord>builder(HadoopOutputFile.fromPath(this.stagingFile, this.fs.getConf()))
        .withSchema(this.schema)
        .withDataModel(dataModel())
        .withCompressionCodec(getCodecFromConfig())
        .withPageSize(pageSize)
        .withRowGroupSize(blockSize)
        .withDictionaryEncoding(enableDictionary)
        .withValidation(validate)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
        .withConf(this.fs.getConf())
        .build();
  }

  private CompressionCodecName getCodecFromConfig() {
    String codecValue = this.properties.getProp(ConfigurationKeys.WRITER_CODEC_TYPE,
        ConfigurationKeys.DEFAULT_WRITER_CODEC_TYPE);
    return CompressionCodecName.valueOf(codecValue.toUpperCase());
  }

  @Override
  public void write(GenericRecord record) throws IOException {
    this.writer.write(record);
    this.count.incrementAndGet();
  }

  @Override
  public long recordsWritten() {
    return this.count.get();
  }

  @Override
  public long bytesWritten() throws IOException {
    if (this.bytesWritten.isPresent()) {
      return this.bytesWritten.get().longValue();
    }
    return 0L;
  }

  /**
   * {@inheritDoc}.
   *
   * <p>
   *   Closes the Parquet file and renames the staging file to the output file.
   * </p>
   */
  @Override
  public void commit() throws IOException {
    close();

    if (!this.fs.exists(this.stagingFile)) {
      throw new IOException(String.format("File %s does not exist", this.stagingFile));
    }
    this.bytesWritten = Optional.of(Long.valueOf(this.fs.getFileStatus(this.stagingFile).getLen()));

    log.info(String.format("Moving data from %s to %s", this.stagingFile, this.outputFile));
    if (this.fs.exists(this.outputFile)) {
      log.warn(String.format("Output file %s already exists", this.outputFile));
      HadoopUtils.deletePath(this.fs, this.outputFile, false);
    }
    HadoopUtils.movePath(this.fs, this.stagingFile, this.outputFile);
    this.properties.appendToSetProp(ConfigurationKeys.WRITER_FINAL_OUTPUT_FILE_PATHS, this.outputFile.toString());
  }

  /**
   * {@inheritDoc}.
   *
   * <p>
   *   Deletes the staging file if it exists.
   * </p>
   */
  @Override
  public void cleanup() throws IOException {
    close();
    if (this.fs.exists(this.stagingFile)) {
      HadoopUtils.deletePath(this.fs, this.stagingFile, false);
    }
  }

  @Override
  public void close() throws IOException {
    if (!this.closed) {
      this.closed = true;
      this.closer.close();
    }
  }

  public Path getOutputFile() {
    return this.outputFile;
  }
}
