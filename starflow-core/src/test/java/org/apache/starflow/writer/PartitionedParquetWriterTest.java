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
import java.math.BigDecimal;
import java.nio.file.Files;
import java.time.LocalDate;
import java.util.List;

import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Optional;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.configuration.TableState;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.test.ParquetTestUtils;
import org.apache.starflow.test.SourceRecords;
import org.apache.starflow.util.HadoopUtils;
import org.apache.starflow.writer.partitioner.DatePartitioner;
import org.apache.starflow.writer.partitioner.WriterPartitioner;


/**
 * Unit tests for {@link ParquetDataWriter} and {@link PartitionedParquetWriter}.
 */
@Test(groups = {"starflow.writer"})
public class PartitionedParquetWriterTest {

  private FileSystem fs;
  private Path root;
  private Path stagingDir;
  private Path outputDir;
  private TableState tableState;

  @BeforeMethod
  public void setUp() throws IOException {
    this.fs = FileSystem.getLocal(HadoopUtils.newConfiguration());
    this.root = new Path(Files.createTempDirectory("PartitionedParquetWriterTest").toString());
    this.stagingDir = new Path(this.root, "staging");
    this.outputDir = new Path(this.root, "output");
    this.tableState = new TableState(new State(), "orders", "run-1");
    this.tableState.setProp(ConfigurationKeys.WRITER_STAGING_DIR, this.stagingDir.toString());
    this.tableState.setProp(ConfigurationKeys.WRITER_OUTPUT_DIR, this.outputDir.toString());
  }

  private ParquetDataWriterBuilder builder() {
    ParquetDataWriterBuilder builder = new ParquetDataWriterBuilder().withFileSystem(this.fs);
    builder.forTable(this.tableState).withWriterId("0").withSchema(StarSchemaEntity.ORDERS.getSchema());
    return builder;
  }

  public void testWriteAndCommit() throws IOException {
    try (ParquetDataWriter writer = builder().build()) {
      writer.write(SourceRecords.order(1, 10, LocalDate.of(2003, 1, 6)));
      writer.write(SourceRecords.order(2, 11, LocalDate.of(2003, 2, 7)));
      Assert.assertEquals(writer.recordsWritten(), 2);
      Assert.assertEquals(writer.bytesWritten(), 0L);
      writer.commit();

      Assert.assertTrue(writer.bytesWritten() > 0);
      Assert.assertTrue(this.fs.exists(writer.getOutputFile()));
      Assert.assertEquals(writer.getOutputFile(), new Path(this.outputDir, "part-0.parquet"));
      Assert.assertEquals(this.tableState.getPropAsSet(ConfigurationKeys.WRITER_FINAL_OUTPUT_FILE_PATHS).size(), 1);
    }

    List<GenericRecord> records = ParquetTestUtils.readTable(this.fs, this.outputDir);
    Assert.assertEquals(records.size(), 2);
    Assert.assertEquals(records.get(1).get("orderNumber"), 2);
    Assert.assertEquals(records.get(1).get("orderDate"), LocalDate.of(2003, 2, 7));
    Assert.assertEquals(HadoopUtils.listDataFilesRecursive(this.fs, this.stagingDir).size(), 0);
  }

  public void testDecimalsSurviveTheRoundTrip() throws IOException {
    ParquetDataWriterBuilder builder = new ParquetDataWriterBuilder().withFileSystem(this.fs);
    builder.forTable(new TableState(this.tableState, "orderdetails", "run-1")).withWriterId("0")
        .withSchema(StarSchemaEntity.ORDER_DETAILS.getSchema());
    try (ParquetDataWriter writer = builder.build()) {
      writer.write(SourceRecords.orderDetail(10100, "S10_1678", 30, "95.70", 3));
      writer.commit();
    }
    GenericRecord record = ParquetTestUtils.readTable(this.fs, this.outputDir).get(0);
    Assert.assertEquals(record.get("priceEach"), new BigDecimal("95.70"));
  }

  public void testCleanupLeavesNothing() throws IOException {
    try (ParquetDataWriter writer = builder().build()) {
      writer.write(SourceRecords.order(1, 10, LocalDate.of(2003, 1, 6)));
      writer.cleanup();
    }
    Assert.assertFalse(this.fs.exists(this.outputDir));
    Assert.assertEquals(HadoopUtils.listDataFilesRecursive(this.fs, this.stagingDir).size(), 0);
  }

  public void testPartitionedWrite() throws IOException {
    Optional<WriterPartitioner<GenericRecord>> partitioner = Optional.<WriterPartitioner<GenericRecord>>of(
        new DatePartitioner(StarSchemaEntity.ORDERS.getSchema(), "orderDate", DatePartitioner.Granularity.MONTH));
    try (PartitionedParquetWriter writer = new PartitionedParquetWriter(builder(), partitioner)) {
      writer.write(SourceRecords.order(1, 10, LocalDate.of(2003, 1, 6)));
      writer.write(SourceRecords.order(2, 10, LocalDate.of(2003, 1, 9)));
      writer.write(SourceRecords.order(3, 11, LocalDate.of(2004, 2, 11)));
      writer.commit();
      Assert.assertEquals(writer.getPartitionCount(), 2);
      Assert.assertEquals(writer.recordsWritten(), 3);
      Assert.assertTrue(writer.bytesWritten() > 0);
    }

    Assert.assertTrue(this.fs.exists(new Path(this.outputDir, "year=2003/month=01/part-0.parquet")));
    Assert.assertTrue(this.fs.exists(new Path(this.outputDir, "year=2004/month=02/part-0.parquet")));
    List<FileStatus> files = HadoopUtils.listDataFilesRecursive(this.fs, this.outputDir);
    Assert.assertEquals(files.size(), 2);
    Assert.assertEquals(ParquetTestUtils.readTable(this.fs, this.outputDir).size(), 3);
  }

  public void testUnpartitionedWriterWritesEmptyTable() throws IOException {
    try (PartitionedParquetWriter writer = new PartitionedParquetWriter(builder(),
        Optional.<WriterPartitioner<GenericRecord>>absent())) {
      writer.commit();
      Assert.assertEquals(writer.getPartitionCount(), 1);
    }
    Assert.assertEquals(HadoopUtils.listDataFilesRecursive(this.fs, this.outputDir).size(), 1);
    Assert.assertTrue(ParquetTestUtils.readTable(this.fs, this.outputDir).isEmpty());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testBuilderRequiresOutputDir() throws IOException {
    this.tableState.removeProp(ConfigurationKeys.WRITER_OUTPUT_DIR);
    builder().build();
  }

  @AfterMethod(alwaysRun = true)
  public void tearDown() throws IOException {
    this.fs.delete(this.root, true);
  }
}
