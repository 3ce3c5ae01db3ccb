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

package org.apache.starflow.test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.avro.Conversions;
import org.apache.avro.data.TimeConversions;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;


/**
 * Reads back the Parquet files of a table directory as Avro records with decimals as
 * {@link java.math.BigDecimal} and dates as {@link java.time.LocalDate}.
 */
public class ParquetTestUtils {

  private ParquetTestUtils() {
  }

  public static GenericData dataModel() {
    GenericData model = new GenericData();
    model.addLogicalTypeConversion(new Conversions.DecimalConversion());
    model.addLogicalTypeConversion(new TimeConversions.DateConversion());
    return model;
  }

  /**
   * Read every data file under <code>dir</code>, recursively, in path order.
   */
  public static List<GenericRecord> readTable(FileSystem fs, Path dir) throws IOException {
    List<FileStatus> files = new ArrayList<>();
    collect(fs, dir, files);
    Collections.sort(files, Comparator.comparing(status -> status.getPath().toString()));

    List<GenericRecord> records = new ArrayList<>();
    for (FileStatus file : files) {
      records.addAll(readFile(fs.getConf(), file.getPath()));
    }
    return records;
  }

  public static List<GenericRecord> readFile(Configuration conf, Path file) throws IOException {
    List<GenericRecord> records = new ArrayList<>();
    try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(
        HadoopInputFile.fromPath(file, conf)).withDataModel(dataModel()).build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        records.add(record);
      }
    }
    return records;
  }

  private static void collect(FileSystem fs, Path dir, List<FileStatus> files) throws IOException {
    for (FileStatus status : fs.listStatus(dir)) {
      String name = status.getPath().getName();
      if (name.startsWith("_") || name.startsWith(".")) {
        continue;
      }
      if (status.isDirectory()) {
        collect(fs, status.getPath(), files);
      } else {
        files.add(status);
      }
    }
  }
}
