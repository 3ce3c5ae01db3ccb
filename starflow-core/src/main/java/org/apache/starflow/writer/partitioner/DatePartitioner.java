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

import java.time.LocalDate;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Preconditions;

import org.apache.starflow.schema.AvroSchemas;


/**
 * A {@link WriterPartitioner} that partitions a record on a {@code date} column into hive style directories,
 * e.g. {@code year=2003/month=01}. Records with a null date go to {@link #NULL_PARTITION}.
 */
public class DatePartitioner implements WriterPartitioner<GenericRecord> {

  public enum Granularity {
    YEAR,
    MONTH,
    DAY
  }

  public static final Granularity DEFAULT_GRANULARITY = Granularity.MONTH;
  public static final String NULL_PARTITION = "__HIVE_DEFAULT_PARTITION__";

  private final String column;
  private final Granularity granularity;

  public DatePartitioner(Schema schema, String column, Granularity granularity) {
    Schema.Field field = schema.getField(column);
    Preconditions.checkArgument(field != null, "Partition column %s is not a field of %s", column,
        schema.getFullName());
    Preconditions.checkArgument(AvroSchemas.isDate(field.schema()), "Partition column %s is not a date but %s",
        column, AvroSchemas.describe(field.schema()));
    this.column = column;
    this.granularity = granularity;
  }

  @Override
  public String partitionForRecord(GenericRecord record) {
    Object value = record.get(this.column);
    if (value == null) {
      return "year=" + NULL_PARTITION;
    }
    LocalDate date = value instanceof LocalDate ? (LocalDate) value : LocalDate.ofEpochDay(((Number) value).longValue());
    StringBuilder path = new StringBuilder("year=").append(date.getYear());
    if (this.granularity != Granularity.YEAR) {
      path.append(String.format("/month=%02d", date.getMonthValue()));
    }
    if (this.granularity == Granularity.DAY) {
      path.append(String.format("/day=%02d", date.getDayOfMonth()));
    }
    return path.toString();
  }
}
