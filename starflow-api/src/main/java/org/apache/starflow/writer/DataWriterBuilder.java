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

import org.apache.starflow.configuration.TableState;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * A builder class for {@link DataWriter}.
 *
 * @param <S> schema type
 * @param <D> data record type
 */
@Getter
@Slf4j
public abstract class DataWriterBuilder<S, D> {

  protected TableState tableState;
  protected String writerId;
  protected S schema;
  /** Relative directory of the partition the writer writes, empty for an unpartitioned table. */
  protected String partitionPath = "";

  /**
   * Tell the writer which table of which run it writes. The table state also carries the writer configuration.
   */
  public DataWriterBuilder<S, D> forTable(TableState tableState) {
    this.tableState = tableState;
    log.debug("For table: {}", tableState.getTableName());
    return this;
  }

  public DataWriterBuilder<S, D> withWriterId(String writerId) {
    this.writerId = writerId;
    log.debug("withWriterId : {}", this.writerId);
    return this;
  }

  public DataWriterBuilder<S, D> withSchema(S schema) {
    this.schema = schema;
    log.debug("withSchema : {}", this.schema);
    return this;
  }

  public DataWriterBuilder<S, D> withPartitionPath(String partitionPath) {
    this.partitionPath = partitionPath;
    log.debug("withPartitionPath : {}", this.partitionPath);
    return this;
  }

  /**
   * Build a {@link DataWriter}.
   *
   * @throws IOException if there is anything wrong building the writer
   */
  public abstract DataWriter<D> build() throws IOException;
}
