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

import java.io.Closeable;
import java.io.IOException;


/**
 * An interface for data writers.
 *
 * <p>
 *   One writer writes the rows of one table of one run. Rows only become part of the run's output once
 *   {@link #commit()} succeeds; until then they live in a writer private staging location.
 * </p>
 *
 * @param <D> data record type
 */
public interface DataWriter<D> extends Closeable {

  /**
   * Write a data record.
   *
   * @param record data record to write
   * @throws IOException if there is anything wrong writing the record
   */
  void write(D record) throws IOException;

  /**
   * Commit the data written.
   * This method is expected to be called at most once during the lifetime of a writer.
   *
   * @throws IOException if there is anything wrong committing the output
   */
  void commit() throws IOException;

  /**
   * Cleanup context/resources, deleting anything that was written but not committed.
   *
   * @throws IOException if there is anything wrong doing cleanup.
   */
  void cleanup() throws IOException;

  /**
   * Get the number of records written.
   */
  long recordsWritten();

  /**
   * Get the number of bytes written.
   */
  long bytesWritten() throws IOException;
}
