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

package org.apache.starflow.publisher;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;

import org.apache.starflow.configuration.State;
import org.apache.starflow.configuration.TableState;


/**
 * Defines how to publish the staged tables of a run and their corresponding metadata.
 */
public abstract class DataPublisher implements Closeable {

  protected final State state;

  public DataPublisher(State state) {
    this.state = state;
  }

  /**
   * Publish the data of the given tables.
   */
  public abstract void publishData(Collection<? extends TableState> states) throws IOException;

  /**
   * Publish the metadata (e.g., schema, row counts) of the given tables.
   */
  public abstract void publishMetadata(Collection<? extends TableState> states) throws IOException;

  /**
   * First publish the metadata via {@link DataPublisher#publishMetadata(Collection)}, and then publish the output data
   * via the {@link DataPublisher#publishData(Collection)} method.
   *
   * @param states is a {@link Collection} of {@link TableState}s.
   * @throws IOException if there is a problem with publishing the metadata or the data.
   */
  public void publish(Collection<? extends TableState> states) throws IOException {
    publishMetadata(states);
    publishData(states);
  }

  public State getState() {
    return this.state;
  }
}
