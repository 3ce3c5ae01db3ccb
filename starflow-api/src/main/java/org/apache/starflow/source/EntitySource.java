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

package org.apache.starflow.source;

import java.io.Closeable;
import java.io.IOException;

import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.StarSchemaEntity;


/**
 * The relational store the source entities are read from.
 *
 * <p>
 *   An {@link EntitySource} owns the connections to the store. Implementations must be safe to call from several
 *   threads at once, one entity per call, and must release every connection they acquire before returning.
 * </p>
 */
public interface EntitySource extends Closeable {

  /**
   * Fetch the complete current contents of one source entity.
   *
   * @param entity a source entity
   * @return the rows of the entity in key order
   * @throws SourceUnavailableException if the store cannot be reached or does not answer within the query timeout
   * @throws SchemaMismatchException if the fetched rows do not have the entity's declared shape
   * @throws IOException for any other failure reading the store
   */
  RowSet extract(StarSchemaEntity entity) throws IOException;
}
