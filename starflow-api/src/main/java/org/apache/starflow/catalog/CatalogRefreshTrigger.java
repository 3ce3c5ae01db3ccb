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

package org.apache.starflow.catalog;

import java.io.IOException;


/**
 * Tells the external metadata catalog that a new snapshot of the star schema has been published.
 *
 * <p>
 *   Implementations are instantiated reflectively with a public constructor taking a
 *   {@link org.apache.starflow.configuration.State}. Triggering is fire and forget: the run has already succeeded
 *   when the trigger is called.
 * </p>
 */
public interface CatalogRefreshTrigger {

  void trigger(CatalogRefreshRequest request) throws IOException;
}
