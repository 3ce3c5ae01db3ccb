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

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.State;


/**
 * A {@link CatalogRefreshTrigger} that only logs, for deployments whose catalog discovers new snapshots by itself.
 */
@Slf4j
public class NoopCatalogRefreshTrigger implements CatalogRefreshTrigger {

  public NoopCatalogRefreshTrigger(State state) {
  }

  @Override
  public void trigger(CatalogRefreshRequest request) {
    log.info("Catalog refresh not configured, skipping refresh of {}", request.getTables().keySet());
  }
}
