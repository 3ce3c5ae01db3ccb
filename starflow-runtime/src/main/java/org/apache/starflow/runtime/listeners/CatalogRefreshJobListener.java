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

package org.apache.starflow.runtime.listeners;

import org.apache.starflow.catalog.CatalogRefreshRequest;
import org.apache.starflow.catalog.CatalogRefreshTrigger;
import org.apache.starflow.catalog.CatalogRefreshTriggers;
import org.apache.starflow.configuration.State;
import org.apache.starflow.runtime.JobContext;
import org.apache.starflow.runtime.RunOutcome;

import lombok.extern.slf4j.Slf4j;


/**
 * Tells the external catalog about every newly published snapshot through the configured
 * {@link CatalogRefreshTrigger}. The run has succeeded by then, so a failing trigger is only logged by the launcher.
 */
@Slf4j
public class CatalogRefreshJobListener extends AbstractJobListener {

  private final CatalogRefreshTrigger trigger;

  public CatalogRefreshJobListener(State state) {
    this(CatalogRefreshTriggers.create(state));
  }

  public CatalogRefreshJobListener(CatalogRefreshTrigger trigger) {
    this.trigger = trigger;
  }

  @Override
  public void onJobCompletion(JobContext jobContext) throws Exception {
    RunOutcome outcome = jobContext.getOutcome();
    CatalogRefreshRequest request = new CatalogRefreshRequest(outcome.getRunId(), outcome.getOutputDir(),
        outcome.getPublishedTables(), outcome.getEndTimeMillis());
    log.info("Requesting catalog refresh of {} tables under {}", request.getTables().size(), request.getLocation());
    this.trigger.trigger(request);
  }
}
