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

package org.apache.starflow.runtime;

import org.apache.starflow.configuration.State;

import lombok.Getter;


/**
 * The view of a run that {@link org.apache.starflow.runtime.listeners.JobListener}s receive.
 */
@Getter
public class JobContext {

  private final String jobName;
  private final String runId;
  private final State jobState;
  private final RunMetrics metrics;
  private volatile RunOutcome outcome;

  public JobContext(String jobName, String runId, State jobState, RunMetrics metrics) {
    this.jobName = jobName;
    this.runId = runId;
    this.jobState = jobState;
    this.metrics = metrics;
  }

  void setOutcome(RunOutcome outcome) {
    this.outcome = outcome;
  }

  @Override
  public String toString() {
    return String.format("JobContext[jobName=%s, runId=%s]", this.jobName, this.runId);
  }
}
