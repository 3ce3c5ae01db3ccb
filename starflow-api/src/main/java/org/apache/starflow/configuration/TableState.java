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

package org.apache.starflow.configuration;

import lombok.EqualsAndHashCode;


/**
 * The {@link State} of one target table within a run.
 *
 * <p>
 *   A {@link TableState} starts as a copy of the job configuration. The writer records its staging and output
 *   locations and record counts on it, and the publisher reads them back to decide what to make visible.
 *   The state id is the table name.
 * </p>
 */
@EqualsAndHashCode(callSuper = true)
public class TableState extends State {

  public enum WorkingState {
    PENDING,
    STAGED,
    COMMITTED,
    FAILED
  }

  private static final String WORKING_STATE_KEY = "table.working.state";
  private static final String RUN_ID_KEY = "table.run.id";

  private final String tableName;

  public TableState(State jobState, String tableName, String runId) {
    super(jobState);
    this.tableName = tableName;
    setProp(RUN_ID_KEY, runId);
    setWorkingState(WorkingState.PENDING);
  }

  public String getTableName() {
    return this.tableName;
  }

  public String getRunId() {
    return getProp(RUN_ID_KEY);
  }

  public WorkingState getWorkingState() {
    return WorkingState.valueOf(getProp(WORKING_STATE_KEY));
  }

  public void setWorkingState(WorkingState workingState) {
    setProp(WORKING_STATE_KEY, workingState.name());
  }

  public long getRecordsWritten() {
    return getPropAsLong(ConfigurationKeys.WRITER_RECORDS_WRITTEN, 0L);
  }
}
