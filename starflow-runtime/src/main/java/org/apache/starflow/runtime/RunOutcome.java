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

import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import lombok.Builder;
import lombok.Getter;


/**
 * What a run did: its status, row counts per table, the warnings raised while deriving the star schema, a sample
 * of the referential gaps that excluded fact rows and, for a run that did not succeed, the error.
 *
 * <p>
 *   Row count maps are keyed by table name. {@link #toJson()} renders the outcome the way the command line prints it.
 * </p>
 */
@Getter
@Builder
public class RunOutcome {

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private final String runId;
  private final String jobName;
  private final RunStatus status;
  private final long startTimeMillis;
  private final long endTimeMillis;
  private final String outputDir;
  private final Map<String, Long> rowsExtracted;
  private final Map<String, Long> rowsWritten;
  private final Map<String, Long> rowsSkipped;
  /** Published table name to its directory, empty unless the run succeeded. */
  private final Map<String, String> publishedTables;
  private final List<String> warnings;
  private final List<String> referentialGaps;
  private final long referentialGapCount;
  private final String error;

  public boolean isSuccessful() {
    return this.status == RunStatus.SUCCESS;
  }

  public long getDurationMillis() {
    return this.endTimeMillis - this.startTimeMillis;
  }

  public String toJson() {
    return GSON.toJson(this);
  }

  public static RunOutcome fromJson(String json) {
    return GSON.fromJson(json, RunOutcome.class);
  }

  @Override
  public String toString() {
    return String.format("RunOutcome[runId=%s, status=%s, rowsWritten=%s, rowsSkipped=%s]", this.runId, this.status,
        this.rowsWritten, this.rowsSkipped);
  }
}
