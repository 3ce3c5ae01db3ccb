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

import java.util.Collections;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;


/**
 * Written to {@code _backup/<run id>/_PUBLISHING} before the first table of a run is swapped, and deleted once every
 * table is swapped. A journal found on startup marks a publish that did not complete.
 *
 * <p>
 *   {@code createdTables} names the tables that had no visible snapshot when the publish started. Only those may be
 *   deleted when the publish is undone; any other table is either still in place or has a backup to restore.
 * </p>
 */
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class PublishJournal {

  private String runId;
  private List<String> tables;
  private List<String> createdTables;
  private long startedAtMillis;

  public List<String> getCreatedTables() {
    return this.createdTables == null ? Collections.<String>emptyList() : this.createdTables;
  }
}
