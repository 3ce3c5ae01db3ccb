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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import lombok.Getter;
import lombok.ToString;


/**
 * What an external catalog needs to know to re-discover a freshly published table set.
 */
@Getter
@ToString
public class CatalogRefreshRequest {

  private final String runId;
  /** Root under which the published tables live. */
  private final String location;
  /** Published table name to its directory. */
  private final Map<String, String> tables;
  private final long publishedAtMillis;

  public CatalogRefreshRequest(String runId, String location, Map<String, String> tables, long publishedAtMillis) {
    this.runId = runId;
    this.location = location;
    this.tables = ImmutableMap.copyOf(tables);
    this.publishedAtMillis = publishedAtMillis;
  }
}
