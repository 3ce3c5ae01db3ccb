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
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.util.HadoopUtils;


/**
 * A {@link CatalogRefreshTrigger} that drops a JSON refresh request, {@code <run id>.json}, into
 * {@link ConfigurationKeys#CATALOG_REFRESH_MARKER_DIR} for an external crawler to pick up.
 *
 * <p>
 *   The marker is written under a temporary name and renamed, so a watcher never reads a partial request.
 *   Without an explicit marker directory, {@code _catalog} under the publisher's final directory is used.
 * </p>
 */
@Slf4j
public class MarkerFileCatalogRefreshTrigger implements CatalogRefreshTrigger {

  public static final String DEFAULT_MARKER_DIR_NAME = "_catalog";
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final State state;
  private final Path markerDir;

  public MarkerFileCatalogRefreshTrigger(State state) {
    this.state = state;
    String markerDir = state.getProp(ConfigurationKeys.CATALOG_REFRESH_MARKER_DIR);
    if (markerDir == null) {
      String finalDir = state.getProp(ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
      if (finalDir == null) {
        throw new IllegalArgumentException(String.format("Either %s or %s must be set",
            ConfigurationKeys.CATALOG_REFRESH_MARKER_DIR, ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR));
      }
      this.markerDir = new Path(finalDir, DEFAULT_MARKER_DIR_NAME);
    } else {
      this.markerDir = new Path(markerDir);
    }
  }

  public Path getMarkerDir() {
    return this.markerDir;
  }

  @Override
  public void trigger(CatalogRefreshRequest request) throws IOException {
    try (FileSystem fs = HadoopUtils.getWriterFileSystem(this.state)) {
      Path marker = new Path(this.markerDir, request.getRunId() + ".json");
      Path tmp = new Path(this.markerDir, "." + request.getRunId() + ".json.tmp");
      try (FSDataOutputStream out = fs.create(tmp, true);
          Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
        GSON.toJson(request, writer);
      }
      HadoopUtils.deletePath(fs, marker, false);
      HadoopUtils.renamePath(fs, tmp, marker);
      log.info("Requested catalog refresh of {} with marker {}", request.getTables().keySet(), marker);
    }
  }
}
