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

package org.apache.starflow.runtime.cli;

import java.io.File;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.apache.starflow.configuration.State;
import org.apache.starflow.util.ConfigUtils;


/**
 * Loads a job configuration file, HOCON or {@code .properties}, on top of the {@code reference.conf} defaults.
 * Overrides win over the file.
 */
public class JobConfigLoader {

  private JobConfigLoader() {
  }

  /**
   * @throws IllegalArgumentException if the file does not exist
   * @throws com.typesafe.config.ConfigException if the file cannot be parsed or a substitution cannot be resolved
   */
  public static State load(File jobFile, Map<String, String> overrides) {
    Preconditions.checkArgument(jobFile.isFile(), "Job configuration file %s does not exist", jobFile);
    Config config = ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.parseFile(jobFile))
        .withFallback(ConfigFactory.defaultReference())
        .resolve();
    return ConfigUtils.configToState(config);
  }
}
