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

import java.util.List;

import org.apache.commons.lang3.reflect.ConstructorUtils;

import com.google.common.collect.Lists;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;


/**
 * Builds the listeners of a job: the classes named in {@link ConfigurationKeys#JOB_LISTENERS_KEY}, followed by a
 * {@link CatalogRefreshJobListener} unless {@link ConfigurationKeys#CATALOG_REFRESH_ENABLED} is false.
 */
public class JobListeners {

  private JobListeners() {
  }

  public static List<JobListener> create(State state) {
    List<JobListener> listeners = Lists.newArrayList();
    for (String className : state.getPropAsList(ConfigurationKeys.JOB_LISTENERS_KEY, "")) {
      listeners.add(newListener(className, state));
    }
    if (state.getPropAsBoolean(ConfigurationKeys.CATALOG_REFRESH_ENABLED, true)) {
      listeners.add(new CatalogRefreshJobListener(state));
    }
    return listeners;
  }

  private static JobListener newListener(String className, State state) {
    try {
      Class<?> clazz = Class.forName(className);
      if (ConstructorUtils.getMatchingAccessibleConstructor(clazz, State.class) != null) {
        return (JobListener) ConstructorUtils.invokeConstructor(clazz, state);
      }
      return (JobListener) ConstructorUtils.invokeConstructor(clazz);
    } catch (ReflectiveOperationException | ClassCastException e) {
      throw new IllegalArgumentException("Cannot instantiate job listener " + className, e);
    }
  }
}
