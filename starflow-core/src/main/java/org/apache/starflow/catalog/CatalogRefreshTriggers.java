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

import org.apache.commons.lang3.reflect.ConstructorUtils;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;


/**
 * Instantiates the {@link CatalogRefreshTrigger} named by {@link ConfigurationKeys#CATALOG_REFRESH_TRIGGER_CLASS}.
 */
public class CatalogRefreshTriggers {

  private CatalogRefreshTriggers() {
  }

  public static CatalogRefreshTrigger create(State state) {
    String className = state.getProp(ConfigurationKeys.CATALOG_REFRESH_TRIGGER_CLASS,
        NoopCatalogRefreshTrigger.class.getName());
    try {
      Class<?> clazz = Class.forName(className);
      return (CatalogRefreshTrigger) ConstructorUtils.invokeConstructor(clazz, state);
    } catch (ReflectiveOperationException | ClassCastException e) {
      throw new IllegalArgumentException("Cannot instantiate catalog refresh trigger " + className, e);
    }
  }
}
