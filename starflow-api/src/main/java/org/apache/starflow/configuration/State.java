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

import java.util.List;
import java.util.Properties;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import lombok.EqualsAndHashCode;


/**
 * A thread-safe wrapper around {@link Properties} that carries the configuration of a run and the
 * bookkeeping properties the components exchange (e.g. a writer telling the publisher where its output went).
 *
 * <p>
 *   All values are stored as strings. Typed getters parse on read, so a malformed value surfaces
 *   where it is used rather than when the configuration is loaded.
 * </p>
 */
@EqualsAndHashCode
public class State {

  private static final Joiner LIST_JOINER = Joiner.on(",");
  private static final Splitter LIST_SPLITTER = Splitter.on(",").trimResults().omitEmptyStrings();

  private final Properties properties;

  public State() {
    this.properties = new Properties();
  }

  public State(Properties properties) {
    this.properties = properties;
  }

  public State(State otherState) {
    this.properties = otherState.getProperties();
  }

  /**
   * Return a copy of the underlying {@link Properties} object.
   *
   * @return A copy of the underlying {@link Properties} object.
   */
  public Properties getProperties() {
    // a.putAll(b) iterates over the entries of b. Synchronizing on b prevents concurrent modification on b.
    synchronized (this.properties) {
      Properties props = new Properties();
      props.putAll(this.properties);
      return props;
    }
  }

  /**
   * Populates this instance with properties of the other instance.
   *
   * @param otherState the other {@link State} instance
   */
  public void addAll(State otherState) {
    addAll(otherState.properties);
  }

  /**
   * Populates this instance with values of a {@link Properties} instance.
   *
   * @param properties a {@link Properties} instance
   */
  public void addAll(Properties properties) {
    this.properties.putAll(properties);
  }

  /**
   * Add properties in a {@link State} instance that are not in the current instance.
   *
   * @param otherState a {@link State} instance
   */
  public void addAllIfNotExist(State otherState) {
    for (String key : otherState.properties.stringPropertyNames()) {
      if (!this.properties.containsKey(key)) {
        this.properties.setProperty(key, otherState.properties.getProperty(key));
      }
    }
  }

  /**
   * Set a property.
   *
   * <p>
   *   Both key and value are stored as strings. The value object must override {@link Object#toString()}.
   * </p>
   *
   * @param key property key
   * @param value property value
   */
  public void setProp(String key, Object value) {
    Preconditions.checkNotNull(value, "Value of property %s must not be null", key);
    this.properties.put(key, value.toString());
  }

  /**
   * Appends the input value to a set property that can be retrieved with {@link #getPropAsSet}.
   *
   * @param key property key
   * @param value property value (if it includes commas, it will be split by the commas).
   */
  public synchronized void appendToSetProp(String key, String value) {
    Set<String> set = value == null ? Sets.<String>newLinkedHashSet() : Sets.newLinkedHashSet(LIST_SPLITTER.splitToList(value));
    if (contains(key)) {
      set.addAll(getPropAsSet(key));
    }
    setProp(key, LIST_JOINER.join(set));
  }

  public String getProp(String key) {
    return this.properties.getProperty(key);
  }

  public String getProp(String key, String def) {
    return this.properties.getProperty(key, def);
  }

  public List<String> getPropAsList(String key) {
    return LIST_SPLITTER.splitToList(getProp(key));
  }

  public List<String> getPropAsList(String key, String def) {
    return LIST_SPLITTER.splitToList(getProp(key, def));
  }

  public Set<String> getPropAsSet(String key) {
    return ImmutableSet.copyOf(LIST_SPLITTER.splitToList(getProp(key)));
  }

  public long getPropAsLong(String key) {
    return Long.parseLong(getProp(key));
  }

  public long getPropAsLong(String key, long def) {
    return Long.parseLong(getProp(key, String.valueOf(def)));
  }

  public int getPropAsInt(String key) {
    return Integer.parseInt(getProp(key));
  }

  public int getPropAsInt(String key, int def) {
    return Integer.parseInt(getProp(key, String.valueOf(def)));
  }

  public boolean getPropAsBoolean(String key) {
    return Boolean.parseBoolean(getProp(key));
  }

  public boolean getPropAsBoolean(String key, boolean def) {
    return Boolean.parseBoolean(getProp(key, String.valueOf(def)));
  }

  public void removeProp(String key) {
    this.properties.remove(key);
  }

  /**
   * Get the names of all the properties set in a {@link Set}.
   *
   * @return names of all the properties set in a {@link Set}
   */
  public Set<String> getPropertyNames() {
    return this.properties.stringPropertyNames();
  }

  public boolean contains(String key) {
    return this.properties.getProperty(key) != null;
  }

  /**
   * Renders the properties with the values of credential keys masked.
   */
  @Override
  public String toString() {
    Properties printable = getProperties();
    for (String key : printable.stringPropertyNames()) {
      if (key.toLowerCase().contains(ConfigurationKeys.PASSWORD_KEY_MARKER)) {
        printable.setProperty(key, "******");
      }
    }
    return printable.toString();
  }
}
