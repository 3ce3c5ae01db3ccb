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

package org.apache.starflow.util.jdbc;

import org.apache.commons.lang3.StringUtils;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;

import lombok.extern.slf4j.Slf4j;


/**
 * A builder for the pooled {@link JdbcDataSource} the source store is read through.
 */
@Slf4j
public class DataSourceBuilder {

  private String url;
  private String driver;
  private String userName;
  private String passWord;
  private Integer maxIdleConnections;
  private Integer maxActiveConnections;
  private Long maxWaitMillis;

  public static DataSourceBuilder builder() {
    return new DataSourceBuilder();
  }

  /**
   * A builder populated from the {@code source.conn.*} properties of a {@link State}.
   */
  public static DataSourceBuilder fromState(State state) {
    return builder()
        .url(state.getProp(ConfigurationKeys.SOURCE_CONN_URL))
        .driver(state.getProp(ConfigurationKeys.SOURCE_CONN_DRIVER))
        .userName(state.getProp(ConfigurationKeys.SOURCE_CONN_USERNAME, ""))
        .passWord(state.getProp(ConfigurationKeys.SOURCE_CONN_PASSWORD, ""))
        .maxIdleConnections(state.getPropAsInt(ConfigurationKeys.SOURCE_CONN_MAX_IDLE,
            ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_IDLE))
        .maxActiveConnections(state.getPropAsInt(ConfigurationKeys.SOURCE_CONN_MAX_ACTIVE,
            ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_ACTIVE))
        .maxWaitMillis(state.getPropAsLong(ConfigurationKeys.SOURCE_CONN_MAX_WAIT_MS,
            ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_WAIT_MS));
  }

  public DataSourceBuilder url(String url) {
    this.url = url;
    return this;
  }

  public DataSourceBuilder driver(String driver) {
    this.driver = driver;
    return this;
  }

  public DataSourceBuilder userName(String userName) {
    this.userName = userName;
    return this;
  }

  public DataSourceBuilder passWord(String passWord) {
    this.passWord = passWord;
    return this;
  }

  public DataSourceBuilder maxIdleConnections(int maxIdleConnections) {
    this.maxIdleConnections = maxIdleConnections;
    return this;
  }

  public DataSourceBuilder maxActiveConnections(int maxActiveConnections) {
    this.maxActiveConnections = maxActiveConnections;
    return this;
  }

  public DataSourceBuilder maxWaitMillis(long maxWaitMillis) {
    this.maxWaitMillis = maxWaitMillis;
    return this;
  }

  public JdbcDataSource build() {
    validate();
    JdbcDataSource dataSource = new JdbcDataSource(this.driver, this.url, this.userName, this.passWord,
        this.maxIdleConnections == null ? ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_IDLE : this.maxIdleConnections,
        this.maxActiveConnections == null ? ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_ACTIVE : this.maxActiveConnections,
        this.maxWaitMillis == null ? ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_WAIT_MS : this.maxWaitMillis);
    log.debug("Built {}", this);
    return dataSource;
  }

  private void validate() {
    validateNotEmpty(this.url, "url");
    validateNotEmpty(this.driver, "driver");
    validateTrue(this.maxIdleConnections == null || this.maxIdleConnections > 0,
        "maxIdleConnections should be a positive integer.");
    validateTrue(this.maxActiveConnections == null || this.maxActiveConnections > 0,
        "maxActiveConnections should be a positive integer.");
  }

  private void validateNotEmpty(String s, String name) {
    if (StringUtils.isEmpty(s)) {
      throw new IllegalArgumentException(name + " should not be empty.");
    }
  }

  private void validateTrue(boolean condition, String message) {
    if (!condition) {
      throw new IllegalArgumentException(message);
    }
  }

  @Override
  public String toString() {
    return "DataSourceBuilder [url=" + this.url + ", driver=" + this.driver + ", userName=" + this.userName
        + ", passWord=******, maxIdleConnections=" + this.maxIdleConnections + ", maxActiveConnections="
        + this.maxActiveConnections + ", maxWaitMillis=" + this.maxWaitMillis + "]";
  }
}
