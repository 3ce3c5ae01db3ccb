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

import org.apache.commons.dbcp.BasicDataSource;


/**
 * Jdbc data source that extends {@link org.apache.commons.dbcp.BasicDataSource} and sets necessary attributes.
 * Connections handed out are read-only: the source store is never written to.
 */
public class JdbcDataSource extends BasicDataSource {

  public JdbcDataSource(String driver, String connectionUrl, String user, String password, int maxIdle,
      int maxActive, long maxWaitMillis) {
    this.setDriverClassName(driver);
    this.setUsername(user);
    this.setPassword(password);
    this.setUrl(connectionUrl);
    this.setInitialSize(0);
    this.setMaxIdle(maxIdle);
    this.setMaxActive(maxActive);
    this.setMaxWait(maxWaitMillis);
    this.setDefaultReadOnly(true);
  }
}
