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

import org.testng.Assert;
import org.testng.annotations.Test;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;


@Test(groups = {"starflow.util.jdbc"})
public class DataSourceBuilderTest {

  @Test
  public void testFromState() throws Exception {
    State state = new State();
    state.setProp(ConfigurationKeys.SOURCE_CONN_URL, "jdbc:derby:memory:builder;create=true");
    state.setProp(ConfigurationKeys.SOURCE_CONN_DRIVER, "org.apache.derby.jdbc.EmbeddedDriver");
    state.setProp(ConfigurationKeys.SOURCE_CONN_USERNAME, "etl");
    state.setProp(ConfigurationKeys.SOURCE_CONN_PASSWORD, "secret");
    state.setProp(ConfigurationKeys.SOURCE_CONN_MAX_ACTIVE, 3);

    JdbcDataSource dataSource = DataSourceBuilder.fromState(state).build();
    try {
      Assert.assertEquals(dataSource.getUrl(), "jdbc:derby:memory:builder;create=true");
      Assert.assertEquals(dataSource.getUsername(), "etl");
      Assert.assertEquals(dataSource.getMaxActive(), 3);
      Assert.assertEquals(dataSource.getMaxIdle(), ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_IDLE);
      Assert.assertEquals(dataSource.getMaxWait(), ConfigurationKeys.DEFAULT_SOURCE_CONN_MAX_WAIT_MS);
      Assert.assertTrue(dataSource.getDefaultReadOnly());
    } finally {
      dataSource.close();
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testMissingUrl() {
    DataSourceBuilder.builder().driver("org.apache.derby.jdbc.EmbeddedDriver").build();
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonPositivePoolSize() {
    DataSourceBuilder.builder().url("jdbc:x").driver("d").maxActiveConnections(0).build();
  }

  @Test
  public void testToStringMasksPassword() {
    String rendered = DataSourceBuilder.builder().url("jdbc:x").passWord("secret").toString();
    Assert.assertFalse(rendered.contains("secret"));
  }
}
