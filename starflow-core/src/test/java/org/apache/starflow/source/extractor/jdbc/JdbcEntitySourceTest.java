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

package org.apache.starflow.source.extractor.jdbc;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.apache.avro.generic.GenericRecord;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.SchemaViolation;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.source.SourceUnavailableException;
import org.apache.starflow.test.ClassicModelsDatabase;


@Test(groups = {"starflow.source.jdbc"})
public class JdbcEntitySourceTest {

  private ClassicModelsDatabase database;
  private JdbcEntitySource source;

  @BeforeClass
  public void setUp() throws IOException {
    this.database = ClassicModelsDatabase.create("JdbcEntitySourceTest");
    this.source = new JdbcEntitySource(this.database.configure(new State()));
  }

  public void testExtractsEveryEntity() throws IOException {
    Assert.assertEquals(this.source.extract(StarSchemaEntity.CUSTOMERS).size(), ClassicModelsDatabase.CUSTOMERS);
    Assert.assertEquals(this.source.extract(StarSchemaEntity.PRODUCT_LINES).size(),
        ClassicModelsDatabase.PRODUCT_LINES);
    Assert.assertEquals(this.source.extract(StarSchemaEntity.PRODUCTS).size(), ClassicModelsDatabase.PRODUCTS);
    Assert.assertEquals(this.source.extract(StarSchemaEntity.ORDERS).size(), ClassicModelsDatabase.ORDERS);
    Assert.assertEquals(this.source.extract(StarSchemaEntity.ORDER_DETAILS).size(),
        ClassicModelsDatabase.ORDER_DETAILS);
  }

  public void testConvertsValuesToSchemaTypes() throws IOException {
    RowSet details = this.source.extract(StarSchemaEntity.ORDER_DETAILS);
    GenericRecord first = details.getRows().get(0);
    Assert.assertEquals(first.get("orderNumber"), 10100);
    Assert.assertEquals(first.get("productCode"), "S10_1678");
    Assert.assertEquals(first.get("quantityOrdered"), 30);
    Assert.assertEquals(first.get("priceEach"), new BigDecimal("95.70"));
    Assert.assertEquals(first.get("orderLineNumber"), 3);

    GenericRecord order = this.source.extract(StarSchemaEntity.ORDERS).getRows().get(3);
    Assert.assertEquals(order.get("orderNumber"), 10103);
    Assert.assertEquals(order.get("orderDate"), LocalDate.of(2003, 2, 24));
    Assert.assertNull(order.get("shippedDate"));

    GenericRecord customer = this.source.extract(StarSchemaEntity.CUSTOMERS).getRows().get(5);
    Assert.assertEquals(customer.get("customerNumber"), 125);
    Assert.assertNull(customer.get("salesRepEmployeeNumber"));
    Assert.assertEquals(customer.get("creditLimit"), new BigDecimal("0.00"));
  }

  public void testRowsComeInKeyOrder() throws IOException {
    List<GenericRecord> details = this.source.extract(StarSchemaEntity.ORDER_DETAILS).getRows();
    for (int i = 1; i < details.size(); i++) {
      String previous = details.get(i - 1).get("orderNumber") + "/" + details.get(i - 1).get("productCode");
      String current = details.get(i).get("orderNumber") + "/" + details.get(i).get("productCode");
      Assert.assertTrue(previous.compareTo(current) < 0, previous + " before " + current);
    }
  }

  public void testTableNameOverride() throws IOException {
    this.database.execute("CREATE TABLE legacy_lines AS SELECT * FROM productlines WITH NO DATA",
        "INSERT INTO legacy_lines SELECT * FROM productlines WHERE productLine <> 'Planes'");
    State state = this.database.configure(new State());
    state.setProp(ConfigurationKeys.SOURCE_ENTITY_PREFIX + "productlines" + ConfigurationKeys.SOURCE_ENTITY_TABLE_SUFFIX,
        "legacy_lines");
    try (JdbcEntitySource overridden = new JdbcEntitySource(state)) {
      Assert.assertEquals(overridden.getTable(StarSchemaEntity.PRODUCT_LINES), "legacy_lines");
      Assert.assertEquals(overridden.extract(StarSchemaEntity.PRODUCT_LINES).size(),
          ClassicModelsDatabase.PRODUCT_LINES - 1);
    }
  }

  public void testMissingColumnIsSchemaMismatch() throws IOException {
    this.database.execute("CREATE TABLE narrow_products AS SELECT productCode, productName FROM products WITH NO DATA");
    State state = this.database.configure(new State());
    state.setProp(ConfigurationKeys.SOURCE_ENTITY_PREFIX + "products" + ConfigurationKeys.SOURCE_ENTITY_TABLE_SUFFIX,
        "narrow_products");
    try (JdbcEntitySource narrow = new JdbcEntitySource(state)) {
      narrow.extract(StarSchemaEntity.PRODUCTS);
      Assert.fail("A table without the declared columns must be rejected");
    } catch (SchemaMismatchException sme) {
      Assert.assertEquals(sme.getEntity(), StarSchemaEntity.PRODUCTS);
      Assert.assertEquals(sme.getViolations().size(), 7);
      for (SchemaViolation violation : sme.getViolations()) {
        Assert.assertEquals(violation.getType(), SchemaViolation.Type.MISSING_FIELD);
      }
    }
  }

  public void testIncompatibleColumnTypeIsSchemaMismatch() throws IOException {
    this.database.execute("CREATE TABLE text_lines (productLine VARCHAR(50), textDescription INTEGER, "
        + "htmlDescription LONG VARCHAR)");
    State state = this.database.configure(new State());
    state.setProp(ConfigurationKeys.SOURCE_ENTITY_PREFIX + "productlines" + ConfigurationKeys.SOURCE_ENTITY_TABLE_SUFFIX,
        "text_lines");
    try (JdbcEntitySource source = new JdbcEntitySource(state)) {
      source.extract(StarSchemaEntity.PRODUCT_LINES);
      Assert.fail("An integer column cannot carry a string field");
    } catch (SchemaMismatchException sme) {
      Assert.assertEquals(sme.getViolations().size(), 1);
      Assert.assertEquals(sme.getViolations().get(0).getType(), SchemaViolation.Type.TYPE_MISMATCH);
      Assert.assertEquals(sme.getViolations().get(0).getField(), "textDescription");
    }
  }

  public void testUnknownTableIsSchemaMismatch() throws IOException {
    State state = this.database.configure(new State());
    state.setProp(ConfigurationKeys.SOURCE_ENTITY_PREFIX + "orders" + ConfigurationKeys.SOURCE_ENTITY_TABLE_SUFFIX,
        "no_such_table");
    try (JdbcEntitySource source = new JdbcEntitySource(state)) {
      source.extract(StarSchemaEntity.ORDERS);
      Assert.fail("An unknown table must be rejected");
    } catch (SchemaMismatchException sme) {
      Assert.assertEquals(sme.getEntity(), StarSchemaEntity.ORDERS);
      Assert.assertTrue(sme.getMessage().contains("no_such_table"), sme.getMessage());
    }
  }

  @Test(expectedExceptions = SourceUnavailableException.class)
  public void testUnreachableStoreIsSourceUnavailable() throws IOException {
    State state = new State();
    state.setProp(ConfigurationKeys.SOURCE_CONN_DRIVER, ClassicModelsDatabase.DRIVER);
    state.setProp(ConfigurationKeys.SOURCE_CONN_URL, "jdbc:derby:memory:JdbcEntitySourceTestMissing");
    try (JdbcEntitySource missing = new JdbcEntitySource(state)) {
      missing.extract(StarSchemaEntity.CUSTOMERS);
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testTargetEntitiesCannotBeExtracted() throws IOException {
    this.source.extract(StarSchemaEntity.FACT_ORDERS);
  }

  @AfterClass(alwaysRun = true)
  public void tearDown() throws IOException {
    try {
      this.source.close();
    } finally {
      this.database.close();
    }
  }
}
