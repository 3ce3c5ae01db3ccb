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

package org.apache.starflow.transform;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.avro.generic.GenericRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.schema.RecordKey;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.SchemaViolation;
import org.apache.starflow.schema.StarSchemaEntity;

import static org.apache.starflow.test.SourceRecords.customer;
import static org.apache.starflow.test.SourceRecords.order;
import static org.apache.starflow.test.SourceRecords.orderDetail;
import static org.apache.starflow.test.SourceRecords.product;
import static org.apache.starflow.test.SourceRecords.productLine;


@Test(groups = {"starflow.transform"})
public class StarSchemaTransformerTest {

  private static final LocalDate ORDER_DATE = LocalDate.of(2003, 5, 20);

  private final StarSchemaTransformer transformer = new StarSchemaTransformer(new State());

  private static SourceSnapshot snapshot(List<GenericRecord> customers, List<GenericRecord> productLines,
      List<GenericRecord> products, List<GenericRecord> orders, List<GenericRecord> orderDetails) {
    return SourceSnapshot.builder()
        .add(new RowSet(StarSchemaEntity.CUSTOMERS, customers))
        .add(new RowSet(StarSchemaEntity.PRODUCT_LINES, productLines))
        .add(new RowSet(StarSchemaEntity.PRODUCTS, products))
        .add(new RowSet(StarSchemaEntity.ORDERS, orders))
        .add(new RowSet(StarSchemaEntity.ORDER_DETAILS, orderDetails))
        .build();
  }

  private static SourceSnapshot singleOrder() {
    return snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.of(order(1, 1, ORDER_DATE)),
        ImmutableList.of(orderDetail(1, "A", 3, "10.00", 1)));
  }

  public void testSingleOrderLine() throws Exception {
    TransformResult result = this.transformer.transform(singleOrder());

    List<GenericRecord> facts = result.getTable(StarSchemaEntity.FACT_ORDERS).getRows();
    Assert.assertEquals(facts.size(), 1);
    GenericRecord fact = facts.get(0);
    Assert.assertEquals(fact.get("order_amount"), new BigDecimal("30.00"));
    Assert.assertEquals(fact.get("order_number"), 1);
    Assert.assertEquals(fact.get("customer_number"), 1);
    Assert.assertEquals(fact.get("product_code").toString(), "A");
    Assert.assertEquals(fact.get("postal_code").toString(), "94016");
    Assert.assertEquals(fact.get("order_date"), ORDER_DATE);

    GenericRecord product = result.getTable(StarSchemaEntity.DIM_PRODUCTS).getRows().get(0);
    Assert.assertEquals(product.get("product_code").toString(), "A");
    Assert.assertEquals(product.get("product_line_description").toString(), "Electronics");

    List<GenericRecord> locations = result.getTable(StarSchemaEntity.DIM_LOCATIONS).getRows();
    Assert.assertEquals(locations.size(), 1);
    Assert.assertEquals(locations.get(0).get("postal_code").toString(), "94016");
    Assert.assertEquals(locations.get(0).get("city").toString(), "San Francisco");
    Assert.assertEquals(locations.get(0).get("state").toString(), "CA");
    Assert.assertEquals(locations.get(0).get("country").toString(), "USA");

    Assert.assertEquals(result.getTable(StarSchemaEntity.DIM_CUSTOMERS).size(), 1);
    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      Assert.assertEquals(result.getRowsSkipped(target), 0L, target.getTableName());
    }
    Assert.assertTrue(result.getWarnings().isEmpty());
  }

  public void testOrderLineOfMissingOrderIsSkipped() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets"), product("B", "Gadgets")),
        ImmutableList.of(order(1, 1, ORDER_DATE)),
        ImmutableList.of(orderDetail(1, "A", 3, "10.00", 1), orderDetail(2, "B", 1, "5.00", 1)));

    TransformResult result = this.transformer.transform(snapshot);

    Assert.assertEquals(result.getTable(StarSchemaEntity.FACT_ORDERS).size(), 1);
    Assert.assertEquals(result.getRowsSkipped(StarSchemaEntity.FACT_ORDERS), 1L);
    Assert.assertEquals(result.getReferentialGapCount(), 1L);
    ReferentialGap gap = result.getReferentialGaps().get(0);
    Assert.assertEquals(gap.getTable(), StarSchemaEntity.FACT_ORDERS);
    Assert.assertEquals(gap.getMissing(), StarSchemaEntity.ORDERS);
    Assert.assertEquals(gap.getReference(), "orderNumber=2");
    Assert.assertEquals(result.getTable(StarSchemaEntity.DIM_PRODUCTS).size(), 2);
  }

  public void testEveryUnresolvedReferenceIsExcludedAndCounted() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA"), customer(2, null, "Nowhere", null, "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.of(order(1, 1, ORDER_DATE), order(2, 99, ORDER_DATE), order(3, 2, ORDER_DATE)),
        ImmutableList.of(
            orderDetail(1, "A", 3, "10.00", 1),
            orderDetail(1, "Z", 1, "1.00", 2),
            orderDetail(2, "A", 1, "1.00", 1),
            orderDetail(3, "A", 1, "1.00", 1),
            orderDetail(4, "A", 1, "1.00", 1)));

    TransformResult result = this.transformer.transform(snapshot);

    long details = snapshot.get(StarSchemaEntity.ORDER_DETAILS).size();
    Assert.assertEquals(result.getRowsSkipped(StarSchemaEntity.FACT_ORDERS)
        + result.getTable(StarSchemaEntity.FACT_ORDERS).size(), details);
    Assert.assertEquals(result.getTable(StarSchemaEntity.FACT_ORDERS).size(), 1);

    Set<StarSchemaEntity> missing = new HashSet<>();
    for (ReferentialGap gap : result.getReferentialGaps()) {
      missing.add(gap.getMissing());
    }
    Assert.assertEquals(missing, new HashSet<>(ImmutableList.of(StarSchemaEntity.PRODUCTS, StarSchemaEntity.CUSTOMERS,
        StarSchemaEntity.DIM_LOCATIONS, StarSchemaEntity.ORDERS)));

    // The customer without a postal code has no location but keeps its customer row
    Assert.assertEquals(result.getTable(StarSchemaEntity.DIM_LOCATIONS).size(), 1);
    Assert.assertEquals(result.getRowsSkipped(StarSchemaEntity.DIM_LOCATIONS), 1L);
    Assert.assertEquals(result.getTable(StarSchemaEntity.DIM_CUSTOMERS).size(), 2);
  }

  public void testFactsReferenceSameRunDimensions() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA"), customer(2, "10001", "New York", "NY",
            "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics"), productLine("Toys", null)),
        ImmutableList.of(product("A", "Gadgets"), product("B", "Toys")),
        ImmutableList.of(order(1, 1, ORDER_DATE), order(2, 2, ORDER_DATE.plusDays(1))),
        ImmutableList.of(orderDetail(1, "A", 3, "10.00", 1), orderDetail(1, "B", 2, "0.99", 2),
            orderDetail(2, "B", 7, "12.34", 1)));

    TransformResult result = this.transformer.transform(snapshot);

    Set<RecordKey> customers = keys(result.getTable(StarSchemaEntity.DIM_CUSTOMERS), "customer_number");
    Set<RecordKey> products = keys(result.getTable(StarSchemaEntity.DIM_PRODUCTS), "product_code");
    Set<RecordKey> locations = keys(result.getTable(StarSchemaEntity.DIM_LOCATIONS), "postal_code");
    for (GenericRecord fact : result.getTable(StarSchemaEntity.FACT_ORDERS).getRows()) {
      Assert.assertTrue(customers.contains(RecordKey.of(fact, ImmutableList.of("customer_number"))));
      Assert.assertTrue(products.contains(RecordKey.of(fact, ImmutableList.of("product_code"))));
      Assert.assertTrue(locations.contains(RecordKey.of(fact, ImmutableList.of("postal_code"))));
    }
    Assert.assertEquals(result.getTable(StarSchemaEntity.FACT_ORDERS).size(), 3);
    Assert.assertEquals(result.getTable(StarSchemaEntity.DIM_PRODUCTS).size(), 2);
  }

  public void testOrderAmountIsExact() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets"), product("B", "Gadgets"), product("C", "Gadgets")),
        ImmutableList.of(order(1, 1, ORDER_DATE)),
        ImmutableList.of(orderDetail(1, "A", 3, "0.10", 1), orderDetail(1, "B", 7, "33.33", 2),
            orderDetail(1, "C", 99999, "99999999.99", 3)));

    List<GenericRecord> facts = this.transformer.transform(snapshot).getTable(StarSchemaEntity.FACT_ORDERS).getRows();

    Assert.assertEquals(facts.get(0).get("order_amount"), new BigDecimal("0.30"));
    Assert.assertEquals(facts.get(1).get("order_amount"), new BigDecimal("233.31"));
    Assert.assertEquals(facts.get(2).get("order_amount"), new BigDecimal("9999899999000.01"));
  }

  public void testMissingProductLineKeepsProduct() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets"), product("B", "Unknown")),
        ImmutableList.of(order(1, 1, ORDER_DATE)),
        ImmutableList.of(orderDetail(1, "B", 1, "1.00", 1)));

    TransformResult result = this.transformer.transform(snapshot);

    List<GenericRecord> products = result.getTable(StarSchemaEntity.DIM_PRODUCTS).getRows();
    Assert.assertEquals(products.size(), 2);
    Assert.assertNull(products.get(1).get("product_line_description"));
    Assert.assertEquals(result.getUnresolvedReferences().size(), 1);
    Assert.assertTrue(result.getUnresolvedReferences().get(0).contains("Unknown"));
    Assert.assertEquals(result.getTable(StarSchemaEntity.FACT_ORDERS).size(), 1);
  }

  public void testFirstLocationWinsAndConflictIsReported() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "44000", "Nantes", null, "France"), customer(2, "44000", "Nantes", null, "France"),
            customer(3, "44000", "Saint-Herblain", null, "France")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.<GenericRecord>of(),
        ImmutableList.<GenericRecord>of());

    TransformResult result = this.transformer.transform(snapshot);

    List<GenericRecord> locations = result.getTable(StarSchemaEntity.DIM_LOCATIONS).getRows();
    Assert.assertEquals(locations.size(), 1);
    Assert.assertEquals(locations.get(0).get("city").toString(), "Nantes");
    Assert.assertEquals(result.getLocationConflicts().size(), 1);
    LocationConflict conflict = result.getLocationConflicts().get(0);
    Assert.assertEquals(conflict.getPostalCode(), "44000");
    Assert.assertEquals(conflict.getCustomerKey(), "customerNumber=3");
    Assert.assertTrue(conflict.getDiscarded().contains("Saint-Herblain"));
    Assert.assertEquals(result.getWarnings().size(), 1);
  }

  public void testOutputFollowsExtractionOrder() throws Exception {
    List<GenericRecord> customers = new ArrayList<>();
    List<GenericRecord> orders = new ArrayList<>();
    List<GenericRecord> details = new ArrayList<>();
    for (int i = 1; i <= 50; i++) {
      customers.add(customer(i, String.format("%05d", i % 7), "City" + i % 7, null, "USA"));
      orders.add(order(i, i, ORDER_DATE.plusDays(i)));
      details.add(orderDetail(i, i % 2 == 0 ? "A" : "B", i, "1.50", 1));
    }
    SourceSnapshot snapshot = snapshot(customers, ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets"), product("B", "Gadgets")), orders, details);

    State state = new State();
    state.setProp(ConfigurationKeys.TRANSFORM_THREADS, 1);
    TransformResult first = new StarSchemaTransformer(state).transform(snapshot);
    TransformResult second = this.transformer.transform(snapshot);

    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      Assert.assertEquals(render(second.getTable(target)), render(first.getTable(target)), target.getTableName());
    }
    List<GenericRecord> facts = first.getTable(StarSchemaEntity.FACT_ORDERS).getRows();
    for (int i = 0; i < facts.size(); i++) {
      Assert.assertEquals(facts.get(i).get("order_number"), i + 1);
    }
    Assert.assertEquals(first.getTable(StarSchemaEntity.DIM_LOCATIONS).size(), 7);
    Assert.assertEquals(first.getTable(StarSchemaEntity.DIM_LOCATIONS).getRows().get(0).get("postal_code"), "00001");
  }

  public void testDuplicateSourceKeyFailsTheTransformation() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA"), customer(1, "94016", "San Francisco",
            "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.<GenericRecord>of(),
        ImmutableList.<GenericRecord>of());

    try {
      this.transformer.transform(snapshot);
      Assert.fail("Duplicate customer numbers must be rejected");
    } catch (SchemaMismatchException sme) {
      Assert.assertEquals(sme.getEntity(), StarSchemaEntity.CUSTOMERS);
      Assert.assertEquals(sme.getViolations().get(0).getType(), SchemaViolation.Type.DUPLICATE_KEY);
    }
  }

  public void testLargestOrderAmountIsExact() throws Exception {
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.of(order(1, 1, ORDER_DATE)),
        ImmutableList.of(orderDetail(1, "A", Integer.MAX_VALUE, "99999999.99", 1)));

    List<GenericRecord> facts = this.transformer.transform(snapshot).getTable(StarSchemaEntity.FACT_ORDERS).getRows();

    Assert.assertEquals(facts.size(), 1);
    Assert.assertEquals(facts.get(0).get("order_amount"), new BigDecimal("214748364678525163.53"));
  }

  public void testGapSampleIsBounded() throws Exception {
    List<GenericRecord> details = new ArrayList<>();
    for (int i = 1; i <= 20; i++) {
      details.add(orderDetail(100 + i, "A", 1, "1.00", 1));
    }
    SourceSnapshot snapshot = snapshot(
        ImmutableList.of(customer(1, "94016", "San Francisco", "CA", "USA")),
        ImmutableList.of(productLine("Gadgets", "Electronics")),
        ImmutableList.of(product("A", "Gadgets")),
        ImmutableList.<GenericRecord>of(), details);
    State state = new State();
    state.setProp(ConfigurationKeys.TRANSFORM_GAP_SAMPLE_SIZE, 5);

    TransformResult result = new StarSchemaTransformer(state).transform(snapshot);

    Assert.assertEquals(result.getReferentialGapCount(), 20L);
    Assert.assertEquals(result.getReferentialGaps().size(), 5);
    Assert.assertEquals(result.getRowsSkipped(StarSchemaEntity.FACT_ORDERS), 20L);
  }

  private static List<String> render(RowSet rowSet) {
    List<String> rendered = new ArrayList<>();
    for (GenericRecord row : rowSet.getRows()) {
      rendered.add(row.toString());
    }
    return rendered;
  }

  private static Set<RecordKey> keys(RowSet rowSet, String field) {
    Set<RecordKey> keys = new HashSet<>();
    for (GenericRecord row : rowSet.getRows()) {
      keys.add(RecordKey.of(row, ImmutableList.of(field)));
    }
    return keys;
  }
}
