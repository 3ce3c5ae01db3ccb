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

package org.apache.starflow.schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.GenericRecordBuilder;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;


@Test(groups = {"starflow.schema"})
public class SchemaValidatorTest {

  private final SchemaValidator validator = new SchemaValidator();

  private static GenericRecord productLine(String line, String description) {
    return new GenericRecordBuilder(StarSchemaEntity.PRODUCT_LINES.getSchema())
        .set("productLine", line).set("textDescription", description).build();
  }

  private static GenericRecord orderDetail(int order, String product, int quantity, String price) {
    return new GenericRecordBuilder(StarSchemaEntity.ORDER_DETAILS.getSchema())
        .set("orderNumber", order).set("productCode", product).set("quantityOrdered", quantity)
        .set("priceEach", new BigDecimal(price)).set("orderLineNumber", 1).build();
  }

  private static GenericRecord order(int order, int customer) {
    return new GenericRecordBuilder(StarSchemaEntity.ORDERS.getSchema())
        .set("orderNumber", order).set("orderDate", LocalDate.of(2003, 1, 6))
        .set("requiredDate", LocalDate.of(2003, 1, 13)).set("status", "Shipped")
        .set("customerNumber", customer).build();
  }

  private static List<SchemaViolation.Type> types(List<SchemaViolation> violations) {
    ImmutableList.Builder<SchemaViolation.Type> builder = ImmutableList.builder();
    for (SchemaViolation violation : violations) {
      builder.add(violation.getType());
    }
    return builder.build();
  }

  @Test
  public void testValidRowsHaveNoViolations() {
    RowSet rowSet = new RowSet(StarSchemaEntity.ORDER_DETAILS,
        ImmutableList.of(orderDetail(1, "A", 3, "10.00"), orderDetail(1, "B", 1, "0.5")));
    Assert.assertTrue(this.validator.validate(rowSet).isEmpty());
  }

  @Test
  public void testNullableFieldAcceptsNull() {
    RowSet rowSet = new RowSet(StarSchemaEntity.PRODUCT_LINES, ImmutableList.of(productLine("Planes", null)));
    Assert.assertTrue(this.validator.validate(rowSet).isEmpty());
  }

  @Test
  public void testDuplicateCompositeKey() {
    RowSet rowSet = new RowSet(StarSchemaEntity.ORDER_DETAILS,
        ImmutableList.of(orderDetail(1, "A", 3, "10.00"), orderDetail(1, "A", 4, "11.00"), orderDetail(2, "A", 1, "1")));
    List<SchemaViolation> violations = this.validator.validate(rowSet);
    Assert.assertEquals(types(violations), ImmutableList.of(SchemaViolation.Type.DUPLICATE_KEY));
    Assert.assertEquals(violations.get(0).getKey(), "(orderNumber,productCode)=(1,A)");
    Assert.assertTrue(violations.get(0).isFatal());
  }

  @Test
  public void testNullKeyAndNullValue() {
    GenericRecord record = new GenericData.Record(StarSchemaEntity.ORDER_DETAILS.getSchema());
    record.put("orderNumber", 1);
    record.put("quantityOrdered", 1);
    record.put("priceEach", new BigDecimal("2.00"));
    record.put("orderLineNumber", 1);
    List<SchemaViolation> violations =
        this.validator.validate(new RowSet(StarSchemaEntity.ORDER_DETAILS, ImmutableList.of(record)));
    Assert.assertEquals(types(violations), ImmutableList.of(SchemaViolation.Type.NULL_KEY));
    Assert.assertEquals(violations.get(0).getField(), "productCode");

    record.put("productCode", "A");
    record.put("quantityOrdered", null);
    violations = this.validator.validate(new RowSet(StarSchemaEntity.ORDER_DETAILS, ImmutableList.of(record)));
    Assert.assertEquals(types(violations), ImmutableList.of(SchemaViolation.Type.NULL_VALUE));
  }

  @Test
  public void testTypeMismatch() {
    GenericRecord record = orderDetail(1, "A", 3, "10.00");
    record.put("priceEach", 10.0d);
    List<SchemaViolation> violations =
        this.validator.validate(new RowSet(StarSchemaEntity.ORDER_DETAILS, ImmutableList.of(record)));
    Assert.assertEquals(types(violations), ImmutableList.of(SchemaViolation.Type.TYPE_MISMATCH));
    Assert.assertTrue(violations.get(0).getReason().contains("decimal(10,2)"));
  }

  @Test
  public void testDecimalOverflow() {
    List<SchemaViolation> violations = this.validator.validate(new RowSet(StarSchemaEntity.ORDER_DETAILS,
        ImmutableList.of(orderDetail(1, "A", 3, "123456789.00"), orderDetail(2, "A", 3, "1.005"))));
    Assert.assertEquals(types(violations),
        ImmutableList.of(SchemaViolation.Type.PRECISION_OVERFLOW, SchemaViolation.Type.PRECISION_OVERFLOW));
  }

  @Test
  public void testMissingFieldReportedOnce() {
    Schema narrow = SchemaBuilder.record("ProductLine").fields().requiredString("productLine").endRecord();
    GenericRecord first = new GenericRecordBuilder(narrow).set("productLine", "Planes").build();
    GenericRecord second = new GenericRecordBuilder(narrow).set("productLine", "Ships").build();
    List<SchemaViolation> violations =
        this.validator.validate(new RowSet(StarSchemaEntity.PRODUCT_LINES, ImmutableList.of(first, second)));
    Assert.assertEquals(types(violations),
        ImmutableList.of(SchemaViolation.Type.MISSING_FIELD, SchemaViolation.Type.MISSING_FIELD));
    Assert.assertEquals(violations.get(0).getField(), "textDescription");
    Assert.assertNull(violations.get(0).getKey());
  }

  @Test
  public void testDanglingReferences() {
    Map<StarSchemaEntity, RowSet> rowSets = ImmutableMap.of(
        StarSchemaEntity.ORDERS, new RowSet(StarSchemaEntity.ORDERS, ImmutableList.of(order(1, 103))),
        StarSchemaEntity.ORDER_DETAILS, new RowSet(StarSchemaEntity.ORDER_DETAILS,
            ImmutableList.of(orderDetail(1, "A", 3, "10.00"), orderDetail(2, "B", 1, "5.00"))));

    List<SchemaViolation> violations = this.validator.validateReferences(rowSets);

    Assert.assertEquals(types(violations), ImmutableList.of(SchemaViolation.Type.DANGLING_REFERENCE));
    Assert.assertEquals(violations.get(0).getEntity(), StarSchemaEntity.ORDER_DETAILS);
    Assert.assertEquals(violations.get(0).getField(), "orderNumber");
    Assert.assertFalse(violations.get(0).isFatal());
    Assert.assertTrue(SchemaValidator.fatal(violations).isEmpty());
  }

  @Test
  public void testSchemaMismatchMessageIsBounded() {
    ImmutableList.Builder<SchemaViolation> violations = ImmutableList.builder();
    for (int i = 0; i < 25; i++) {
      violations.add(new SchemaViolation(StarSchemaEntity.CUSTOMERS, "customerNumber=" + i, null,
          SchemaViolation.Type.DUPLICATE_KEY, "primary key appears more than once"));
    }
    SchemaMismatchException exception = new SchemaMismatchException(StarSchemaEntity.CUSTOMERS, violations.build());
    Assert.assertEquals(exception.getViolations().size(), 25);
    Assert.assertTrue(exception.getMessage().startsWith("Schema mismatch on customers, 25 violation(s)"));
    Assert.assertTrue(exception.getMessage().endsWith("; ..."));
  }
}
