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

package org.apache.starflow.test;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.apache.avro.generic.GenericRecord;
import org.apache.avro.generic.GenericRecordBuilder;

import org.apache.starflow.schema.StarSchemaEntity;


/**
 * Factories for source rows, filling every field a test does not care about with a plausible value.
 */
public class SourceRecords {

  private SourceRecords() {
  }

  public static GenericRecord customer(int number, String postalCode, String city, String state, String country) {
    return new GenericRecordBuilder(StarSchemaEntity.CUSTOMERS.getSchema())
        .set("customerNumber", number)
        .set("customerName", "Customer " + number)
        .set("contactLastName", "Last" + number)
        .set("contactFirstName", "First" + number)
        .set("phone", "555-" + number)
        .set("addressLine1", number + " Main St.")
        .set("city", city)
        .set("state", state)
        .set("postalCode", postalCode)
        .set("country", country)
        .set("salesRepEmployeeNumber", 1370)
        .set("creditLimit", new BigDecimal("1000.00"))
        .build();
  }

  public static GenericRecord productLine(String productLine, String textDescription) {
    return new GenericRecordBuilder(StarSchemaEntity.PRODUCT_LINES.getSchema())
        .set("productLine", productLine)
        .set("textDescription", textDescription)
        .build();
  }

  public static GenericRecord product(String code, String productLine) {
    return new GenericRecordBuilder(StarSchemaEntity.PRODUCTS.getSchema())
        .set("productCode", code)
        .set("productName", "Product " + code)
        .set("productLine", productLine)
        .set("productScale", "1:18")
        .set("productVendor", "Vendor")
        .set("productDescription", "Description of " + code)
        .set("quantityInStock", 100)
        .set("buyPrice", new BigDecimal("5.00"))
        .set("MSRP", new BigDecimal("9.99"))
        .build();
  }

  public static GenericRecord order(int number, int customerNumber, LocalDate orderDate) {
    return new GenericRecordBuilder(StarSchemaEntity.ORDERS.getSchema())
        .set("orderNumber", number)
        .set("orderDate", orderDate)
        .set("requiredDate", orderDate.plusDays(7))
        .set("status", "Shipped")
        .set("customerNumber", customerNumber)
        .build();
  }

  public static GenericRecord orderDetail(int orderNumber, String productCode, int quantity, String priceEach,
      int lineNumber) {
    return new GenericRecordBuilder(StarSchemaEntity.ORDER_DETAILS.getSchema())
        .set("orderNumber", orderNumber)
        .set("productCode", productCode)
        .set("quantityOrdered", quantity)
        .set("priceEach", new BigDecimal(priceEach))
        .set("orderLineNumber", lineNumber)
        .build();
  }
}
