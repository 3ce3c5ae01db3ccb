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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.avro.generic.GenericRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import org.apache.starflow.schema.RecordKey;

import static org.apache.starflow.test.SourceRecords.customer;
import static org.apache.starflow.test.SourceRecords.product;
import static org.apache.starflow.test.SourceRecords.productLine;


@Test(groups = {"starflow.transform"})
public class RelationsTest {

  private static final List<String> LINE = ImmutableList.of("productLine");

  private final List<GenericRecord> lines = ImmutableList.of(productLine("Cars", "Fast"), productLine("Ships", null));
  private final List<GenericRecord> products =
      ImmutableList.of(product("P3", "Ships"), product("P1", "Trains"), product("P2", "Cars"));

  public void testInnerJoinKeepsLeftOrderAndReportsUnmatched() {
    Map<RecordKey, GenericRecord> index = Relations.index(this.lines, LINE);
    List<GenericRecord> unmatched = new ArrayList<>();

    List<Relations.Joined<GenericRecord, GenericRecord>> joined =
        Relations.innerJoin(this.products, p -> RecordKey.of(p, LINE), index, unmatched::add);

    Assert.assertEquals(joined.size(), 2);
    Assert.assertEquals(joined.get(0).getLeft().get("productCode"), "P3");
    Assert.assertEquals(joined.get(0).getRight().get("productLine"), "Ships");
    Assert.assertEquals(joined.get(1).getLeft().get("productCode"), "P2");
    Assert.assertEquals(unmatched.size(), 1);
    Assert.assertEquals(unmatched.get(0).get("productCode"), "P1");
  }

  public void testLeftJoinKeepsEveryLeftRow() {
    List<Relations.Joined<GenericRecord, GenericRecord>> joined =
        Relations.leftJoin(this.products, p -> RecordKey.of(p, LINE), Relations.index(this.lines, LINE));

    Assert.assertEquals(joined.size(), this.products.size());
    Assert.assertNotNull(joined.get(0).getRight());
    Assert.assertNull(joined.get(1).getRight());
    Assert.assertNotNull(joined.get(2).getRight());
  }

  public void testNullKeysNeverMatch() {
    List<String> postalCode = ImmutableList.of("postalCode");
    List<GenericRecord> customers = ImmutableList.of(customer(1, null, "A", null, "X"), customer(2, "1000", "B", null,
        "X"));
    Map<RecordKey, GenericRecord> index = Relations.index(customers, postalCode);
    Assert.assertEquals(index.size(), 1);

    List<GenericRecord> unmatched = new ArrayList<>();
    List<Relations.Joined<GenericRecord, GenericRecord>> joined =
        Relations.innerJoin(customers, c -> RecordKey.of(c, postalCode), index, unmatched::add);
    Assert.assertEquals(joined.size(), 1);
    Assert.assertEquals(unmatched.size(), 1);
    Assert.assertEquals(unmatched.get(0).get("customerNumber"), 1);
  }

  public void testDistinctByKeyKeepsFirst() {
    List<String> postalCode = ImmutableList.of("postalCode");
    List<GenericRecord> customers = ImmutableList.of(customer(1, "1000", "A", null, "X"),
        customer(2, "2000", "B", null, "X"), customer(3, "1000", "C", null, "X"), customer(4, null, "D", null, "X"));
    List<String> duplicates = new ArrayList<>();

    List<GenericRecord> distinct = Relations.distinctByKey(customers, c -> RecordKey.of(c, postalCode),
        (kept, other) -> duplicates.add(kept.get("customerNumber") + "<" + other.get("customerNumber")));

    Assert.assertEquals(distinct.size(), 2);
    Assert.assertEquals(distinct.get(0).get("city"), "A");
    Assert.assertEquals(distinct.get(1).get("city"), "B");
    Assert.assertEquals(duplicates, ImmutableList.of("1<3"));
  }
}
