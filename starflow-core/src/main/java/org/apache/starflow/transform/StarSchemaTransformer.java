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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.schema.AvroSchemas;
import org.apache.starflow.schema.RecordKey;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.SchemaMismatchException;
import org.apache.starflow.schema.SchemaValidator;
import org.apache.starflow.schema.SchemaViolation;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.util.ExecutorsUtils;


/**
 * Derives the star schema from a {@link SourceSnapshot}.
 *
 * <p>
 *   {@link #transform(SourceSnapshot)} has no side effects besides logging. It validates the source row sets,
 *   derives the three dimensions concurrently while deriving the fact table on the calling thread, and
 *   validates every derived table against its target schema. Output rows follow the extraction order of the
 *   rows they come from, so two transformations of the same snapshot yield identical tables.
 * </p>
 *
 * <ul>
 *   <li>{@code dim_customers}: one row per customer.</li>
 *   <li>{@code dim_products}: one row per product, with the description of its product line, or null
 *   (and a warning) if the line is unknown.</li>
 *   <li>{@code dim_locations}: one row per distinct customer postal code; the first (city, state, country) in
 *   extraction order wins and every disagreeing tuple is reported as a {@link LocationConflict}.</li>
 *   <li>{@code fact_orders}: one row per order line whose order, customer, customer postal code and product all
 *   resolve; every other order line is a {@link ReferentialGap}.</li>
 * </ul>
 */
@Slf4j
public class StarSchemaTransformer {

  private static final List<String> ORDER_REF = ImmutableList.of("orderNumber");
  private static final List<String> CUSTOMER_REF = ImmutableList.of("customerNumber");
  private static final List<String> PRODUCT_REF = ImmutableList.of("productCode");
  private static final List<String> PRODUCT_LINE_REF = ImmutableList.of("productLine");
  private static final List<String> POSTAL_CODE = ImmutableList.of("postalCode");
  private static final Joiner TUPLE_JOINER = Joiner.on(", ").useForNull("null");

  private final SchemaValidator validator = new SchemaValidator();
  private final int threads;
  private final long timeoutMillis;
  private final int gapSampleSize;

  public StarSchemaTransformer(State state) {
    this.threads = state.getPropAsInt(ConfigurationKeys.TRANSFORM_THREADS, ConfigurationKeys.DEFAULT_TRANSFORM_THREADS);
    this.timeoutMillis =
        state.getPropAsLong(ConfigurationKeys.TRANSFORM_TIMEOUT_MS, ConfigurationKeys.DEFAULT_TRANSFORM_TIMEOUT_MS);
    this.gapSampleSize = state.getPropAsInt(ConfigurationKeys.TRANSFORM_GAP_SAMPLE_SIZE,
        ConfigurationKeys.DEFAULT_TRANSFORM_GAP_SAMPLE_SIZE);
  }

  /**
   * Derive the four target tables.
   *
   * @throws SchemaMismatchException if a source or derived row set breaks its entity's schema or key contract
   * @throws TimeoutException if the dimensions are not derived within {@code transform.timeout.ms}
   */
  public TransformResult transform(SourceSnapshot snapshot) throws InterruptedException, TimeoutException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    for (StarSchemaEntity source : StarSchemaEntity.sources()) {
      checkRowSet(snapshot.get(source));
    }
    List<SchemaViolation> dangling = this.validator.validateReferences(snapshot.asMap());
    if (!dangling.isEmpty()) {
      log.info("{} dangling reference(s) between source entities, first: {}", dangling.size(), dangling.get(0));
    }

    Map<StarSchemaEntity, RowSet> tables = new EnumMap<>(StarSchemaEntity.class);
    Map<StarSchemaEntity, Long> rowsSkipped = new EnumMap<>(StarSchemaEntity.class);
    List<LocationConflict> conflicts = new ArrayList<>();
    List<String> unresolved = new ArrayList<>();
    GapCollector gaps = new GapCollector(this.gapSampleSize);

    ListeningExecutorService executor =
        ExecutorsUtils.newFixedListeningThreadPool(this.threads, log, "StarSchemaTransformer-%d");
    try {
      List<ListenableFuture<RowSet>> dimensions = ImmutableList.of(
          executor.submit(() -> deriveCustomers(snapshot)),
          executor.submit(() -> deriveProducts(snapshot, unresolved)),
          executor.submit(() -> deriveLocations(snapshot, conflicts)));
      RowSet facts = deriveFacts(snapshot, gaps);

      for (RowSet dimension : awaitAll(dimensions)) {
        tables.put(dimension.getEntity(), dimension);
      }
      tables.put(StarSchemaEntity.FACT_ORDERS, facts);
    } finally {
      ExecutorsUtils.shutdownExecutorService(executor);
    }

    long customersWithoutPostalCode = 0;
    for (GenericRecord customer : snapshot.get(StarSchemaEntity.CUSTOMERS).getRows()) {
      if (customer.get("postalCode") == null) {
        customersWithoutPostalCode++;
      }
    }
    rowsSkipped.put(StarSchemaEntity.DIM_LOCATIONS, customersWithoutPostalCode);
    rowsSkipped.put(StarSchemaEntity.FACT_ORDERS, gaps.getCount());

    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      checkRowSet(tables.get(target));
    }

    TransformResult result =
        new TransformResult(tables, rowsSkipped, conflicts, unresolved, gaps.getSample(), gaps.getCount());
    logSummary(result, stopwatch);
    return result;
  }

  private void checkRowSet(RowSet rowSet) {
    List<SchemaViolation> fatal = SchemaValidator.fatal(this.validator.validate(rowSet));
    if (!fatal.isEmpty()) {
      throw new SchemaMismatchException(rowSet.getEntity(), fatal);
    }
  }

  private List<RowSet> awaitAll(List<ListenableFuture<RowSet>> futures)
      throws InterruptedException, TimeoutException {
    ListenableFuture<List<RowSet>> all = Futures.allAsList(futures);
    try {
      return all.get(this.timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      all.cancel(true);
      throw e;
    } catch (ExecutionException ee) {
      Throwable cause = ee.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Dimension derivation failed", cause);
    }
  }

  private static RowSet deriveCustomers(SourceSnapshot snapshot) {
    Schema schema = StarSchemaEntity.DIM_CUSTOMERS.getSchema();
    List<GenericRecord> rows = new ArrayList<>();
    for (GenericRecord customer : snapshot.get(StarSchemaEntity.CUSTOMERS).getRows()) {
      GenericRecord row = new GenericData.Record(schema);
      row.put("customer_number", customer.get("customerNumber"));
      row.put("customer_name", customer.get("customerName"));
      row.put("contact_last_name", customer.get("contactLastName"));
      row.put("contact_first_name", customer.get("contactFirstName"));
      row.put("phone", customer.get("phone"));
      row.put("address_line1", customer.get("addressLine1"));
      row.put("address_line2", customer.get("addressLine2"));
      row.put("postal_code", customer.get("postalCode"));
      row.put("sales_rep_employee_number", customer.get("salesRepEmployeeNumber"));
      row.put("credit_limit", customer.get("creditLimit"));
      rows.add(row);
    }
    return new RowSet(StarSchemaEntity.DIM_CUSTOMERS, rows);
  }

  private static RowSet deriveProducts(SourceSnapshot snapshot, List<String> unresolved) {
    Schema schema = StarSchemaEntity.DIM_PRODUCTS.getSchema();
    Map<RecordKey, GenericRecord> lines = Relations.index(snapshot.get(StarSchemaEntity.PRODUCT_LINES).getRows(),
        StarSchemaEntity.PRODUCT_LINES.getPrimaryKey());

    List<GenericRecord> rows = new ArrayList<>();
    for (Relations.Joined<GenericRecord, GenericRecord> joined : Relations.leftJoin(
        snapshot.get(StarSchemaEntity.PRODUCTS).getRows(), p -> RecordKey.of(p, PRODUCT_LINE_REF), lines)) {
      GenericRecord product = joined.getLeft();
      GenericRecord line = joined.getRight();
      if (line == null) {
        unresolved.add(String.format("%s: product %s references unknown product line %s",
            StarSchemaEntity.DIM_PRODUCTS.getTableName(), product.get("productCode"), product.get("productLine")));
      }
      GenericRecord row = new GenericData.Record(schema);
      row.put("product_code", product.get("productCode"));
      row.put("product_name", product.get("productName"));
      row.put("product_line", product.get("productLine"));
      row.put("product_line_description", line == null ? null : line.get("textDescription"));
      row.put("product_scale", product.get("productScale"));
      row.put("product_vendor", product.get("productVendor"));
      row.put("product_description", product.get("productDescription"));
      row.put("quantity_in_stock", product.get("quantityInStock"));
      row.put("buy_price", product.get("buyPrice"));
      row.put("msrp", product.get("MSRP"));
      rows.add(row);
    }
    return new RowSet(StarSchemaEntity.DIM_PRODUCTS, rows);
  }

  private static RowSet deriveLocations(SourceSnapshot snapshot, List<LocationConflict> conflicts) {
    Schema schema = StarSchemaEntity.DIM_LOCATIONS.getSchema();
    List<GenericRecord> firsts = Relations.distinctByKey(snapshot.get(StarSchemaEntity.CUSTOMERS).getRows(),
        c -> RecordKey.of(c, POSTAL_CODE), (kept, other) -> {
          String keptTuple = locationTuple(kept);
          String otherTuple = locationTuple(other);
          if (!keptTuple.equals(otherTuple)) {
            conflicts.add(new LocationConflict(kept.get("postalCode").toString(), keptTuple, otherTuple,
                StarSchemaEntity.CUSTOMERS.keyOf(other).toString()));
          }
        });

    List<GenericRecord> rows = new ArrayList<>();
    for (GenericRecord customer : firsts) {
      GenericRecord row = new GenericData.Record(schema);
      row.put("postal_code", customer.get("postalCode"));
      row.put("city", customer.get("city"));
      row.put("state", customer.get("state"));
      row.put("country", customer.get("country"));
      rows.add(row);
    }
    return new RowSet(StarSchemaEntity.DIM_LOCATIONS, rows);
  }

  private static String locationTuple(GenericRecord customer) {
    return "(" + TUPLE_JOINER.join(text(customer.get("city")), text(customer.get("state")),
        text(customer.get("country"))) + ")";
  }

  private static String text(Object value) {
    return Objects.toString(value, null);
  }

  private static RowSet deriveFacts(SourceSnapshot snapshot, GapCollector gaps) {
    Map<RecordKey, GenericRecord> orders =
        Relations.index(snapshot.get(StarSchemaEntity.ORDERS).getRows(), StarSchemaEntity.ORDERS.getPrimaryKey());
    Map<RecordKey, GenericRecord> customers = Relations.index(snapshot.get(StarSchemaEntity.CUSTOMERS).getRows(),
        StarSchemaEntity.CUSTOMERS.getPrimaryKey());
    Map<RecordKey, GenericRecord> products = Relations.index(snapshot.get(StarSchemaEntity.PRODUCTS).getRows(),
        StarSchemaEntity.PRODUCTS.getPrimaryKey());

    List<FactLine> lines = new ArrayList<>();
    for (Relations.Joined<GenericRecord, GenericRecord> joined : Relations.innerJoin(
        snapshot.get(StarSchemaEntity.ORDER_DETAILS).getRows(), d -> RecordKey.of(d, ORDER_REF), orders,
        d -> gaps.add(d, StarSchemaEntity.ORDERS, RecordKey.of(d, ORDER_REF)))) {
      lines.add(new FactLine(joined.getLeft(), joined.getRight()));
    }

    List<FactLine> withCustomers = new ArrayList<>(lines.size());
    for (Relations.Joined<FactLine, GenericRecord> joined : Relations.innerJoin(lines,
        l -> RecordKey.of(l.order, CUSTOMER_REF), customers,
        l -> gaps.add(l.detail, StarSchemaEntity.CUSTOMERS, RecordKey.of(l.order, CUSTOMER_REF)))) {
      FactLine line = joined.getLeft();
      line.customer = joined.getRight();
      if (line.customer.get("postalCode") == null) {
        gaps.add(line.detail, StarSchemaEntity.DIM_LOCATIONS, RecordKey.of(line.customer, POSTAL_CODE));
      } else {
        withCustomers.add(line);
      }
    }

    Schema schema = StarSchemaEntity.FACT_ORDERS.getSchema();
    int amountScale = AvroSchemas.decimal(schema.getField("order_amount").schema()).getScale();
    List<GenericRecord> rows = new ArrayList<>();
    for (Relations.Joined<FactLine, GenericRecord> joined : Relations.innerJoin(withCustomers,
        l -> RecordKey.of(l.detail, PRODUCT_REF), products,
        l -> gaps.add(l.detail, StarSchemaEntity.PRODUCTS, RecordKey.of(l.detail, PRODUCT_REF)))) {
      FactLine line = joined.getLeft();
      GenericRecord product = joined.getRight();
      int quantity = (Integer) line.detail.get("quantityOrdered");
      BigDecimal priceEach = (BigDecimal) line.detail.get("priceEach");

      GenericRecord row = new GenericData.Record(schema);
      row.put("order_number", line.detail.get("orderNumber"));
      row.put("order_line_number", line.detail.get("orderLineNumber"));
      row.put("customer_number", line.customer.get("customerNumber"));
      row.put("product_code", product.get("productCode"));
      row.put("postal_code", line.customer.get("postalCode"));
      row.put("order_date", line.order.get("orderDate"));
      row.put("status", line.order.get("status"));
      row.put("quantity_ordered", quantity);
      row.put("price_each", priceEach);
      row.put("order_amount", orderAmount(quantity, priceEach, amountScale));
      rows.add(row);
    }
    return new RowSet(StarSchemaEntity.FACT_ORDERS, rows);
  }

  /**
   * The exact product of quantity and unit price. The result is only rescaled when that loses nothing, so an
   * unrepresentable amount is left for target validation to reject.
   */
  static BigDecimal orderAmount(int quantity, BigDecimal priceEach, int scale) {
    BigDecimal amount = priceEach.multiply(BigDecimal.valueOf(quantity));
    try {
      return amount.setScale(scale, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException ae) {
      return amount;
    }
  }

  private static void logSummary(TransformResult result, Stopwatch stopwatch) {
    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      log.info("Derived {} rows of {} ({} skipped)", result.getTable(target).size(), target.getTableName(),
          result.getRowsSkipped(target));
    }
    for (String warning : result.getWarnings()) {
      log.warn(warning);
    }
    if (result.getReferentialGapCount() > 0) {
      log.warn("Excluded {} order line(s) with unresolved references, e.g. {}", result.getReferentialGapCount(),
          result.getReferentialGaps().get(0));
    }
    log.info("Transformation finished in {}", stopwatch);
  }

  /** An order line and the rows it resolves to. */
  private static class FactLine {
    private final GenericRecord detail;
    private final GenericRecord order;
    private GenericRecord customer;

    private FactLine(GenericRecord detail, GenericRecord order) {
      this.detail = detail;
      this.order = order;
    }
  }

  /** Counts every gap and keeps the first few. */
  private static class GapCollector {
    private final int sampleSize;
    private final List<ReferentialGap> sample = new ArrayList<>();
    private long count = 0;

    private GapCollector(int sampleSize) {
      this.sampleSize = sampleSize;
    }

    private void add(GenericRecord detail, StarSchemaEntity missing, RecordKey reference) {
      this.count++;
      if (this.sample.size() < this.sampleSize) {
        this.sample.add(new ReferentialGap(StarSchemaEntity.FACT_ORDERS,
            StarSchemaEntity.ORDER_DETAILS.keyOf(detail).toString(), missing, reference.toString()));
      }
    }

    private long getCount() {
      return this.count;
    }

    private List<ReferentialGap> getSample() {
      return this.sample;
    }
  }
}
