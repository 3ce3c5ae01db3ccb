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

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;


/**
 * The entities Starflow reads and produces: the five normalized tables of the retail store and the four tables
 * of the star schema derived from them.
 *
 * <p>
 *   Each entity owns an Avro {@link Schema} loaded from {@code avro/<table name>.avsc}. The primary key is declared
 *   in the schema's {@code primaryKey} property so it travels with the schema into the Parquet footers.
 *   Foreign keys are only declared between source entities; the target tables reference each other by
 *   construction.
 * </p>
 */
public enum StarSchemaEntity {

  CUSTOMERS("customers", EntityRole.SOURCE),
  PRODUCT_LINES("productlines", EntityRole.SOURCE),
  PRODUCTS("products", EntityRole.SOURCE),
  ORDERS("orders", EntityRole.SOURCE),
  ORDER_DETAILS("orderdetails", EntityRole.SOURCE),

  DIM_CUSTOMERS("dim_customers", EntityRole.DIMENSION),
  DIM_PRODUCTS("dim_products", EntityRole.DIMENSION),
  DIM_LOCATIONS("dim_locations", EntityRole.DIMENSION),
  FACT_ORDERS("fact_orders", EntityRole.FACT);

  public static final String PRIMARY_KEY_PROP = "primaryKey";

  private final String tableName;
  private final EntityRole role;
  private final Schema schema;
  private final List<String> primaryKey;

  StarSchemaEntity(String tableName, EntityRole role) {
    this.tableName = tableName;
    this.role = role;
    this.schema = loadSchema(tableName);
    this.primaryKey = readPrimaryKey(this.schema);
  }

  public String getTableName() {
    return this.tableName;
  }

  public EntityRole getRole() {
    return this.role;
  }

  public boolean isSource() {
    return this.role == EntityRole.SOURCE;
  }

  public Schema getSchema() {
    return this.schema;
  }

  public List<String> getPrimaryKey() {
    return this.primaryKey;
  }

  /**
   * @return the references this entity holds to other source entities, empty for target tables.
   */
  public List<ForeignKey> getForeignKeys() {
    switch (this) {
      case PRODUCTS:
        return ImmutableList.of(new ForeignKey(PRODUCTS, ImmutableList.of("productLine"), PRODUCT_LINES));
      case ORDERS:
        return ImmutableList.of(new ForeignKey(ORDERS, ImmutableList.of("customerNumber"), CUSTOMERS));
      case ORDER_DETAILS:
        return ImmutableList.of(new ForeignKey(ORDER_DETAILS, ImmutableList.of("orderNumber"), ORDERS),
            new ForeignKey(ORDER_DETAILS, ImmutableList.of("productCode"), PRODUCTS));
      default:
        return ImmutableList.of();
    }
  }

  /**
   * Get the primary key of a record of this entity.
   */
  public RecordKey keyOf(GenericRecord record) {
    return RecordKey.of(record, this.primaryKey);
  }

  public static List<StarSchemaEntity> sources() {
    return byRole(EntityRole.SOURCE, EntityRole.SOURCE);
  }

  /**
   * @return the dimension and fact tables, dimensions first.
   */
  public static List<StarSchemaEntity> targets() {
    return byRole(EntityRole.DIMENSION, EntityRole.FACT);
  }

  public static StarSchemaEntity forTableName(String tableName) {
    for (StarSchemaEntity entity : values()) {
      if (entity.tableName.equalsIgnoreCase(tableName)) {
        return entity;
      }
    }
    throw new IllegalArgumentException("Unknown table " + tableName);
  }

  private static List<StarSchemaEntity> byRole(EntityRole first, EntityRole second) {
    ImmutableList.Builder<StarSchemaEntity> builder = ImmutableList.builder();
    for (StarSchemaEntity entity : values()) {
      if (entity.role == first || entity.role == second) {
        builder.add(entity);
      }
    }
    return builder.build();
  }

  private static Schema loadSchema(String tableName) {
    String resource = "/avro/" + tableName + ".avsc";
    try (InputStream in = StarSchemaEntity.class.getResourceAsStream(resource)) {
      Preconditions.checkState(in != null, "Missing schema resource %s", resource);
      return new Schema.Parser().parse(in);
    } catch (IOException ioe) {
      throw new IllegalStateException("Failed to load schema resource " + resource, ioe);
    }
  }

  @SuppressWarnings("unchecked")
  private static List<String> readPrimaryKey(Schema schema) {
    Object key = schema.getObjectProp(PRIMARY_KEY_PROP);
    Preconditions.checkState(key instanceof List, "Schema %s declares no %s", schema.getFullName(), PRIMARY_KEY_PROP);
    return ImmutableList.copyOf((List<String>) key);
  }
}
