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

package org.apache.starflow.configuration;

/**
 * A central place for all Starflow configuration property keys.
 */
public class ConfigurationKeys {

  /**
   * Common
   */
  public static final String LOCAL_FS_URI = "file:///";
  public static final String PASSWORD_KEY_MARKER = "password";

  /**
   * Job configuration properties
   */
  public static final String JOB_NAME_KEY = "job.name";
  public static final String DEFAULT_JOB_NAME = "classicmodels-star-schema";
  public static final String JOB_ID_KEY = "job.id";
  public static final String JOB_LOCK_ENABLED_KEY = "job.lock.enabled";
  public static final String JOB_LOCK_DIR_KEY = "job.lock.dir";
  public static final String JOB_LISTENERS_KEY = "job.listeners";

  /**
   * Source (relational store) connection properties
   */
  public static final String SOURCE_PREFIX = "source";
  public static final String SOURCE_CONN_PREFIX = SOURCE_PREFIX + ".conn.";
  public static final String SOURCE_CONN_DRIVER = SOURCE_CONN_PREFIX + "driver";
  public static final String SOURCE_CONN_URL = SOURCE_CONN_PREFIX + "url";
  public static final String SOURCE_CONN_USERNAME = SOURCE_CONN_PREFIX + "username";
  public static final String SOURCE_CONN_PASSWORD = SOURCE_CONN_PREFIX + "password";
  public static final String SOURCE_CONN_MAX_ACTIVE = SOURCE_CONN_PREFIX + "max.active";
  public static final int DEFAULT_SOURCE_CONN_MAX_ACTIVE = 5;
  public static final String SOURCE_CONN_MAX_IDLE = SOURCE_CONN_PREFIX + "max.idle";
  public static final int DEFAULT_SOURCE_CONN_MAX_IDLE = 5;
  public static final String SOURCE_CONN_MAX_WAIT_MS = SOURCE_CONN_PREFIX + "max.wait.ms";
  public static final long DEFAULT_SOURCE_CONN_MAX_WAIT_MS = 30000L;

  public static final String SOURCE_QUERY_TIMEOUT_SECONDS = SOURCE_PREFIX + ".query.timeout.seconds";
  public static final int DEFAULT_SOURCE_QUERY_TIMEOUT_SECONDS = 300;
  public static final String SOURCE_QUERY_FETCH_SIZE = SOURCE_PREFIX + ".query.fetch.size";
  public static final int DEFAULT_SOURCE_QUERY_FETCH_SIZE = 1000;
  public static final String SOURCE_ENTITY_PREFIX = SOURCE_PREFIX + ".entity.";
  public static final String SOURCE_ENTITY_TABLE_SUFFIX = ".table";

  public static final String SOURCE_EXTRACT_TIMEOUT_MS = SOURCE_PREFIX + ".extract.timeout.ms";
  public static final long DEFAULT_SOURCE_EXTRACT_TIMEOUT_MS = 600000L;
  public static final String SOURCE_EXTRACT_THREADS = SOURCE_PREFIX + ".extract.threads";
  public static final int DEFAULT_SOURCE_EXTRACT_THREADS = 5;
  public static final String SOURCE_EXTRACT_RUN_TIMEOUT_MS = SOURCE_PREFIX + ".extract.run.timeout.ms";
  public static final long DEFAULT_SOURCE_EXTRACT_RUN_TIMEOUT_MS = 3600000L;
  public static final String SOURCE_RETRY_PREFIX = SOURCE_PREFIX + ".retry.";
  public static final String SOURCE_RETRY_ENABLED = SOURCE_RETRY_PREFIX + "enabled";

  /**
   * Transformation properties
   */
  public static final String TRANSFORM_THREADS = "transform.threads";
  public static final int DEFAULT_TRANSFORM_THREADS = 3;
  public static final String TRANSFORM_TIMEOUT_MS = "transform.timeout.ms";
  public static final long DEFAULT_TRANSFORM_TIMEOUT_MS = 600000L;
  public static final String TRANSFORM_GAP_SAMPLE_SIZE = "transform.referential.gap.sample.size";
  public static final int DEFAULT_TRANSFORM_GAP_SAMPLE_SIZE = 100;

  /**
   * Writer properties
   */
  public static final String WRITER_PREFIX = "writer";
  public static final String WRITER_FILE_SYSTEM_URI = WRITER_PREFIX + ".fs.uri";
  public static final String WRITER_CODEC_TYPE = WRITER_PREFIX + ".codec.type";
  public static final String DEFAULT_WRITER_CODEC_TYPE = "SNAPPY";
  public static final String WRITER_FILE_NAME_PREFIX = WRITER_PREFIX + ".file.name.prefix";
  public static final String DEFAULT_WRITER_FILE_NAME_PREFIX = "part";
  public static final String WRITER_PARQUET_PAGE_SIZE = WRITER_PREFIX + ".parquet.page.size";
  public static final String WRITER_PARQUET_BLOCK_SIZE = WRITER_PREFIX + ".parquet.block.size";
  public static final String WRITER_PARQUET_DICTIONARY = WRITER_PREFIX + ".parquet.dictionary";
  public static final String WRITER_PARQUET_VALIDATE = WRITER_PREFIX + ".parquet.validate";
  public static final String WRITER_PARTITIONER_PREFIX = WRITER_PREFIX + ".partitioner.";
  public static final String WRITER_PARTITIONER_COLUMN_SUFFIX = ".column";
  public static final String WRITER_PARTITIONER_GRANULARITY_SUFFIX = ".granularity";

  /**
   * Writer bookkeeping properties, set on a table's state by the writer and read by the publisher
   */
  public static final String WRITER_STAGING_DIR = WRITER_PREFIX + ".staging.dir";
  public static final String WRITER_OUTPUT_DIR = WRITER_PREFIX + ".output.dir";
  public static final String WRITER_RECORDS_WRITTEN = WRITER_PREFIX + ".records.written";
  public static final String WRITER_BYTES_WRITTEN = WRITER_PREFIX + ".bytes.written";
  public static final String WRITER_FINAL_OUTPUT_FILE_PATHS = WRITER_PREFIX + ".final.output.file.paths";

  /**
   * Data publisher properties
   */
  public static final String DATA_PUBLISHER_PREFIX = "data.publisher";
  public static final String DATA_PUBLISHER_FINAL_DIR = DATA_PUBLISHER_PREFIX + ".final.dir";
  public static final String DATA_PUBLISHER_STAGING_DIR_NAME = "_staging";
  public static final String DATA_PUBLISHER_BACKUP_DIR_NAME = "_backup";
  public static final String DATA_PUBLISHER_MANIFEST_FILE_NAME = "_SNAPSHOT";
  public static final String PUBLISHER_DIRS = DATA_PUBLISHER_PREFIX + ".output.dirs";

  /**
   * Catalog refresh properties
   */
  public static final String CATALOG_REFRESH_TRIGGER_CLASS = "catalog.refresh.trigger.class";
  public static final String CATALOG_REFRESH_MARKER_DIR = "catalog.refresh.marker.dir";
  public static final String CATALOG_REFRESH_ENABLED = "catalog.refresh.enabled";
}
