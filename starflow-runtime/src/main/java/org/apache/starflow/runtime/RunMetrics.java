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

package org.apache.starflow.runtime;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;


/**
 * Metrics of a single run: one timer per stage and meters for the records flowing in and out.
 */
public class RunMetrics {

  public static final String METRICS_PREFIX = "starflow.run";
  public static final String RECORDS_EXTRACTED_METER = MetricRegistry.name(METRICS_PREFIX, "records", "extracted");
  public static final String RECORDS_WRITTEN_METER = MetricRegistry.name(METRICS_PREFIX, "records", "written");

  public enum Stage {
    EXTRACT,
    TRANSFORM,
    STAGE,
    PUBLISH;

    public String getTimerName() {
      return MetricRegistry.name(METRICS_PREFIX, name().toLowerCase(), "time");
    }
  }

  private final MetricRegistry registry = new MetricRegistry();
  private final Meter recordsExtracted = this.registry.meter(RECORDS_EXTRACTED_METER);
  private final Meter recordsWritten = this.registry.meter(RECORDS_WRITTEN_METER);

  /**
   * Start timing a stage. Close the returned context when the stage ends.
   */
  public Timer.Context time(Stage stage) {
    return this.registry.timer(stage.getTimerName()).time();
  }

  public void markRecordsExtracted(long count) {
    this.recordsExtracted.mark(count);
  }

  public void markRecordsWritten(long count) {
    this.recordsWritten.mark(count);
  }

  public MetricRegistry getRegistry() {
    return this.registry;
  }

  /**
   * Log every metric of this run once.
   */
  public void report(Logger logger) {
    Slf4jReporter.forRegistry(this.registry)
        .outputTo(logger)
        .convertRatesTo(TimeUnit.SECONDS)
        .convertDurationsTo(TimeUnit.MILLISECONDS)
        .build()
        .report();
  }
}
