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

package org.apache.starflow.util.retry;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.StopStrategy;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.apache.starflow.exception.NonTransientException;


/**
 * Factory class that builds Retryer.
 * It's recommended to use with {@link org.apache.starflow.util.ConfigUtils#stateToConfigWithoutPrefix} so that
 * with a State and the prefix of the config keys, a caller can easily instantiate a Retryer.
 *
 * <p>
 *   A retryer stops after {@link #RETRY_TIMES} attempts when that key is set, and after {@link #RETRY_TIME_OUT_MS}
 *   otherwise. A {@link NonTransientException} is never retried. Callers can narrow the retried exceptions further
 *   with {@link #newInstance(Config, String, Predicate)}.
 * </p>
 *
 * @param <T>
 */
public class RetryerFactory<T> {
  private static final Logger LOG = LoggerFactory.getLogger(RetryerFactory.class);
  public static final String RETRY_MULTIPLIER = "multiplier";
  public static final String RETRY_INTERVAL_MS = "interval_ms";
  public static final String RETRY_TIME_OUT_MS = "time_out_ms";
  public static final String RETRY_TIMES = "times";
  public static final String RETRY_TYPE = "retry_type";

  private static final Predicate<Throwable> RETRY_EXCEPTION_PREDICATE;
  private static final Config DEFAULTS;
  static {
    RETRY_EXCEPTION_PREDICATE = new Predicate<Throwable>() {
      @Override
      public boolean apply(Throwable t) {
        return !(t instanceof NonTransientException);
      }
    };

    Map<String, Object> configMap = ImmutableMap.<String, Object>builder()
                                                .put(RETRY_TIME_OUT_MS, TimeUnit.MINUTES.toMillis(5L))
                                                .put(RETRY_INTERVAL_MS, TimeUnit.SECONDS.toMillis(30L))
                                                .put(RETRY_MULTIPLIER, 2L)
                                                .put(RETRY_TYPE, RetryType.EXPONENTIAL.name())
                                                .build();
    DEFAULTS = ConfigFactory.parseMap(configMap);
  }

  public static enum RetryType {
    EXPONENTIAL,
    FIXED;
  }

  /**
   * Creates new instance of retryer based on the config.
   * Accepted config keys are defined in RetryerFactory as static member variable.
   */
  public static <T> Retryer<T> newInstance(Config config) {
    return newInstance(config, "operation");
  }

  /**
   * Same as {@link #newInstance(Config)}, logging each failed attempt of <code>operationName</code>.
   */
  public static <T> Retryer<T> newInstance(Config config, final String operationName) {
    return newInstance(config, operationName, Predicates.<Throwable>alwaysTrue());
  }

  /**
   * Same as {@link #newInstance(Config, String)}, retrying only the exceptions accepted by <code>retryIf</code>.
   */
  public static <T> Retryer<T> newInstance(Config config, final String operationName, Predicate<Throwable> retryIf) {
    config = config.withFallback(DEFAULTS);
    Predicate<Throwable> retryPredicate = Predicates.and(RETRY_EXCEPTION_PREDICATE, retryIf);
    RetryType type = RetryType.valueOf(config.getString(RETRY_TYPE).toUpperCase());

    RetryerBuilder<T> builder;
    switch (type) {
      case EXPONENTIAL:
        builder = newExponentialRetryer(config, retryPredicate);
        break;
      case FIXED:
        builder = newFixedRetryer(config, retryPredicate);
        break;
      default:
        throw new IllegalArgumentException(type + " is not supported");
    }
    return builder.withStopStrategy(stopStrategy(config))
        .withRetryListener(new RetryListener() {
          @Override
          public <V> void onRetry(Attempt<V> attempt) {
            if (attempt.hasException()) {
              LOG.warn(String.format("Attempt %d of %s failed: %s", attempt.getAttemptNumber(), operationName,
                  attempt.getExceptionCause().getMessage()));
            }
          }
        })
        .build();
  }

  private static StopStrategy stopStrategy(Config config) {
    if (config.hasPath(RETRY_TIMES)) {
      return StopStrategies.stopAfterAttempt(config.getInt(RETRY_TIMES));
    }
    return StopStrategies.stopAfterDelay(config.getLong(RETRY_TIME_OUT_MS), TimeUnit.MILLISECONDS);
  }

  private static <T> RetryerBuilder<T> newFixedRetryer(Config config, Predicate<Throwable> retryPredicate) {
    return RetryerBuilder.<T> newBuilder()
        .retryIfException(retryPredicate)
        .withWaitStrategy(WaitStrategies.fixedWait(config.getLong(RETRY_INTERVAL_MS), TimeUnit.MILLISECONDS));
  }

  private static <T> RetryerBuilder<T> newExponentialRetryer(Config config, Predicate<Throwable> retryPredicate) {
    return RetryerBuilder.<T> newBuilder()
        .retryIfException(retryPredicate)
        .withWaitStrategy(WaitStrategies.exponentialWait(config.getLong(RETRY_MULTIPLIER),
                                                         config.getLong(RETRY_INTERVAL_MS),
                                                         TimeUnit.MILLISECONDS));
  }
}
