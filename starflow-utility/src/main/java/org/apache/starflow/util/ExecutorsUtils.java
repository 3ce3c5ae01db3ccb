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

package org.apache.starflow.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;


/**
 * A utility class to use with {@link java.util.concurrent.Executors} in cases such as when creating new thread pools.
 */
public class ExecutorsUtils {

  public static final long EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT = 60;
  public static final TimeUnit EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT_TIMEUNIT = TimeUnit.SECONDS;

  private ExecutorsUtils() {
  }

  /**
   * Get a new {@link java.util.concurrent.ThreadFactory} that uses a {@link LoggingUncaughtExceptionHandler}
   * to handle uncaught exceptions and the given thread name format.
   *
   * @param logger an {@link com.google.common.base.Optional} wrapping the {@link org.slf4j.Logger} that the
   *               {@link LoggingUncaughtExceptionHandler} uses to log uncaught exceptions thrown in threads
   * @param nameFormat an {@link com.google.common.base.Optional} wrapping a thread naming format
   * @return a new {@link java.util.concurrent.ThreadFactory}
   */
  public static ThreadFactory newThreadFactory(Optional<Logger> logger, Optional<String> nameFormat) {
    ThreadFactoryBuilder builder = new ThreadFactoryBuilder().setDaemon(true);
    if (nameFormat.isPresent()) {
      builder.setNameFormat(nameFormat.get());
    }
    return builder.setUncaughtExceptionHandler(new LoggingUncaughtExceptionHandler(logger)).build();
  }

  /**
   * Create a bounded {@link ListeningExecutorService} whose threads are named after <code>nameFormat</code>
   * and log uncaught exceptions to <code>logger</code>.
   */
  public static ListeningExecutorService newFixedListeningThreadPool(int threads, Logger logger, String nameFormat) {
    Preconditions.checkArgument(threads > 0, "Thread pool size must be positive: %s", threads);
    return MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(threads,
        newThreadFactory(Optional.of(logger), Optional.of(nameFormat))));
  }

  /**
   * Shutdown an {@link ExecutorService} gradually, first disabling new task submissions and later cancelling
   * existing tasks.
   *
   * @param executorService the {@link ExecutorService} to shutdown
   * @param timeout the maximum time to wait for the {@code ExecutorService} to terminate
   * @param unit the time unit of the timeout argument
   */
  public static void shutdownExecutorService(ExecutorService executorService, long timeout, TimeUnit unit) {
    Preconditions.checkNotNull(unit);
    // Disable new tasks from being submitted
    executorService.shutdown();
    try {
      long halfTimeoutNanos = TimeUnit.NANOSECONDS.convert(timeout, unit) / 2;
      // Wait for half the duration of the timeout for existing tasks to terminate
      if (!executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS)) {
        // Cancel currently executing tasks
        executorService.shutdownNow();
        // Wait the other half of the timeout for tasks to respond to being cancelled
        executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS);
      }
    } catch (InterruptedException ie) {
      // Preserve interrupt status
      Thread.currentThread().interrupt();
      // (Re-)Cancel if current thread also interrupted
      executorService.shutdownNow();
    }
  }

  /**
   * Shutdown an {@link ExecutorService} with the default timeout of {@link #EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT}
   * {@link #EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT_TIMEUNIT}.
   */
  public static void shutdownExecutorService(ExecutorService executorService) {
    shutdownExecutorService(executorService, EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT,
        EXECUTOR_SERVICE_SHUTDOWN_TIMEOUT_TIMEUNIT);
  }
}
