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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hadoop.fs.FileSystem;

import com.codahale.metrics.Timer;
import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.typesafe.config.Config;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.configuration.TableState;
import org.apache.starflow.publisher.StarSchemaPublisher;
import org.apache.starflow.runtime.listeners.JobListener;
import org.apache.starflow.runtime.listeners.JobListeners;
import org.apache.starflow.runtime.locks.FileBasedJobLock;
import org.apache.starflow.runtime.locks.JobLock;
import org.apache.starflow.runtime.locks.JobLockException;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.source.EntitySource;
import org.apache.starflow.source.SourceUnavailableException;
import org.apache.starflow.source.extractor.jdbc.JdbcEntitySource;
import org.apache.starflow.transform.ReferentialGap;
import org.apache.starflow.transform.SourceSnapshot;
import org.apache.starflow.transform.StarSchemaTransformer;
import org.apache.starflow.transform.TransformResult;
import org.apache.starflow.util.ConfigUtils;
import org.apache.starflow.util.ExecutorsUtils;
import org.apache.starflow.util.HadoopUtils;
import org.apache.starflow.util.retry.RetryerFactory;


/**
 * Runs the job once: extracts the source entities, derives the star schema and publishes it.
 *
 * <p>
 *   A run proceeds as follows:
 * </p>
 * <ol>
 *   <li>Acquire the {@link JobLock} of the job. A run that finds the lock held fails without touching the
 *   output location.</li>
 *   <li>Roll back any publish a previous run left half done.</li>
 *   <li>Extract the five source entities in parallel. Each attempt is bounded by
 *   {@link ConfigurationKeys#SOURCE_EXTRACT_TIMEOUT_MS}. Attempts failing with a {@link SourceUnavailableException}
 *   are retried with the retryer configured under {@link ConfigurationKeys#SOURCE_RETRY_PREFIX}; any other failure
 *   fails the run at once.</li>
 *   <li>Transform, stage every target table, then publish them all at once.</li>
 *   <li>Notify the {@link JobListener}s.</li>
 * </ol>
 *
 * <p>
 *   {@link #cancelJob()} is honoured between stages. A run that fails or is cancelled discards what it staged
 *   and leaves the published snapshot untouched. The lock, the executors, the source and the file system are
 *   released on every path. A launcher runs once.
 * </p>
 */
@Slf4j
public class StarSchemaJobLauncher {

  private final State jobState;
  private final String jobName;
  private final String runId;
  private final String outputDir;
  private final EntitySource source;
  private final List<JobListener> listeners;
  private final RunMetrics metrics = new RunMetrics();
  private final JobContext jobContext;

  private final boolean retryEnabled;
  private final Config retryConfig;
  private final long extractTimeoutMillis;
  private final long extractRunTimeoutMillis;
  private final int extractThreads;

  private final AtomicBoolean launched = new AtomicBoolean(false);
  private volatile boolean cancellationRequested = false;

  // Accounting of the run, reported in its outcome
  private final Map<String, Long> rowsExtracted = new LinkedHashMap<>();
  private final Map<String, Long> rowsWritten = new LinkedHashMap<>();
  private final Map<String, Long> rowsSkipped = new LinkedHashMap<>();
  private final Map<String, String> publishedTables = new LinkedHashMap<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> referentialGaps = new ArrayList<>();
  private long referentialGapCount = 0;

  public StarSchemaJobLauncher(State jobState) {
    this(checkOutputDir(jobState), new JdbcEntitySource(jobState), JobListeners.create(jobState));
  }

  public StarSchemaJobLauncher(State jobState, EntitySource source, List<JobListener> listeners) {
    this.jobState = new State(checkOutputDir(jobState));
    this.jobName = jobState.getProp(ConfigurationKeys.JOB_NAME_KEY, ConfigurationKeys.DEFAULT_JOB_NAME);
    this.runId = jobState.getProp(ConfigurationKeys.JOB_ID_KEY, newRunId(this.jobName));
    this.jobState.setProp(ConfigurationKeys.JOB_NAME_KEY, this.jobName);
    this.jobState.setProp(ConfigurationKeys.JOB_ID_KEY, this.runId);
    this.outputDir = jobState.getProp(ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
    this.source = source;
    this.listeners = ImmutableList.copyOf(listeners);
    this.jobContext = new JobContext(this.jobName, this.runId, this.jobState, this.metrics);

    this.retryEnabled = jobState.getPropAsBoolean(ConfigurationKeys.SOURCE_RETRY_ENABLED, true);
    this.retryConfig = ConfigUtils.stateToConfigWithoutPrefix(jobState, ConfigurationKeys.SOURCE_RETRY_PREFIX);
    this.extractTimeoutMillis = jobState.getPropAsLong(ConfigurationKeys.SOURCE_EXTRACT_TIMEOUT_MS,
        ConfigurationKeys.DEFAULT_SOURCE_EXTRACT_TIMEOUT_MS);
    this.extractRunTimeoutMillis = jobState.getPropAsLong(ConfigurationKeys.SOURCE_EXTRACT_RUN_TIMEOUT_MS,
        ConfigurationKeys.DEFAULT_SOURCE_EXTRACT_RUN_TIMEOUT_MS);
    this.extractThreads = jobState.getPropAsInt(ConfigurationKeys.SOURCE_EXTRACT_THREADS,
        ConfigurationKeys.DEFAULT_SOURCE_EXTRACT_THREADS);
  }

  private static State checkOutputDir(State jobState) {
    Preconditions.checkArgument(jobState.contains(ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR),
        "Missing required property %s", ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
    return jobState;
  }

  /**
   * @return a new run id of the form {@code job_<job name>_<current time millis>}
   */
  public static String newRunId(String jobName) {
    return "job_" + jobName + "_" + System.currentTimeMillis();
  }

  public String getRunId() {
    return this.runId;
  }

  public RunMetrics getMetrics() {
    return this.metrics;
  }

  /**
   * Run the job. Failures are reported in the returned outcome rather than thrown.
   *
   * @throws IllegalStateException if this launcher already ran
   */
  public RunOutcome launchJob() {
    Preconditions.checkState(this.launched.compareAndSet(false, true), "Run %s was already launched", this.runId);
    long startTime = System.currentTimeMillis();
    log.info("Starting run {} of job {}", this.runId, this.jobName);

    RunStatus status;
    Throwable failure = null;
    boolean started = false;
    FileSystem fs = null;
    StarSchemaPublisher publisher = null;
    Optional<JobLock> jobLock = Optional.absent();
    try {
      fs = newFileSystem();
      publisher = new StarSchemaPublisher(this.jobState, fs);
      jobLock = lockJob(fs);
      started = true;
      notifyListeners("start", JobListener::onJobStart);

      runStages(publisher);
      status = RunStatus.SUCCESS;
    } catch (RunCancelledException rce) {
      status = RunStatus.CANCELLED;
      log.warn(rce.getMessage());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      status = RunStatus.FAILED;
      failure = ie;
      log.error(String.format("Run %s was interrupted", this.runId), ie);
    } catch (Exception e) {
      status = RunStatus.FAILED;
      failure = e;
      log.error(String.format("Run %s of job %s failed", this.runId, this.jobName), e);
    }

    try {
      if (started && status != RunStatus.SUCCESS) {
        discard(publisher);
        this.publishedTables.clear();
      }

      RunOutcome outcome = buildOutcome(status, failure, startTime);
      this.jobContext.setOutcome(outcome);
      if (started) {
        switch (status) {
          case SUCCESS:
            notifyListeners("completion", JobListener::onJobCompletion);
            break;
          case CANCELLED:
            notifyListeners("cancellation", JobListener::onJobCancellation);
            break;
          default:
            notifyListeners("failure", JobListener::onJobFailure);
            break;
        }
      }
      this.metrics.report(log);
      log.info("Run {} finished with status {} in {} ms:\n{}", this.runId, status, outcome.getDurationMillis(),
          outcome.toJson());
      return outcome;
    } finally {
      unlockJob(jobLock);
      closeQuietly(this.source, "source");
      closeQuietly(publisher, "publisher");
      closeQuietly(fs, "file system");
    }
  }

  /**
   * The file system holding the lock and the published tables. It is closed when the run ends.
   */
  @VisibleForTesting
  protected FileSystem newFileSystem() throws IOException {
    return HadoopUtils.getWriterFileSystem(this.jobState);
  }

  /**
   * Ask the run to stop at the next stage boundary. A stage that is running, a publish included, completes first.
   */
  public synchronized void cancelJob() {
    if (this.cancellationRequested) {
      return;
    }
    this.cancellationRequested = true;
    log.info("Cancellation requested for run {}", this.runId);
  }

  public boolean isCancellationRequested() {
    return this.cancellationRequested;
  }

  private void runStages(StarSchemaPublisher publisher) throws Exception {
    List<String> recovered = publisher.recover();
    if (!recovered.isEmpty()) {
      log.warn("Rolled back the interrupted publish of run(s) {}", recovered);
    }

    checkCancellation("extraction");
    SourceSnapshot snapshot;
    try (Timer.Context context = this.metrics.time(RunMetrics.Stage.EXTRACT)) {
      snapshot = extractAll();
    }

    checkCancellation("transformation");
    TransformResult result;
    try (Timer.Context context = this.metrics.time(RunMetrics.Stage.TRANSFORM)) {
      result = new StarSchemaTransformer(this.jobState).transform(snapshot);
    }
    recordTransformResult(result);

    checkCancellation("staging");
    List<TableState> staged = new ArrayList<>();
    try (Timer.Context context = this.metrics.time(RunMetrics.Stage.STAGE)) {
      for (StarSchemaEntity target : StarSchemaEntity.targets()) {
        TableState tableState = publisher.stage(this.runId, result.getTable(target));
        staged.add(tableState);
        this.rowsWritten.put(target.getTableName(), tableState.getRecordsWritten());
        this.metrics.markRecordsWritten(tableState.getRecordsWritten());
      }
    }

    checkCancellation("publishing");
    try (Timer.Context context = this.metrics.time(RunMetrics.Stage.PUBLISH)) {
      publisher.publish(staged);
    }
    for (TableState tableState : staged) {
      this.publishedTables.put(tableState.getTableName(),
          publisher.getPublishedDir(tableState.getTableName()).toString());
    }
  }

  /**
   * Extract every source entity, failing as soon as one entity fails for good.
   */
  private SourceSnapshot extractAll() throws IOException, InterruptedException {
    ListeningExecutorService entityExecutor =
        ExecutorsUtils.newFixedListeningThreadPool(this.extractThreads, log, "StarflowExtractor-%d");
    ExecutorService attemptExecutor =
        ExecutorsUtils.newFixedListeningThreadPool(this.extractThreads, log, "StarflowExtractAttempt-%d");
    List<ListenableFuture<RowSet>> futures = new ArrayList<>();
    try {
      for (StarSchemaEntity entity : StarSchemaEntity.sources()) {
        futures.add(entityExecutor.submit(() -> extractWithRetries(entity, attemptExecutor)));
      }

      List<RowSet> rowSets;
      try {
        rowSets = Futures.allAsList(futures).get(this.extractRunTimeoutMillis, TimeUnit.MILLISECONDS);
      } catch (TimeoutException te) {
        throw new SourceUnavailableException(
            String.format("Extraction did not finish within %d ms", this.extractRunTimeoutMillis), te);
      } catch (ExecutionException ee) {
        throw propagate(ee.getCause());
      }

      SourceSnapshot.Builder builder = SourceSnapshot.builder();
      for (RowSet rowSet : rowSets) {
        builder.add(rowSet);
        this.rowsExtracted.put(rowSet.getEntity().getTableName(), (long) rowSet.size());
        this.metrics.markRecordsExtracted(rowSet.size());
      }
      return builder.build();
    } finally {
      // No-op for the tasks that completed
      for (Future<RowSet> future : futures) {
        future.cancel(true);
      }
      ExecutorsUtils.shutdownExecutorService(entityExecutor);
      ExecutorsUtils.shutdownExecutorService(attemptExecutor);
    }
  }

  private RowSet extractWithRetries(StarSchemaEntity entity, ExecutorService attemptExecutor) throws Exception {
    if (!this.retryEnabled) {
      return extractOnce(entity, attemptExecutor);
    }

    // Only an unavailable source is worth another attempt
    Retryer<RowSet> retryer = RetryerFactory.newInstance(this.retryConfig, "extraction of " + entity.getTableName(),
        t -> t instanceof SourceUnavailableException);
    try {
      return retryer.call(() -> extractOnce(entity, attemptExecutor));
    } catch (ExecutionException ee) {
      // Not retried
      throw propagate(ee.getCause());
    } catch (RetryException re) {
      Attempt<?> lastAttempt = re.getLastFailedAttempt();
      if (lastAttempt.hasException()) {
        throw propagate(lastAttempt.getExceptionCause());
      }
      throw new SourceUnavailableException(
          String.format("Gave up extracting %s after %d attempts", entity.getTableName(), re.getNumberOfFailedAttempts()),
          re);
    }
  }

  private RowSet extractOnce(StarSchemaEntity entity, ExecutorService attemptExecutor)
      throws IOException, InterruptedException {
    Future<RowSet> attempt = attemptExecutor.submit(() -> this.source.extract(entity));
    try {
      return attempt.get(this.extractTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException te) {
      attempt.cancel(true);
      throw new SourceUnavailableException(String.format("Extraction of %s did not finish within %d ms",
          entity.getTableName(), this.extractTimeoutMillis), te);
    } catch (ExecutionException ee) {
      throw propagate(ee.getCause());
    } catch (InterruptedException ie) {
      attempt.cancel(true);
      // Keep the flag so that the retryer stops instead of backing off
      Thread.currentThread().interrupt();
      throw ie;
    }
  }

  private void recordTransformResult(TransformResult result) {
    for (StarSchemaEntity target : StarSchemaEntity.targets()) {
      this.rowsSkipped.put(target.getTableName(), result.getRowsSkipped(target));
    }
    this.warnings.addAll(result.getWarnings());
    for (ReferentialGap gap : result.getReferentialGaps()) {
      this.referentialGaps.add(gap.toString());
    }
    this.referentialGapCount = result.getReferentialGapCount();
    if (!this.warnings.isEmpty()) {
      log.warn("Run {} raised {} warning(s), first: {}", this.runId, this.warnings.size(), this.warnings.get(0));
    }
  }

  private RunOutcome buildOutcome(RunStatus status, Throwable failure, long startTime) {
    return RunOutcome.builder()
        .runId(this.runId)
        .jobName(this.jobName)
        .status(status)
        .startTimeMillis(startTime)
        .endTimeMillis(System.currentTimeMillis())
        .outputDir(this.outputDir)
        .rowsExtracted(new LinkedHashMap<>(this.rowsExtracted))
        .rowsWritten(new LinkedHashMap<>(this.rowsWritten))
        .rowsSkipped(new LinkedHashMap<>(this.rowsSkipped))
        .publishedTables(new LinkedHashMap<>(this.publishedTables))
        .warnings(new ArrayList<>(this.warnings))
        .referentialGaps(new ArrayList<>(this.referentialGaps))
        .referentialGapCount(this.referentialGapCount)
        .error(failure == null ? null : describe(failure))
        .build();
  }

  private static String describe(Throwable failure) {
    StringBuilder description = new StringBuilder(failure.toString());
    Throwable rootCause = Throwables.getRootCause(failure);
    if (rootCause != failure) {
      description.append(" caused by ").append(rootCause);
    }
    return description.toString();
  }

  private Optional<JobLock> lockJob(FileSystem fs) throws JobLockException {
    if (!this.jobState.getPropAsBoolean(ConfigurationKeys.JOB_LOCK_ENABLED_KEY, true)) {
      return Optional.absent();
    }
    FileBasedJobLock jobLock = new FileBasedJobLock(fs, FileBasedJobLock.getLockFile(this.jobState));
    if (!jobLock.tryLock()) {
      throw new JobLockException(
          String.format("Job %s is already running, lock %s is held", this.jobName, jobLock.getLockFile()));
    }
    return Optional.of(jobLock);
  }

  private void unlockJob(Optional<JobLock> jobLock) {
    if (jobLock.isPresent()) {
      try {
        // Unlock so the next run of the same job can proceed
        jobLock.get().unlock();
      } catch (JobLockException jle) {
        log.error(String.format("Failed to unlock job %s after run %s", this.jobName, this.runId), jle);
      } finally {
        closeQuietly(jobLock.get(), "job lock");
      }
    }
  }

  private void discard(StarSchemaPublisher publisher) {
    try {
      publisher.discard(this.runId);
    } catch (IOException ioe) {
      log.error(String.format("Failed to discard the staged output of run %s", this.runId), ioe);
    }
  }

  private void checkCancellation(String nextStage) throws RunCancelledException {
    if (this.cancellationRequested) {
      throw new RunCancelledException(String.format("Run %s was cancelled before %s", this.runId, nextStage));
    }
  }

  private void notifyListeners(String event, ListenerCallback callback) {
    for (JobListener listener : this.listeners) {
      try {
        callback.call(listener, this.jobContext);
      } catch (Exception e) {
        log.error(String.format("Listener %s failed on %s of run %s", listener.getClass().getName(), event,
            this.runId), e);
      }
    }
  }

  private void closeQuietly(Closeable closeable, String name) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (IOException ioe) {
      log.error(String.format("Failed to close the %s of run %s", name, this.runId), ioe);
    }
  }

  private static IOException propagate(Throwable t) {
    Throwables.throwIfUnchecked(t);
    if (t instanceof IOException) {
      return (IOException) t;
    }
    return new IOException(t);
  }

  private interface ListenerCallback {
    void call(JobListener listener, JobContext jobContext) throws Exception;
  }

  private static class RunCancelledException extends Exception {
    private static final long serialVersionUID = -3271465183052349417L;

    RunCancelledException(String message) {
      super(message);
    }
  }
}
