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

package org.apache.starflow.publisher;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.apache.avro.SchemaNormalization;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.configuration.TableState;
import org.apache.starflow.schema.RowSet;
import org.apache.starflow.schema.StarSchemaEntity;
import org.apache.starflow.util.HadoopUtils;
import org.apache.starflow.writer.ParquetDataWriterBuilder;
import org.apache.starflow.writer.PartitionedParquetWriter;
import org.apache.starflow.writer.partitioner.WriterPartitioner;


/**
 * Stages star schema tables as Parquet and publishes a run's tables as one unit.
 *
 * <p>
 *   Layout under the base directory {@link ConfigurationKeys#DATA_PUBLISHER_FINAL_DIR}:
 *   <ul>
 *     <li>{@code <table>}: the visible snapshot of a table, read by the query layer</li>
 *     <li>{@code _staging/<run id>/<table>}: a table staged by a run, invisible until published</li>
 *     <li>{@code _backup/<run id>/<table>}: the previous snapshot while a run is being published</li>
 *   </ul>
 *   Names starting with an underscore are ignored by query engines.
 * </p>
 *
 * <p>
 *   Publishing moves each visible table aside and renames the staged table into its place. If any rename fails,
 *   every table already swapped is put back, so readers see either the whole previous snapshot or the whole new
 *   one. {@link #recover()} finishes the same rollback for a publish interrupted by a crash.
 * </p>
 */
@Slf4j
public class StarSchemaPublisher extends DataPublisher {

  public static final String JOURNAL_FILE_NAME = "_PUBLISHING";
  private static final String WRITER_TMP_DIR_NAME = "_tmp";
  private static final String WRITER_ID = "00000";

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  private final FileSystem fs;
  private final boolean ownsFileSystem;
  private final Path baseDir;

  public StarSchemaPublisher(State state) throws IOException {
    this(state, HadoopUtils.getWriterFileSystem(state), true);
  }

  /**
   * A publisher working on a file system owned by the caller, which {@link #close()} leaves open.
   */
  public StarSchemaPublisher(State state, FileSystem fs) {
    this(state, fs, false);
  }

  private StarSchemaPublisher(State state, FileSystem fs, boolean ownsFileSystem) {
    super(state);
    this.fs = fs;
    this.ownsFileSystem = ownsFileSystem;
    String finalDir = state.getProp(ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
    if (finalDir == null) {
      throw new IllegalArgumentException("Missing required property " + ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
    }
    this.baseDir = new Path(finalDir);
  }

  public FileSystem getFileSystem() {
    return this.fs;
  }

  public Path getBaseDir() {
    return this.baseDir;
  }

  public Path getPublishedDir(String table) {
    return new Path(this.baseDir, table);
  }

  public Path getRunStagingDir(String runId) {
    return new Path(new Path(this.baseDir, ConfigurationKeys.DATA_PUBLISHER_STAGING_DIR_NAME), runId);
  }

  public Path getStagedDir(String runId, String table) {
    return new Path(getRunStagingDir(runId), table);
  }

  public Path getRunBackupDir(String runId) {
    return new Path(new Path(this.baseDir, ConfigurationKeys.DATA_PUBLISHER_BACKUP_DIR_NAME), runId);
  }

  /**
   * Write the rows of a table into the run's staging area.
   *
   * @return the state of the staged table, {@link TableState.WorkingState#STAGED}
   * @throws IOException if writing fails, in which case nothing of the table is left in the staging area
   */
  public TableState stage(String runId, RowSet rowSet) throws IOException {
    StarSchemaEntity entity = rowSet.getEntity();
    TableState tableState = new TableState(this.state, entity.getTableName(), runId);
    Path stagedDir = getStagedDir(runId, entity.getTableName());
    tableState.setProp(ConfigurationKeys.WRITER_OUTPUT_DIR, stagedDir.toString());
    tableState.setProp(ConfigurationKeys.WRITER_STAGING_DIR,
        new Path(new Path(getRunStagingDir(runId), WRITER_TMP_DIR_NAME), entity.getTableName()).toString());
    HadoopUtils.deletePath(this.fs, stagedDir, true);

    Optional<WriterPartitioner<GenericRecord>> partitioner = WriterPartitioner.forTable(this.state, entity);
    ParquetDataWriterBuilder builder = new ParquetDataWriterBuilder().withFileSystem(this.fs);
    builder.forTable(tableState).withWriterId(WRITER_ID).withSchema(entity.getSchema());

    Closer closer = Closer.create();
    try {
      PartitionedParquetWriter writer = closer.register(new PartitionedParquetWriter(builder, partitioner));
      try {
        for (GenericRecord row : rowSet.getRows()) {
          writer.write(row);
        }
        writer.commit();
      } catch (IOException | RuntimeException e) {
        tableState.setWorkingState(TableState.WorkingState.FAILED);
        try {
          writer.cleanup();
          HadoopUtils.deletePath(this.fs, stagedDir, true);
        } catch (IOException cleanupFailure) {
          e.addSuppressed(cleanupFailure);
        }
        throw e;
      }
      if (!this.fs.exists(stagedDir) && !this.fs.mkdirs(stagedDir)) {
        throw new IOException("Failed to create " + stagedDir);
      }
      tableState.setProp(ConfigurationKeys.WRITER_RECORDS_WRITTEN, writer.recordsWritten());
      tableState.setProp(ConfigurationKeys.WRITER_BYTES_WRITTEN, writer.bytesWritten());
      tableState.setWorkingState(TableState.WorkingState.STAGED);
      log.info(String.format("Staged %d rows of %s in %d partition(s) under %s", writer.recordsWritten(),
          entity.getTableName(), writer.getPartitionCount(), stagedDir));
    } catch (Throwable t) {
      throw closer.rethrow(t, IOException.class);
    } finally {
      closer.close();
    }
    return tableState;
  }

  /**
   * Write a {@code _SNAPSHOT} manifest into each staged table, so that it is published with the data.
   */
  @Override
  public void publishMetadata(Collection<? extends TableState> states) throws IOException {
    for (TableState tableState : states) {
      checkStaged(tableState);
      StarSchemaEntity entity = StarSchemaEntity.forTableName(tableState.getTableName());
      List<String> files = tableState.contains(ConfigurationKeys.WRITER_FINAL_OUTPUT_FILE_PATHS)
          ? relativeFiles(tableState) : ImmutableList.<String>of();
      TableManifest manifest = new TableManifest(tableState.getTableName(), tableState.getRunId(),
          tableState.getRecordsWritten(), tableState.getPropAsLong(ConfigurationKeys.WRITER_BYTES_WRITTEN, 0L), files,
          Long.toHexString(SchemaNormalization.parsingFingerprint64(entity.getSchema())),
          this.state.getProp(ConfigurationKeys.WRITER_PARTITIONER_PREFIX + entity.getTableName()
              + ConfigurationKeys.WRITER_PARTITIONER_COLUMN_SUFFIX),
          System.currentTimeMillis());
      writeJson(new Path(getStagedDir(tableState.getRunId(), tableState.getTableName()),
          ConfigurationKeys.DATA_PUBLISHER_MANIFEST_FILE_NAME), manifest);
    }
  }

  private List<String> relativeFiles(TableState tableState) {
    String prefix = tableState.getProp(ConfigurationKeys.WRITER_OUTPUT_DIR) + Path.SEPARATOR;
    List<String> files = new ArrayList<>();
    for (String file : tableState.getPropAsSet(ConfigurationKeys.WRITER_FINAL_OUTPUT_FILE_PATHS)) {
      files.add(file.startsWith(prefix) ? file.substring(prefix.length()) : file);
    }
    Collections.sort(files);
    return files;
  }

  /**
   * Swap every staged table into place, all or nothing.
   *
   * @throws PublishFailureException if any table cannot be swapped; the previous snapshot is restored first
   */
  @Override
  public void publishData(Collection<? extends TableState> states) throws IOException {
    if (states.isEmpty()) {
      return;
    }
    String runId = states.iterator().next().getRunId();
    List<String> tables = new ArrayList<>();
    for (TableState tableState : states) {
      checkStaged(tableState);
      if (!runId.equals(tableState.getRunId())) {
        throw new IllegalArgumentException("Cannot publish tables of runs " + runId + " and " + tableState.getRunId());
      }
      tables.add(tableState.getTableName());
    }

    List<String> createdTables = new ArrayList<>();
    for (String table : tables) {
      if (!this.fs.exists(getPublishedDir(table))) {
        createdTables.add(table);
      }
    }
    Path backupDir = getRunBackupDir(runId);
    Path journal = new Path(backupDir, JOURNAL_FILE_NAME);
    writeJson(journal, new PublishJournal(runId, tables, createdTables, System.currentTimeMillis()));

    Deque<String> swapped = new ArrayDeque<>();
    for (String table : tables) {
      try {
        swap(runId, table);
        swapped.push(table);
      } catch (IOException | RuntimeException e) {
        log.error(String.format("Failed to publish %s of run %s, rolling back %d table(s)", table, runId,
            swapped.size() + 1), e);
        swapped.push(table);
        boolean rolledBack = rollback(runId, swapped, createdTables);
        if (rolledBack) {
          deleteWithEmptyParent(backupDir);
        }
        throw new PublishFailureException(String.format("Failed to publish %s of run %s", table, runId), e,
            rolledBack);
      }
    }

    // Deleting the journal commits the publish
    HadoopUtils.deletePath(this.fs, journal, false);
    deleteWithEmptyParent(backupDir);
    deleteWithEmptyParent(getRunStagingDir(runId));
    for (TableState tableState : states) {
      tableState.setWorkingState(TableState.WorkingState.COMMITTED);
      this.state.appendToSetProp(ConfigurationKeys.PUBLISHER_DIRS, getPublishedDir(tableState.getTableName()).toString());
    }
    log.info(String.format("Published %d table(s) of run %s under %s", tables.size(), runId, this.baseDir));
  }

  private void swap(String runId, String table) throws IOException {
    Path published = getPublishedDir(table);
    if (this.fs.exists(published)) {
      HadoopUtils.movePath(this.fs, published, new Path(getRunBackupDir(runId), table));
    }
    HadoopUtils.renamePath(this.fs, getStagedDir(runId, table), published);
  }

  /**
   * Put back the previous snapshot of each table, most recently swapped first.
   *
   * @return true if every table was restored
   */
  private boolean rollback(String runId, Deque<String> tables, Collection<String> createdTables) {
    boolean restoredAll = true;
    for (String table : tables) {
      try {
        restore(runId, table, createdTables.contains(table));
      } catch (IOException ioe) {
        restoredAll = false;
        log.error(String.format("Failed to roll back %s of run %s, it is left for recovery", table, runId), ioe);
      }
    }
    return restoredAll;
  }

  /**
   * Undo the swap of one table. A table with a backup gets it back. A table created by the publish is deleted. Any
   * other table was never moved aside and is left as it is.
   */
  private void restore(String runId, String table, boolean created) throws IOException {
    Path published = getPublishedDir(table);
    Path backup = new Path(getRunBackupDir(runId), table);
    if (this.fs.exists(backup)) {
      HadoopUtils.deletePath(this.fs, published, true);
      HadoopUtils.renamePath(this.fs, backup, published);
    } else if (created) {
      HadoopUtils.deletePath(this.fs, published, true);
    }
  }

  /**
   * Delete everything a run staged. Published tables are untouched.
   */
  public void discard(String runId) throws IOException {
    Path runStagingDir = getRunStagingDir(runId);
    if (this.fs.exists(runStagingDir)) {
      log.info("Discarding staged output of run {}", runId);
      deleteWithEmptyParent(runStagingDir);
    }
  }

  /**
   * Delete a run directory, and the {@code _staging} or {@code _backup} directory holding it once no other run
   * uses it.
   */
  private void deleteWithEmptyParent(Path runDir) throws IOException {
    HadoopUtils.deletePath(this.fs, runDir, true);
    Path parent = runDir.getParent();
    if (this.fs.exists(parent) && this.fs.listStatus(parent).length == 0) {
      HadoopUtils.deletePath(this.fs, parent, true);
    }
  }

  /**
   * Undo any publish that was interrupted before it completed, and remove backups of publishes that completed.
   *
   * @return the ids of the runs whose publish was rolled back
   */
  public List<String> recover() throws IOException {
    Path backupRoot = new Path(this.baseDir, ConfigurationKeys.DATA_PUBLISHER_BACKUP_DIR_NAME);
    List<String> recovered = new ArrayList<>();
    if (!this.fs.exists(backupRoot)) {
      return recovered;
    }
    for (FileStatus runDir : this.fs.listStatus(backupRoot)) {
      String runId = runDir.getPath().getName();
      Path journal = new Path(runDir.getPath(), JOURNAL_FILE_NAME);
      if (this.fs.exists(journal)) {
        PublishJournal publishJournal = readJson(journal, PublishJournal.class);
        log.warn(String.format("Publish of run %s did not complete, restoring %s", runId, publishJournal.getTables()));
        for (String table : publishJournal.getTables()) {
          restore(runId, table, publishJournal.getCreatedTables().contains(table));
        }
        recovered.add(runId);
      }
      HadoopUtils.deletePath(this.fs, runDir.getPath(), true);
    }
    if (this.fs.exists(backupRoot) && this.fs.listStatus(backupRoot).length == 0) {
      HadoopUtils.deletePath(this.fs, backupRoot, true);
    }
    return recovered;
  }

  /**
   * Read the manifest of a published table.
   */
  public Optional<TableManifest> readManifest(String table) throws IOException {
    Path manifest = new Path(getPublishedDir(table), ConfigurationKeys.DATA_PUBLISHER_MANIFEST_FILE_NAME);
    if (!this.fs.exists(manifest)) {
      return Optional.absent();
    }
    return Optional.of(readJson(manifest, TableManifest.class));
  }

  private void checkStaged(TableState tableState) throws IOException {
    if (tableState.getWorkingState() != TableState.WorkingState.STAGED) {
      throw new IllegalStateException(String.format("Table %s of run %s is %s, not STAGED",
          tableState.getTableName(), tableState.getRunId(), tableState.getWorkingState()));
    }
    Path stagedDir = getStagedDir(tableState.getRunId(), tableState.getTableName());
    if (!this.fs.exists(stagedDir)) {
      throw new PublishFailureException("Staged directory " + stagedDir + " does not exist", null);
    }
  }

  private void writeJson(Path path, Object value) throws IOException {
    try (FSDataOutputStream out = this.fs.create(path, true);
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
      GSON.toJson(value, writer);
    }
  }

  private <T> T readJson(Path path, Class<T> clazz) throws IOException {
    try (FSDataInputStream in = this.fs.open(path);
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return GSON.fromJson(reader, clazz);
    }
  }

  @Override
  public void close() throws IOException {
    if (this.ownsFileSystem) {
      this.fs.close();
    }
  }
}
