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

package org.apache.starflow.runtime.locks;

import java.io.IOException;

import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;
import org.apache.starflow.util.HadoopUtils;


/**
 * A {@link JobLock} that relies on atomic creation of a new file on the output file system.
 *
 * <p>
 *   Acquiring the lock creates the empty file {@code <job.lock.dir>/<job.name>.lock}, releasing it deletes that file.
 *   The lock directory defaults to {@code _locks} under the published output directory, so runs that write to the
 *   same location contend for the same file. Only the instance that created the file deletes it.
 * </p>
 */
@Slf4j
public class FileBasedJobLock implements JobLock {

  public static final String LOCK_FILE_EXTENSION = ".lock";
  public static final String DEFAULT_LOCK_DIR_NAME = "_locks";

  private final FileSystem fs;
  // Empty file associated with the lock
  private final Path lockFile;
  private volatile boolean held = false;

  public FileBasedJobLock(State state) throws JobLockException {
    try {
      this.fs = HadoopUtils.getWriterFileSystem(state);
    } catch (IOException e) {
      throw new JobLockException(e);
    }
    this.lockFile = getLockFile(state);
  }

  /**
   * A lock on a file system owned by the caller.
   */
  public FileBasedJobLock(FileSystem fs, Path lockFile) {
    this.fs = fs;
    this.lockFile = lockFile;
  }

  /**
   * @return the lock file for the job described by {@code state}
   */
  public static Path getLockFile(State state) {
    String jobName = state.getProp(ConfigurationKeys.JOB_NAME_KEY, ConfigurationKeys.DEFAULT_JOB_NAME);
    String lockDir = state.getProp(ConfigurationKeys.JOB_LOCK_DIR_KEY);
    if (lockDir == null) {
      String finalDir = state.getProp(ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR);
      if (finalDir == null) {
        throw new IllegalArgumentException(String.format("Missing required property %s or %s",
            ConfigurationKeys.JOB_LOCK_DIR_KEY, ConfigurationKeys.DATA_PUBLISHER_FINAL_DIR));
      }
      lockDir = new Path(finalDir, DEFAULT_LOCK_DIR_NAME).toString();
    }
    return new Path(lockDir, jobName + LOCK_FILE_EXTENSION);
  }

  public Path getLockFile() {
    return this.lockFile;
  }

  @Override
  public void lock() throws JobLockException {
    if (!tryLock()) {
      throw new JobLockException("Failed to create lock file " + this.lockFile + ": another run holds the lock");
    }
  }

  @Override
  public void unlock() throws JobLockException {
    if (!this.held) {
      return;
    }

    try {
      if (!this.fs.delete(this.lockFile, false)) {
        log.warn("Lock file {} was already gone on release", this.lockFile);
      }
      this.held = false;
    } catch (IOException e) {
      throw new JobLockException("Failed to delete lock file " + this.lockFile, e);
    }
  }

  @Override
  public boolean tryLock() throws JobLockException {
    try {
      if (this.fs.createNewFile(this.lockFile)) {
        this.held = true;
        log.info("Acquired job lock {}", this.lockFile);
      }
      return this.held;
    } catch (IOException e) {
      throw new JobLockException("Failed to create lock file " + this.lockFile, e);
    }
  }

  @Override
  public boolean isLocked() throws JobLockException {
    try {
      return this.fs.exists(this.lockFile);
    } catch (IOException e) {
      throw new JobLockException(e);
    }
  }

  /**
   * Releases the lock if it is still held. The file system is shared and stays open.
   */
  @Override
  public void close() throws IOException {
    try {
      unlock();
    } catch (JobLockException e) {
      throw new IOException(e);
    }
  }
}
