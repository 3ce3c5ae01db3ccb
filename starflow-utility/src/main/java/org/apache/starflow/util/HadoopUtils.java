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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileAlreadyExistsException;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.PathFilter;

import org.apache.starflow.configuration.ConfigurationKeys;
import org.apache.starflow.configuration.State;


/**
 * A utility class for working with Hadoop.
 */
public class HadoopUtils {

  /**
   * Skips the hidden files ({@code _SNAPSHOT}, {@code _SUCCESS}) and checksum files ({@code .part.crc}) the local
   * file system writes next to the data files.
   */
  public static final PathFilter DATA_FILE_FILTER = new PathFilter() {
    @Override
    public boolean accept(Path path) {
      String name = path.getName();
      return !name.startsWith("_") && !name.startsWith(".");
    }
  };

  private HadoopUtils() {
  }

  public static Configuration newConfiguration() {
    Configuration conf = new Configuration();
    // Handles are not shared through the FileSystem cache, each caller closes its own
    conf.setBoolean("fs.file.impl.disable.cache", true);
    return conf;
  }

  /**
   * Get the {@link FileSystem} the writer and publisher use, configured by
   * {@link ConfigurationKeys#WRITER_FILE_SYSTEM_URI}.
   */
  public static FileSystem getWriterFileSystem(State state) throws IOException {
    URI uri = URI.create(state.getProp(ConfigurationKeys.WRITER_FILE_SYSTEM_URI, ConfigurationKeys.LOCAL_FS_URI));
    return FileSystem.get(uri, getConfFromState(state));
  }

  /**
   * Get a {@link Configuration} with every property of the {@link State} copied in.
   */
  public static Configuration getConfFromState(State state) {
    Configuration conf = newConfiguration();
    for (String propName : state.getPropertyNames()) {
      conf.set(propName, state.getProp(propName));
    }
    return conf;
  }

  /**
   * List the data files under <code>path</code> recursively, skipping hidden and checksum files.
   */
  public static List<FileStatus> listDataFilesRecursive(FileSystem fileSystem, Path path) throws IOException {
    List<FileStatus> results = new ArrayList<>();
    walk(results, fileSystem, path);
    return results;
  }

  private static void walk(List<FileStatus> results, FileSystem fileSystem, Path path) throws IOException {
    for (FileStatus status : fileSystem.listStatus(path, DATA_FILE_FILTER)) {
      if (status.isDirectory()) {
        walk(results, fileSystem, status.getPath());
      } else {
        results.add(status);
      }
    }
  }

  /**
   * A wrapper around {@link FileSystem#delete(Path, boolean)} which throws {@link IOException} if the given
   * {@link Path} exists, and {@link FileSystem#delete(Path, boolean)} returns False.
   */
  public static void deletePath(FileSystem fs, Path f, boolean recursive) throws IOException {
    if (fs.exists(f) && !fs.delete(f, recursive)) {
      throw new IOException("Failed to delete: " + f);
    }
  }

  /**
   * A wrapper around {@link FileSystem#rename(Path, Path)} which throws {@link IOException} if
   * {@link FileSystem#rename(Path, Path)} returns False.
   */
  public static void renamePath(FileSystem fs, Path oldName, Path newName) throws IOException {
    if (!fs.exists(oldName)) {
      throw new FileNotFoundException(String.format("Failed to rename %s to %s: src not found", oldName, newName));
    }
    if (fs.exists(newName)) {
      throw new FileAlreadyExistsException(
          String.format("Failed to rename %s to %s: dst already exists", oldName, newName));
    }
    if (!fs.rename(oldName, newName)) {
      throw new IOException(String.format("Failed to rename %s to %s", oldName, newName));
    }
  }

  /**
   * Rename <code>oldName</code> to <code>newName</code>, creating the parent of <code>newName</code> first.
   */
  public static void movePath(FileSystem fs, Path oldName, Path newName) throws IOException {
    Path parent = newName.getParent();
    if (parent != null && !fs.exists(parent) && !fs.mkdirs(parent)) {
      throw new IOException("Failed to create directory " + parent);
    }
    renamePath(fs, oldName, newName);
  }
}
