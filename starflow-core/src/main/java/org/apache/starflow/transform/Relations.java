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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

import org.apache.avro.generic.GenericRecord;

import lombok.AllArgsConstructor;
import lombok.Getter;

import org.apache.starflow.schema.RecordKey;


/**
 * Relational operators over in-memory row lists.
 *
 * <p>
 *   Every operator preserves the order of its left (or only) input, so a pipeline of these operators is
 *   deterministic given ordered inputs. Keys containing a null never match anything.
 * </p>
 */
public class Relations {

  private Relations() {
  }

  /**
   * A row of a join: the left row and the right row it matched, or null for an unmatched left outer row.
   */
  @Getter
  @AllArgsConstructor
  public static class Joined<L, R> {
    private final L left;
    private final R right;
  }

  /**
   * Build a hash index of rows on the given key fields. If two rows share a key the first one is indexed.
   * Rows with a null in the key are not indexed.
   */
  public static Map<RecordKey, GenericRecord> index(List<GenericRecord> rows, List<String> keyFields) {
    Map<RecordKey, GenericRecord> index = new LinkedHashMap<>();
    for (GenericRecord row : rows) {
      RecordKey key = RecordKey.of(row, keyFields);
      if (!key.hasNull()) {
        index.putIfAbsent(key, row);
      }
    }
    return Collections.unmodifiableMap(index);
  }

  /**
   * Join every left row to the indexed right row with the same key. Left rows without a match are dropped and
   * handed to <code>unmatched</code>.
   */
  public static <L, R> List<Joined<L, R>> innerJoin(List<L> left, Function<? super L, RecordKey> leftKey,
      Map<RecordKey, R> rightIndex, Consumer<? super L> unmatched) {
    List<Joined<L, R>> joined = new ArrayList<>(left.size());
    for (L row : left) {
      R match = lookup(rightIndex, leftKey.apply(row));
      if (match == null) {
        unmatched.accept(row);
      } else {
        joined.add(new Joined<>(row, match));
      }
    }
    return joined;
  }

  /**
   * Join every left row to the indexed right row with the same key, keeping left rows without a match with a
   * null right side. The output has exactly one row per left row.
   */
  public static <L, R> List<Joined<L, R>> leftJoin(List<L> left, Function<? super L, RecordKey> leftKey,
      Map<RecordKey, R> rightIndex) {
    List<Joined<L, R>> joined = new ArrayList<>(left.size());
    for (L row : left) {
      joined.add(new Joined<>(row, lookup(rightIndex, leftKey.apply(row))));
    }
    return joined;
  }

  /**
   * Keep the first row of each key. Every later row with an already seen key is passed to
   * <code>onDuplicate</code> together with the row that was kept. Rows with a null in the key are dropped.
   */
  public static <T> List<T> distinctByKey(List<T> rows, Function<? super T, RecordKey> key,
      BiConsumer<? super T, ? super T> onDuplicate) {
    Map<RecordKey, T> firsts = new LinkedHashMap<>();
    for (T row : rows) {
      RecordKey rowKey = key.apply(row);
      if (rowKey.hasNull()) {
        continue;
      }
      T kept = firsts.putIfAbsent(rowKey, row);
      if (kept != null) {
        onDuplicate.accept(kept, row);
      }
    }
    return new ArrayList<>(firsts.values());
  }

  private static <R> R lookup(Map<RecordKey, R> index, RecordKey key) {
    return key.hasNull() ? null : index.get(key);
  }
}
