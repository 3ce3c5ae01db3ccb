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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.avro.generic.GenericRecord;

import com.google.common.base.Joiner;

import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * The values of a set of fields of a record, used as a join and uniqueness key.
 *
 * <p>
 *   Equality only considers the values, so a foreign key and the primary key it references compare equal even when
 *   the field names differ. {@link CharSequence} values are normalized to {@link String} so that keys built
 *   from Avro {@code Utf8} values and keys built from Java strings compare equal.
 * </p>
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RecordKey {

  private static final Joiner KEY_JOINER = Joiner.on(",").useForNull("null");

  private final List<String> fields;
  @EqualsAndHashCode.Include
  private final List<Object> values;

  private RecordKey(List<String> fields, List<Object> values) {
    this.fields = fields;
    this.values = values;
  }

  public static RecordKey of(GenericRecord record, List<String> fields) {
    List<Object> values = new ArrayList<>(fields.size());
    for (String field : fields) {
      values.add(normalize(record.get(field)));
    }
    return new RecordKey(Collections.unmodifiableList(fields), Collections.unmodifiableList(values));
  }

  /**
   * @return true if any of the key values is null, in which case the key cannot take part in a join.
   */
  public boolean hasNull() {
    return this.values.contains(null);
  }

  private static Object normalize(Object value) {
    return value instanceof CharSequence ? value.toString() : value;
  }

  @Override
  public String toString() {
    if (this.fields.size() == 1) {
      return this.fields.get(0) + "=" + this.values.get(0);
    }
    return "(" + KEY_JOINER.join(this.fields) + ")=(" + KEY_JOINER.join(this.values) + ")";
  }
}
