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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;


/**
 * Two customers sharing a postal code but disagreeing on its city, state or country. The location dimension
 * keeps the first tuple in extraction order.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class LocationConflict {

  private final String postalCode;
  private final String kept;
  private final String discarded;
  /** Rendered key of the customer whose location was discarded. */
  private final String customerKey;

  @Override
  public String toString() {
    return String.format("postal code %s: kept %s, discarded %s from %s", this.postalCode, this.kept,
        this.discarded, this.customerKey);
  }
}
