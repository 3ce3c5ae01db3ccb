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


/**
 * Thrown when staged output cannot be made visible. By the time this is thrown every table touched by the failed
 * publish has been restored to its previous snapshot, unless {@link #isRolledBack()} says otherwise.
 */
public class PublishFailureException extends IOException {

  private static final long serialVersionUID = 2920117351426839051L;

  private final boolean rolledBack;

  public PublishFailureException(String message, Throwable cause, boolean rolledBack) {
    super(message, cause);
    this.rolledBack = rolledBack;
  }

  public PublishFailureException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public boolean isRolledBack() {
    return this.rolledBack;
  }
}
