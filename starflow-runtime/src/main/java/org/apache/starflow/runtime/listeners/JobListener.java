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

package org.apache.starflow.runtime.listeners;

import org.apache.starflow.runtime.JobContext;


/**
 * Receives run lifecycle events. Exactly one of the completion, cancellation and failure callbacks is called for
 * a run that started.
 *
 * <p>
 *   A listener that throws does not change the outcome of the run: the launcher logs the exception and moves on
 *   to the next listener.
 * </p>
 */
public interface JobListener {

  /**
   * Called after the job lock was acquired, before extraction starts.
   */
  void onJobStart(JobContext jobContext)
      throws Exception;

  /**
   * Called after a new snapshot was published. {@link JobContext#getOutcome()} is set.
   */
  void onJobCompletion(JobContext jobContext)
      throws Exception;

  /**
   * Called after a cancelled run discarded its staged output.
   */
  void onJobCancellation(JobContext jobContext)
      throws Exception;

  /**
   * Called after a failed run discarded its staged output.
   */
  void onJobFailure(JobContext jobContext)
      throws Exception;
}
