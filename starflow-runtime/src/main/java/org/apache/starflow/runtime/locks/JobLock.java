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

import java.io.Closeable;


/**
 * Claims the exclusive right to run a job, so that no more than one run of a job writes to
 * its output location at any time.
 */
public interface JobLock extends Closeable {

  /**
   * Acquire the lock.
   *
   * @throws JobLockException if the lock is held elsewhere or cannot be acquired
   */
  void lock()
      throws JobLockException;

  /**
   * Release the lock if this instance holds it.
   *
   * @throws JobLockException thrown if the lock fails to be released
   */
  void unlock()
      throws JobLockException;

  /**
   * Try locking the lock.
   *
   * @return <em>true</em> if the lock was acquired, <em>false</em> if it is held elsewhere
   * @throws JobLockException thrown if the state of the lock cannot be determined
   */
  boolean tryLock()
      throws JobLockException;

  /**
   * @return whether anyone holds the lock
   * @throws JobLockException thrown if checking the status of the lock fails
   */
  boolean isLocked()
      throws JobLockException;
}
