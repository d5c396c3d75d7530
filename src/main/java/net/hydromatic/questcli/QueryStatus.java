/*
 * Licensed to Julian Hyde under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.questcli;

/** How the execution of a statement ended.
 *
 * @see QueryExecutor */
public enum QueryStatus {
  /** The statement ran to completion; all of its rows were printed. */
  COMPLETED,

  /** The statement, or the reading of one of its rows, failed. The error has
   * been reported. */
  FAILED,

  /** The statement was cancelled at the user's request. Not an error. */
  CANCELLED
}

// End QueryStatus.java
