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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/** Source of lines typed by the user.
 *
 * @see JLineLineSource */
public interface LineSource {
  /** Blocks until the user has entered a line.
   *
   * @param prompt Prompt to display
   * @return the line, or null if there is no more input
   * @throws InterruptedLineException if the user pressed Ctrl-C while
   * typing
   * @throws IOException if input could not be read
   */
  @Nullable String readLine(String prompt)
      throws InterruptedLineException, IOException;

  /** Makes previously entered lines available for recall. */
  default void addHistory(Iterable<String> lines) {
  }

  /** Thrown by {@link #readLine} if the user interrupted input. */
  class InterruptedLineException extends Exception {
    public InterruptedLineException() {
      super();
    }
  }
}

// End LineSource.java
