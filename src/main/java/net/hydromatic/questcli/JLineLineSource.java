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
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.IOError;
import java.io.IOException;

import static java.util.Objects.requireNonNull;

/** Implementation of {@link LineSource} that reads from a terminal using
 * JLine, with line editing, recall, and completion. */
class JLineLineSource implements LineSource {
  private final LineReader reader;

  JLineLineSource(LineReader reader) {
    this.reader = requireNonNull(reader, "reader");
  }

  @Override public @Nullable String readLine(String prompt)
      throws InterruptedLineException, IOException {
    try {
      return reader.readLine(prompt);
    } catch (UserInterruptException e) {
      throw new InterruptedLineException();
    } catch (EndOfFileException e) {
      return null;
    } catch (IOError e) {
      throw new IOException("Error reading from terminal", e);
    }
  }

  @Override public void addHistory(Iterable<String> lines) {
    final History history = reader.getHistory();
    for (String line : lines) {
      history.add(line);
    }
  }
}

// End JLineLineSource.java
