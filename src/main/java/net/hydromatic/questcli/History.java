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

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSink;
import com.google.common.io.FileWriteMode;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Lines that the user has entered, in this session and previous ones.
 *
 * <p>The file holds one entry per line, in UTF-8. It is read once, by
 * {@link #load()}. {@link #save()} appends the entries added in this
 * session and never rewrites what was already there, so the file survives
 * intact even if it could not be loaded or holds bytes that are not valid
 * UTF-8. */
public class History {
  private final File file;
  private ImmutableList<String> loaded = ImmutableList.of();
  private final List<String> added = new ArrayList<>();

  public History(File file) {
    this.file = requireNonNull(file, "file");
  }

  /** Creates a history for a path, expanding a leading "~" to the user's
   * home directory. */
  public static History of(String path) {
    return new History(expand(path));
  }

  /** Expands a leading "~" in a path to the user's home directory. */
  static File expand(String path) {
    if (path.equals("~")) {
      return new File(System.getProperty("user.home"));
    }
    if (path.startsWith("~/") || path.startsWith("~" + File.separator)) {
      return new File(System.getProperty("user.home"), path.substring(2));
    }
    return new File(path);
  }

  public File file() {
    return file;
  }

  /** Reads the file. A missing file is the same as an empty one.
   *
   * @throws IOException if the file exists but cannot be read
   */
  public void load() throws IOException {
    if (!file.exists()) {
      loaded = ImmutableList.of();
      return;
    }
    loaded = ImmutableList.copyOf(
        Files.asCharSource(file, StandardCharsets.UTF_8).readLines());
  }

  /** Appends an entry. */
  public synchronized void add(String line) {
    added.add(requireNonNull(line, "line"));
  }

  /** Returns all entries, oldest first. */
  public synchronized ImmutableList<String> entries() {
    return ImmutableList.<String>builder()
        .addAll(loaded)
        .addAll(added)
        .build();
  }

  /** Returns the entries that were read by {@link #load()}. */
  public ImmutableList<String> loaded() {
    return loaded;
  }

  /** Appends the entries added in this session to the file, creating it if
   * necessary. Does nothing if there are none. */
  public void save() throws IOException {
    final List<String> lines;
    synchronized (this) {
      lines = ImmutableList.copyOf(added);
    }
    if (lines.isEmpty()) {
      return;
    }
    final File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists()) {
      Files.createParentDirs(file.getAbsoluteFile());
    }
    final CharSink sink =
        Files.asCharSink(file, StandardCharsets.UTF_8, FileWriteMode.APPEND);
    if (!endsWithNewline()) {
      sink.write("\n");
    }
    sink.writeLines(lines, "\n");
  }

  /** Returns whether the file is missing, empty, or ends with a line
   * break. */
  private boolean endsWithNewline() throws IOException {
    final long length = file.isFile() ? file.length() : 0L;
    if (length == 0) {
      return true;
    }
    final byte[] last = Files.asByteSource(file).slice(length - 1, 1).read();
    return last.length == 1 && last[0] == '\n';
  }
}

// End History.java
