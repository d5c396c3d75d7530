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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link History}.
 */
public class HistoryTest {
  @TempDir File tempDir;

  @Test void testMissingFile() throws IOException {
    final History history = new History(new File(tempDir, "none.txt"));
    history.load();
    assertThat(history.loaded(), is(ImmutableList.of()));
    assertThat(history.entries(), is(ImmutableList.of()));
  }

  @Test void testSaveAndLoad() throws IOException {
    final File file = new File(tempDir, "a/b/history.txt");
    final History history = new History(file);
    history.load();
    history.add("SELECT 1");
    history.add("\\dt");
    history.save();
    assertThat(file.isFile(), is(true));

    final History history2 = new History(file);
    history2.load();
    history2.add("SELECT 'é'");
    assertThat(history2.loaded(), is(ImmutableList.of("SELECT 1", "\\dt")));
    history2.save();
    assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8),
        is(ImmutableList.of("SELECT 1", "\\dt", "SELECT 'é'")));
  }

  /** Saving appends; bytes already in the file are kept as they were, even
   * if they are not valid UTF-8. */
  @Test void testSaveKeepsExistingBytes() throws IOException {
    final File file = new File(tempDir, "history.txt");
    final byte[] old = {'c', 'a', 'f', (byte) 0xE9, '\n'};
    Files.write(file.toPath(), old);
    final History history = new History(file);
    history.load();
    history.add("x");
    history.save();
    final byte[] expected = {'c', 'a', 'f', (byte) 0xE9, '\n', 'x', '\n'};
    assertThat(Files.readAllBytes(file.toPath()), is(expected));
  }

  /** If the last line has no line break, one is added before the new
   * entries. */
  @Test void testSaveAfterUnterminatedLine() throws IOException {
    final File file = new File(tempDir, "history.txt");
    Files.write(file.toPath(), "a".getBytes(StandardCharsets.UTF_8));
    final History history = new History(file);
    history.load();
    assertThat(history.loaded(), is(ImmutableList.of("a")));
    history.add("b");
    history.save();
    assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8),
        is(ImmutableList.of("a", "b")));
  }

  /** A session that entered nothing leaves the file untouched, and one whose
   * load failed does not overwrite it. */
  @Test void testSaveWithoutLoad() throws IOException {
    final File file = new File(tempDir, "history.txt");
    Files.write(file.toPath(), ImmutableList.of("old"),
        StandardCharsets.UTF_8);
    final long modified = file.lastModified();
    new History(file).save();
    assertThat(file.lastModified(), is(modified));

    final History history = new History(file);
    history.add("new");
    history.save();
    assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8),
        is(ImmutableList.of("old", "new")));
  }

  @Test void testExpand() {
    final String home = System.getProperty("user.home");
    assertThat(History.expand("~"), is(new File(home)));
    assertThat(History.expand("~/.questcli/history.txt"),
        is(new File(home, ".questcli/history.txt")));
    assertThat(History.expand("history.txt"), is(new File("history.txt")));
    assertThat(History.expand("/tmp/~x"), is(new File("/tmp/~x")));
    assertThat(History.of("~/h.txt").file(), is(new File(home, "h.txt")));
  }
}

// End HistoryTest.java
