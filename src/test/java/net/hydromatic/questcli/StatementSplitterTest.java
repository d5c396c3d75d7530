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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link StatementSplitter}.
 */
public class StatementSplitterTest {
  @Test void testSplit() {
    assertThat(StatementSplitter.split("select 1; select 2;"),
        is(ImmutableList.of("select 1", "select 2")));
    assertThat(StatementSplitter.split("select 1"),
        is(ImmutableList.of("select 1")));
    assertThat(StatementSplitter.split("\n  select 1 ;\n\n  select 2\n"),
        is(ImmutableList.of("select 1", "select 2")));
  }

  @Test void testEmpty() {
    assertThat(StatementSplitter.split(""), is(ImmutableList.of()));
    assertThat(StatementSplitter.split(" ;; \n ; "), is(ImmutableList.of()));
    assertThat(StatementSplitter.split("-- nothing here\n/* or here */;"),
        is(ImmutableList.of()));
  }

  /** Semicolons in strings, quoted identifiers and comments do not end a
   * statement. */
  @Test void testQuoted() {
    assertThat(StatementSplitter.split("select 'a;b'; select 2"),
        is(ImmutableList.of("select 'a;b'", "select 2")));
    assertThat(StatementSplitter.split("select 'it''s;' from \"x;y\";"),
        is(ImmutableList.of("select 'it''s;' from \"x;y\"")));
    assertThat(StatementSplitter.split("select 1 -- one; two\n;select 2"),
        is(ImmutableList.of("select 1 -- one; two", "select 2")));
    assertThat(StatementSplitter.split("select /* ; */ 1; select 2"),
        is(ImmutableList.of("select /* ; */ 1", "select 2")));
  }

  /** An unterminated string extends to the end of the script. */
  @Test void testUnterminated() {
    assertThat(StatementSplitter.split("select 'a; select 2"),
        is(ImmutableList.of("select 'a; select 2")));
  }
}

// End StatementSplitterTest.java
