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

import net.hydromatic.questcli.format.OutputFormat;
import net.hydromatic.questcli.util.TestUtils;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link MetaCommandDispatcher}.
 */
public class MetaCommandDispatcherTest {
  private final TestUtils.Capture out = new TestUtils.Capture();
  private final TestUtils.Capture err = new TestUtils.Capture();
  private final List<String> queries = new ArrayList<>();
  private Connection connection;
  private SessionState state;
  private MetaCommandDispatcher dispatcher;

  @BeforeEach void setUp() throws SQLException {
    connection = TestUtils.connect();
    state = new SessionState(connection, OutputFormat.TABLE,
        new SqlCompleter());
    final QueryExecutor executor =
        new QueryExecutor(connection, out.pw, err.pw);
    dispatcher = new MetaCommandDispatcher(state,
        new MetaCommandDispatcher.QueryRunner() {
          public QueryStatus run(String sql) {
            queries.add(sql);
            return QueryStatus.COMPLETED;
          }

          public void refreshTables() throws SQLException {
            state.completer().refresh(executor);
          }
        }, out.pw, err.pw);
  }

  @AfterEach void tearDown() {
    state.close();
  }

  @Test void testFormatRoundTrip() {
    dispatcher.dispatch("\\format csv");
    assertThat(state.format(), is(OutputFormat.CSV));
    assertThat(out.text(), is("Output format set to csv\n"));
    dispatcher.dispatch("\\format");
    assertThat(out.text(), containsString("Current format: csv\n"));
    assertThat(out.text(),
        containsString(
            "Available formats: table, csv, json, vertical, record\n"));
    assertThat(err.text(), is(""));
  }

  @Test void testFormatCaseInsensitive() {
    dispatcher.dispatch("\\format   JSON  ");
    assertThat(state.format(), is(OutputFormat.JSON));
  }

  /** An invalid format is reported, and the current format is kept. */
  @Test void testFormatInvalid() {
    dispatcher.dispatch("\\format vertical");
    dispatcher.dispatch("\\format xml");
    assertThat(state.format(), is(OutputFormat.VERTICAL));
    assertThat(err.text(), startsWith("Invalid format: xml\n"));
    assertThat(err.text(), containsString("Available formats: "));
  }

  @Test void testListTables() {
    dispatcher.dispatch("\\dt");
    dispatcher.dispatch("\\dwal");
    assertThat(queries,
        is(ImmutableList.of(MetaCommandDispatcher.LIST_TABLES_SQL,
            MetaCommandDispatcher.LIST_WAL_TABLES_SQL)));
  }

  @Test void testStorage() {
    dispatcher.dispatch("\\dstorage trades");
    dispatcher.dispatch("\\dstorage it's");
    assertThat(queries,
        is(ImmutableList.of("SELECT * FROM table_storage('trades')",
            "SELECT * FROM table_storage('it''s')")));
  }

  /** "\dstorage" without a table name prints usage and issues no query. */
  @Test void testStorageWithoutTable() {
    dispatcher.dispatch("\\dstorage");
    dispatcher.dispatch("\\dstorage   ");
    assertThat(queries.isEmpty(), is(true));
    assertThat(err.text(),
        is("Usage: \\dstorage <table>\nUsage: \\dstorage <table>\n"));
  }

  /** A command is recognized only if its token matches exactly. */
  @Test void testUnknown() {
    dispatcher.dispatch("\\foo bar");
    dispatcher.dispatch("\\dtx");
    dispatcher.dispatch("\\q");
    assertThat(queries.isEmpty(), is(true));
    assertThat(err.text(),
        is("Unknown meta command: \\foo bar\n"
            + "Unknown meta command: \\dtx\n"
            + "Unknown meta command: \\q\n"));
  }

  @Test void testHelp() {
    dispatcher.dispatch("\\help");
    final String s = out.text();
    assertThat(s, startsWith("Meta commands:\n"));
    for (MetaCommand command : MetaCommand.values()) {
      assertThat(s, containsString(command.token));
    }
    assertThat(s, containsString("\\dstorage <table>"));
  }

  @Test void testRefresh() throws SQLException {
    try (Statement statement = connection.createStatement()) {
      statement.execute("CREATE SCHEMA \"public\"");
      statement.execute("CREATE TABLE \"public\".\"trades\" (x INT)");
    }
    dispatcher.dispatch("\\refresh");
    assertThat(out.text(),
        is("Refreshing metadata...\nMetadata refreshed.\n"));
    assertThat(state.completer().tables(), is(ImmutableList.of("trades")));
  }

  /** If refresh fails, the error is reported and the cached names are
   * kept. */
  @Test void testRefreshFailure() throws SQLException {
    state.completer().setTables(ImmutableList.of("trades"));
    connection.close();
    dispatcher.dispatch("\\refresh");
    assertThat(out.text(), not(containsString("Metadata refreshed.")));
    assertThat(err.text(), startsWith("Failed to refresh metadata: "));
    assertThat(state.completer().tables(), is(ImmutableList.of("trades")));
  }
}

// End MetaCommandDispatcherTest.java
