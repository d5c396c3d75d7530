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

import java.io.PrintWriter;
import java.sql.SQLException;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/** Interprets meta-commands such as {@code \dt} and {@code \format csv}.
 *
 * <p>{@link MetaCommand#QUIT} is handled by the {@link Repl} and never
 * reaches the dispatcher. Commands that need a query hand it to a
 * {@link QueryRunner}, so that it is executed (and can be cancelled) the same
 * way as a statement the user typed. {@code \refresh} goes through the
 * runner too. */
public class MetaCommandDispatcher {
  static final String LIST_TABLES_SQL = "SELECT * FROM tables()";
  static final String LIST_WAL_TABLES_SQL = "SELECT * FROM wal_tables()";

  private final SessionState state;
  private final QueryRunner runner;
  private final PrintWriter out;
  private final PrintWriter err;

  public MetaCommandDispatcher(SessionState state, QueryRunner runner,
      PrintWriter out, PrintWriter err) {
    this.state = requireNonNull(state, "state");
    this.runner = requireNonNull(runner, "runner");
    this.out = requireNonNull(out, "out");
    this.err = requireNonNull(err, "err");
  }

  /** Executes a meta-command. Returns when the command, including any query
   * it issues, has finished.
   *
   * @param line Trimmed line that starts with a backslash
   */
  public void dispatch(String line) {
    final String[] words = line.trim().split("\\s+", 2);
    final String token = words[0];
    final String arg = words.length > 1 ? words[1].trim() : "";
    final MetaCommand command = MetaCommand.lookup(token);
    if (command == null || command == MetaCommand.QUIT) {
      err.println("Unknown meta command: " + line);
      err.flush();
      return;
    }
    switch (command) {
    case HELP:
      out.println("Meta commands:");
      for (MetaCommand c : MetaCommand.values()) {
        out.println(c.helpLine());
      }
      break;
    case LIST_TABLES:
      runner.run(LIST_TABLES_SQL);
      break;
    case LIST_WAL_TABLES:
      runner.run(LIST_WAL_TABLES_SQL);
      break;
    case STORAGE_INFO:
      if (arg.isEmpty()) {
        err.println("Usage: \\dstorage <table>");
      } else {
        runner.run(storageSql(arg));
      }
      break;
    case REFRESH:
      refresh();
      break;
    case FORMAT:
      format(arg);
      break;
    default:
      throw new AssertionError(command);
    }
    out.flush();
    err.flush();
  }

  private void refresh() {
    out.println("Refreshing metadata...");
    try {
      runner.refreshTables();
      out.println("Metadata refreshed.");
    } catch (SQLException e) {
      err.println("Failed to refresh metadata: " + e.getMessage());
    }
  }

  private void format(String name) {
    if (name.isEmpty()) {
      out.println("Current format: " + state.format().displayName());
      out.println("Available formats: " + OutputFormat.displayNames());
      return;
    }
    final Optional<OutputFormat> format = OutputFormat.lookup(name);
    if (format.isPresent()) {
      state.setFormat(format.get());
      out.println("Output format set to " + format.get().displayName());
    } else {
      err.println("Invalid format: " + name);
      err.println("Available formats: " + OutputFormat.displayNames());
    }
  }

  /** Returns the query that describes the storage of a table. */
  static String storageSql(String table) {
    return "SELECT * FROM table_storage('" + table.replace("'", "''") + "')";
  }

  /** Executes queries on behalf of meta-commands. */
  public interface QueryRunner {
    /** Executes a statement and prints its results. */
    QueryStatus run(String sql);

    /** Reloads the table names that the completer offers.
     *
     * @throws SQLException if the table names could not be fetched, including
     * if the fetch was cancelled; the completer keeps its previous names */
    void refreshTables() throws SQLException;
  }
}

// End MetaCommandDispatcher.java
