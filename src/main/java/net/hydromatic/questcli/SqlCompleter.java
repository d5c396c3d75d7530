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

import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/** Suggests completions for a partially typed line.
 *
 * <p>Candidates come from three sources: SQL keywords, meta-command tokens,
 * and the names of tables in the database. Keywords match
 * case-insensitively; meta-commands and table names match exactly as typed,
 * because table names may be case-sensitive identifiers.
 *
 * <p>The list of table names is a snapshot that is replaced, never
 * modified, by {@link #refresh}; readers on other threads see either the old
 * or the new list. */
public class SqlCompleter {
  static final ImmutableList<String> KEYWORDS =
      ImmutableList.of("SELECT", "FROM", "WHERE", "INSERT", "UPDATE",
          "DELETE", "LIMIT", "JOIN", "ON", "AND", "OR", "NOT", "AS", "INTO",
          "VALUES", "CREATE", "TABLE", "DROP", "ALTER", "ORDER", "GROUP",
          "BY", "SAMPLE", "LATEST", "PARTITION", "TIMESTAMP");

  static final String TABLE_NAMES_SQL = "SELECT table_name "
      + "FROM information_schema.tables "
      + "WHERE table_schema = 'public'";

  private final ImmutableList<String> keywords;
  private final ImmutableList<String> metaCommands;
  private volatile ImmutableList<String> tables = ImmutableList.of();

  public SqlCompleter() {
    this(KEYWORDS, MetaCommand.tokens());
  }

  SqlCompleter(Iterable<String> keywords, Iterable<String> metaCommands) {
    this.keywords = ImmutableList.copyOf(keywords);
    this.metaCommands = ImmutableList.copyOf(metaCommands);
  }

  /** Returns the cached table names. */
  public ImmutableList<String> tables() {
    return tables;
  }

  /** Replaces the cached table names. */
  public void setTables(Iterable<String> tables) {
    this.tables = ImmutableList.copyOf(tables);
  }

  /** Re-reads table names from the database.
   *
   * @throws SQLException if the names could not be read; the previously
   * cached names are kept
   */
  public void refresh(QueryExecutor executor) throws SQLException {
    setTables(executor.fetchStrings(TABLE_NAMES_SQL));
  }

  /** Computes completions for the word that ends at the cursor.
   *
   * @param line Line typed so far
   * @param cursor Cursor position, 0 &le; cursor &le; line length
   */
  public Completion complete(String line, int cursor) {
    requireNonNull(line, "line");
    int start = cursor;
    while (start > 0 && !Character.isWhitespace(line.charAt(start - 1))) {
      --start;
    }
    final String word = line.substring(start, cursor);
    final String upperWord = word.toUpperCase(Locale.ROOT);
    final ImmutableList.Builder<String> candidates = ImmutableList.builder();
    for (String keyword : keywords) {
      if (keyword.startsWith(upperWord)) {
        candidates.add(keyword);
      }
    }
    for (String metaCommand : metaCommands) {
      if (metaCommand.startsWith(word)) {
        candidates.add(metaCommand);
      }
    }
    for (String table : tables) {
      if (table.startsWith(word)) {
        candidates.add(table);
      }
    }
    return new Completion(start, candidates.build());
  }

  /** Result of {@link #complete(String, int)}: the candidates, and the
   * position in the line where the word they would replace starts. */
  public static class Completion {
    public final int start;
    public final ImmutableList<String> candidates;

    Completion(int start, ImmutableList<String> candidates) {
      this.start = start;
      this.candidates = candidates;
    }

    @Override public String toString() {
      return start + ":" + candidates;
    }
  }
}

// End SqlCompleter.java
