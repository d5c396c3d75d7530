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

/** Splits a script into statements.
 *
 * <p>Statements are separated by semicolons. Semicolons inside
 * single-quoted strings, double-quoted identifiers, {@code --} line comments
 * and {@code /* ... *}{@code /} block comments do not separate statements.
 * A quote is escaped by doubling it. Fragments that contain only whitespace
 * and comments are dropped. */
public class StatementSplitter {
  private StatementSplitter() {}

  /** Splits a script into a list of statements, each trimmed and without its
   * terminating semicolon. */
  public static ImmutableList<String> split(String script) {
    final ImmutableList.Builder<String> statements = ImmutableList.builder();
    final StringBuilder buf = new StringBuilder();
    boolean hasCode = false;
    final int n = script.length();
    for (int i = 0; i < n;) {
      final char c = script.charAt(i);
      if (c == '\'' || c == '"') {
        final int end = endOfQuoted(script, i, c);
        buf.append(script, i, end);
        hasCode = true;
        i = end;
      } else if (c == '-' && script.startsWith("--", i)) {
        final int newline = script.indexOf('\n', i);
        final int end = newline < 0 ? n : newline;
        buf.append(script, i, end);
        i = end;
      } else if (c == '/' && script.startsWith("/*", i)) {
        final int close = script.indexOf("*/", i + 2);
        final int end = close < 0 ? n : close + 2;
        buf.append(script, i, end);
        i = end;
      } else if (c == ';') {
        if (hasCode) {
          statements.add(buf.toString().trim());
        }
        buf.setLength(0);
        hasCode = false;
        ++i;
      } else {
        buf.append(c);
        hasCode |= !Character.isWhitespace(c);
        ++i;
      }
    }
    if (hasCode) {
      statements.add(buf.toString().trim());
    }
    return statements.build();
  }

  /** Returns the index just after the quote that closes the quoted section
   * starting at {@code start}, or the length of the script if it is never
   * closed. */
  private static int endOfQuoted(String script, int start, char quote) {
    int i = start + 1;
    while (i < script.length()) {
      if (script.charAt(i) == quote) {
        if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
          i += 2; // doubled quote
          continue;
        }
        return i + 1;
      }
      ++i;
    }
    return script.length();
  }
}

// End StatementSplitter.java
