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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** Client-side commands, recognized by a leading backslash.
 *
 * @see MetaCommandDispatcher */
public enum MetaCommand {
  QUIT("\\q", "", "Quit"),
  HELP("\\help", "", "Show this help message"),
  LIST_TABLES("\\dt", "", "List all tables"),
  LIST_WAL_TABLES("\\dwal", "", "List all WAL tables"),
  STORAGE_INFO("\\dstorage", "<table>", "Show storage details for a table"),
  REFRESH("\\refresh", "", "Refresh metadata"),
  FORMAT("\\format", "[name]", "Show or set the output format");

  /** Character that starts every meta-command. */
  public static final char ESCAPE = '\\';

  /** The token that invokes this command, e.g. "\dt". */
  public final String token;
  private final String args;
  private final String description;

  MetaCommand(String token, String args, String description) {
    this.token = token;
    this.args = args;
    this.description = description;
  }

  /** Returns the tokens of all commands, in declaration order. */
  public static ImmutableList<String> tokens() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (MetaCommand command : values()) {
      b.add(command.token);
    }
    return b.build();
  }

  /** Finds the command invoked by a token, or returns null. */
  public static @Nullable MetaCommand lookup(String token) {
    for (MetaCommand command : values()) {
      if (command.token.equals(token)) {
        return command;
      }
    }
    return null;
  }

  /** Returns a line of help, e.g.
   * "{@code   \dstorage <table>  Show storage details for a table}". */
  String helpLine() {
    final String usage = args.isEmpty() ? token : token + " " + args;
    return String.format(Locale.ROOT, "  %-18s %s", usage, description);
  }
}

// End MetaCommand.java
