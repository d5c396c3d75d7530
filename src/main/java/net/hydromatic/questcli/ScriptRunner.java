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

import com.google.common.io.Files;
import com.google.common.io.Resources;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/** Executes each statement of a script, in order.
 *
 * <p>A statement that fails is reported and execution continues with the
 * next one. */
public class ScriptRunner {
  private final QueryExecutor executor;
  private final OutputFormat format;
  private final PrintWriter err;

  public ScriptRunner(QueryExecutor executor, OutputFormat format,
      PrintWriter err) {
    this.executor = requireNonNull(executor, "executor");
    this.format = requireNonNull(format, "format");
    this.err = requireNonNull(err, "err");
  }

  /** Reads a script from a URL ("http:", "https:" or "file:") or, if the
   * source is not a URL, from a local file. */
  public static String read(String source) throws IOException {
    final String lower = source.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://")
        || lower.startsWith("https://")
        || lower.startsWith("file:")) {
      return Resources.toString(new URL(source), StandardCharsets.UTF_8);
    }
    return Files.asCharSource(History.expand(source), StandardCharsets.UTF_8)
        .read();
  }

  /** Executes the statements of a script.
   *
   * @return Number of statements that failed
   */
  public int run(String script) {
    final List<String> statements = StatementSplitter.split(script);
    int failures = 0;
    for (int i = 0; i < statements.size(); i++) {
      final String sql = statements.get(i);
      final QueryStatus status = executor.execute(sql, format);
      if (status == QueryStatus.FAILED) {
        ++failures;
        err.println("Statement " + (i + 1) + " of " + statements.size()
            + " failed: " + sql);
        err.flush();
      }
    }
    return failures;
  }
}

// End ScriptRunner.java
