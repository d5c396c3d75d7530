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

import java.io.PrintWriter;
import java.util.List;

/**
 * Parses command-line arguments.
 */
class Launcher {
  private static final String[] USAGE_LINES = {
      "Usage: questcli [option...] [command]",
      "",
      "Options:",
      "  --help",
      "           Print usage",
      "  -H, --host host",
      "           Server host (default " + QuestCli.DEFAULT_HOST + ")",
      "  -p, --port port",
      "           PostgreSQL wire protocol port (default "
          + QuestCli.DEFAULT_PORT + ")",
      "  -u, --user user",
      "           User name (default " + QuestCli.DEFAULT_USER + ")",
      "  -P, --password password",
      "           Password",
      "  -d, --dbname name",
      "           Database name (default " + QuestCli.DEFAULT_DATABASE + ")",
      "  --use-tls",
      "           Connect using TLS",
      "  --allow-invalid-cert",
      "           With --use-tls, accept a certificate that cannot be",
      "           validated",
      "  -f, --format format",
      "           Output format: table, csv, json, vertical, record",
      "           (default " + QuestCli.DEFAULT_FORMAT + ")",
      "  -c, --history-file file",
      "           History file (default " + QuestCli.DEFAULT_HISTORY_FILE
          + ")",
      "",
      "Commands:",
      "  exec sql",
      "           Execute one statement and exit",
      "  exec-from source",
      "           Execute the statements in a file or URL and exit",
      "",
      "With no command, starts an interactive session.",
  };

  private final List<String> args;
  private final PrintWriter out;

  Launcher(List<String> args, PrintWriter out) {
    this.args = args;
    this.out = out;
  }

  /** Creates a launcher, parses command line arguments, and runs the
   * client.
   *
   * <p>Similar to a {@code main} method, but never calls
   * {@link System#exit(int)}.
   *
   * @param out Writer to which to print output
   * @param err Writer to which to print errors
   * @param args Command-line arguments
   *
   * @return Operating system error code (0 = success, 1 = invalid arguments,
   * 2 = other error)
   */
  static int main2(PrintWriter out, PrintWriter err, List<String> args) {
    try {
      final Launcher launcher = new Launcher(args, out);
      final QuestCli.Config config;
      try {
        config = launcher.parse();
      } catch (ParseException e) {
        return e.code;
      }
      return new QuestCli(config, out, err).execute();
    } catch (Throwable e) {
      out.flush();
      e.printStackTrace(err);
      return 2;
    } finally {
      out.flush();
      err.flush();
    }
  }

  /** Parses the command line arguments, and returns a configuration.
   *
   * @throws ParseException if command line arguments were invalid or usage
   * was requested
   */
  public QuestCli.Config parse() throws ParseException {
    QuestCli.ConfigBuilder builder = QuestCli.configBuilder();
    int i;
    for (i = 0; i < args.size();) {
      final String arg = args.get(i);
      switch (arg) {
      case "--help":
        usage();
        throw new ParseException(0);
      case "-H":
      case "--host":
        builder = builder.withHost(value(i));
        i += 2;
        continue;
      case "-p":
      case "--port":
        builder = builder.withPort(port(value(i)));
        i += 2;
        continue;
      case "-u":
      case "--user":
        builder = builder.withUser(value(i));
        i += 2;
        continue;
      case "-P":
      case "--password":
        builder = builder.withPassword(value(i));
        i += 2;
        continue;
      case "-d":
      case "--dbname":
        builder = builder.withDatabase(value(i));
        i += 2;
        continue;
      case "--use-tls":
        builder = builder.withUseTls(true);
        ++i;
        continue;
      case "--allow-invalid-cert":
        builder = builder.withAllowInvalidCert(true);
        ++i;
        continue;
      case "-f":
      case "--format":
        builder = builder.withFormat(value(i));
        i += 2;
        continue;
      case "-c":
      case "--history-file":
        builder = builder.withHistoryFile(value(i));
        i += 2;
        continue;
      default:
        if (arg.startsWith("-")) {
          throw error("Unknown option " + arg);
        }
      }
      break;
    }
    if (i < args.size()) {
      final String command = args.get(i);
      switch (command) {
      case "exec":
        builder = builder.withSql(value(i));
        break;
      case "exec-from":
        builder = builder.withSource(value(i));
        break;
      default:
        throw error("Unknown command " + command);
      }
      if (i + 2 < args.size()) {
        throw error("Too many arguments");
      }
    }
    return builder.build();
  }

  /** Returns the argument after the one at position {@code i}. */
  private String value(int i) throws ParseException {
    if (i + 1 >= args.size()) {
      throw error("Insufficient arguments for " + args.get(i));
    }
    return args.get(i + 1);
  }

  private int port(String s) throws ParseException {
    final int port;
    try {
      port = Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw error("Invalid port " + s);
    }
    if (port <= 0 || port > 65535) {
      throw error("Invalid port " + s);
    }
    return port;
  }

  private ParseException error(String error) {
    out.println(error);
    out.println();
    usage();
    return new ParseException(1);
  }

  private void usage() {
    for (String line : USAGE_LINES) {
      out.println(line);
    }
  }

  static class ParseException extends Exception {
    private final int code;

    ParseException(int code) {
      super();
      this.code = code;
    }
  }
}

// End Launcher.java
