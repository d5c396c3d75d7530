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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Command-line client for QuestDB.
 */
public class QuestCli {
  private static final Logger logger = LoggerFactory.getLogger(QuestCli.class);

  public static final boolean DEBUG =
      "true".equals(System.getProperties().getProperty("questcli.debug"));

  /** Default value for {@link Config#host()}. */
  static final String DEFAULT_HOST = "localhost";

  /** Default value for {@link Config#port()}; QuestDB's PostgreSQL wire
   * protocol port. */
  static final int DEFAULT_PORT = 8812;

  static final String DEFAULT_USER = "admin";
  static final String DEFAULT_PASSWORD = "quest";
  static final String DEFAULT_DATABASE = "qdb";
  static final String DEFAULT_FORMAT = "table";
  static final String DEFAULT_HISTORY_FILE = "history.txt";

  private final Config config;
  private final PrintWriter out;
  private final PrintWriter err;

  /** Creates a client. */
  public QuestCli(Config config, PrintWriter out, PrintWriter err) {
    this.config = Objects.requireNonNull(config);
    this.out = Objects.requireNonNull(out);
    this.err = Objects.requireNonNull(err);
  }

  /** Creates a {@link ConfigBuilder} with the default settings. */
  public static ConfigBuilder configBuilder() {
    return new ConfigBuilder(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_USER,
        DEFAULT_PASSWORD, DEFAULT_DATABASE, false, false, DEFAULT_FORMAT,
        DEFAULT_HISTORY_FILE, null, null);
  }

  /** Entry point from the operating system command line.
   *
   * <p>Calls {@link System#exit(int)} with the following status codes:
   * <ul>
   *   <li>0: success</li>
   *   <li>1: invalid arguments</li>
   *   <li>2: could not connect, or a statement failed</li>
   * </ul>
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final PrintWriter out = new PrintWriter(System.out);
    final PrintWriter err = new PrintWriter(System.err);
    final int code = Launcher.main2(out, err, Arrays.asList(args));
    System.exit(code);
  }

  /** Returns the output format named in the configuration, or
   * {@link OutputFormat#TABLE} if the name is not recognized. */
  OutputFormat initialFormat() {
    final Optional<OutputFormat> format =
        OutputFormat.lookup(config.format());
    if (!format.isPresent()) {
      logger.warn("Unknown output format '{}'; using '{}'", config.format(),
          OutputFormat.TABLE.displayName());
    }
    return format.orElse(OutputFormat.TABLE);
  }

  /** Connects, then executes the statement or script in the configuration,
   * or if there is none, runs an interactive session.
   *
   * @return Operating system error code
   */
  public int execute() {
    final OutputFormat format = initialFormat();
    final Connection connection;
    try {
      connection = Connections.connect(config);
    } catch (SQLException e) {
      err.println("Failed to connect: " + e.getMessage());
      if (DEBUG) {
        e.printStackTrace(err);
      }
      return 2;
    }
    final SessionState state =
        new SessionState(connection, format, new SqlCompleter());
    try {
      final QueryExecutor executor = new QueryExecutor(connection, out, err);
      final String sql = config.sql();
      if (sql != null) {
        return executor.execute(sql, format) == QueryStatus.FAILED ? 2 : 0;
      }
      final String source = config.source();
      if (source != null) {
        final String script;
        try {
          script = ScriptRunner.read(source);
        } catch (IOException e) {
          err.println("Error executing script: " + e.getMessage());
          return 2;
        }
        final int failures =
            new ScriptRunner(executor, format, err).run(script);
        return failures == 0 ? 0 : 2;
      }
      out.println("Connected to QuestDB at " + config.host() + ":"
          + config.port() + ".");
      out.flush();
      interactive(state);
      return 0;
    } finally {
      state.close();
    }
  }

  private void interactive(SessionState state) {
    final Terminal terminal;
    try {
      terminal = TerminalBuilder.builder()
          .name("questcli")
          .system(true)
          .build();
    } catch (IOException e) {
      err.println("Error in REPL: " + e.getMessage());
      return;
    }
    try {
      final DefaultParser parser = new DefaultParser();
      parser.setEscapeChars(null);
      final LineReader reader = LineReaderBuilder.builder()
          .terminal(terminal)
          .appName("questcli")
          .parser(parser)
          .completer(new JLineCompleter(state.completer()))
          .option(LineReader.Option.CASE_INSENSITIVE, true)
          .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
          .build();
      final PrintWriter writer = terminal.writer();
      final Repl repl =
          new Repl(state, new QueryExecutor(state.connection(), writer, writer),
              History.of(config.historyFile()), new JLineLineSource(reader),
              writer, writer);
      terminal.handle(Terminal.Signal.INT, signal -> repl.interrupt());
      repl.run();
    } finally {
      try {
        terminal.close();
      } catch (IOException e) {
        logger.warn("Error closing terminal", e);
      }
    }
  }

  /** The information needed to start a session. */
  public interface Config {
    String host();
    int port();
    String user();
    String password();
    String database();

    /** Whether to connect using TLS. */
    boolean useTls();

    /** Whether to accept a server certificate that cannot be validated.
     * Only relevant if {@link #useTls()}. */
    boolean allowInvalidCert();

    /** Name of the initial output format. If not recognized, the format is
     * "table". */
    String format();

    /** Path of the history file; may start with "~". */
    String historyFile();

    /** Statement to execute instead of an interactive session, or null. */
    @Nullable String sql();

    /** File or URL of a script to execute instead of an interactive session,
     * or null. */
    @Nullable String source();
  }

  /** Builds a {@link Config}. */
  public static class ConfigBuilder {
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String database;
    private final boolean useTls;
    private final boolean allowInvalidCert;
    private final String format;
    private final String historyFile;
    private final @Nullable String sql;
    private final @Nullable String source;

    private ConfigBuilder(String host, int port, String user, String password,
        String database, boolean useTls, boolean allowInvalidCert,
        String format, String historyFile, @Nullable String sql,
        @Nullable String source) {
      this.host = Objects.requireNonNull(host);
      this.port = port;
      this.user = Objects.requireNonNull(user);
      this.password = Objects.requireNonNull(password);
      this.database = Objects.requireNonNull(database);
      this.useTls = useTls;
      this.allowInvalidCert = allowInvalidCert;
      this.format = Objects.requireNonNull(format);
      this.historyFile = Objects.requireNonNull(historyFile);
      this.sql = sql;
      this.source = source;
    }

    /** Returns a {@link Config}. */
    public Config build() {
      return new Config() {
        public String host() {
          return host;
        }

        public int port() {
          return port;
        }

        public String user() {
          return user;
        }

        public String password() {
          return password;
        }

        public String database() {
          return database;
        }

        public boolean useTls() {
          return useTls;
        }

        public boolean allowInvalidCert() {
          return allowInvalidCert;
        }

        public String format() {
          return format;
        }

        public String historyFile() {
          return historyFile;
        }

        public @Nullable String sql() {
          return sql;
        }

        public @Nullable String source() {
          return source;
        }
      };
    }

    /** Sets {@link Config#host}. */
    public ConfigBuilder withHost(String host) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#port}. */
    public ConfigBuilder withPort(int port) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#user}. */
    public ConfigBuilder withUser(String user) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#password}. */
    public ConfigBuilder withPassword(String password) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#database}. */
    public ConfigBuilder withDatabase(String database) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#useTls}. */
    public ConfigBuilder withUseTls(boolean useTls) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#allowInvalidCert}. */
    public ConfigBuilder withAllowInvalidCert(boolean allowInvalidCert) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#format}. */
    public ConfigBuilder withFormat(String format) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#historyFile}. */
    public ConfigBuilder withHistoryFile(String historyFile) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#sql}. */
    public ConfigBuilder withSql(@Nullable String sql) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }

    /** Sets {@link Config#source}. */
    public ConfigBuilder withSource(@Nullable String source) {
      return new ConfigBuilder(host, port, user, password, database, useTls,
          allowInvalidCert, format, historyFile, sql, source);
    }
  }
}

// End QuestCli.java
