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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/** State of an interactive session.
 *
 * <p>Owns the connection, which it closes when the session ends. The output
 * format is changed only by meta-commands, but may be read from any thread;
 * the table names that the completer caches are likewise replaced whole. */
public class SessionState implements AutoCloseable {
  private static final Logger logger =
      LoggerFactory.getLogger(SessionState.class);

  private final Connection connection;
  private final AtomicReference<OutputFormat> format;
  private final SqlCompleter completer;

  public SessionState(Connection connection, OutputFormat format,
      SqlCompleter completer) {
    this.connection = requireNonNull(connection, "connection");
    this.format = new AtomicReference<>(requireNonNull(format, "format"));
    this.completer = requireNonNull(completer, "completer");
  }

  public Connection connection() {
    return connection;
  }

  public OutputFormat format() {
    return format.get();
  }

  public void setFormat(OutputFormat format) {
    this.format.set(requireNonNull(format, "format"));
  }

  public SqlCompleter completer() {
    return completer;
  }

  /** Closes the connection. Errors are logged, not thrown. */
  @Override public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      logger.warn("Error closing connection", e);
    }
  }
}

// End SessionState.java
