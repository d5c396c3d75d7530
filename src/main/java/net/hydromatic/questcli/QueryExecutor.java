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

import net.hydromatic.questcli.format.Column;
import net.hydromatic.questcli.format.OutputFormat;
import net.hydromatic.questcli.format.Row;
import net.hydromatic.questcli.format.RowSink;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Executes SQL statements on a connection and prints their results.
 *
 * <p>At most one statement is pending at a time. While it is pending,
 * another thread may call {@link #cancel()}; the JDBC driver sends the
 * cancel request over a separate channel, because the connection's own
 * channel is busy, and the statement then fails with an error that this
 * class reports as {@link QueryStatus#CANCELLED}. The connection remains
 * usable afterwards. */
public class QueryExecutor {
  private static final Logger logger =
      LoggerFactory.getLogger(QueryExecutor.class);

  /** SQLSTATE "query_canceled". */
  static final String QUERY_CANCELED = "57014";

  private final Connection connection;
  private final PrintWriter out;
  private final PrintWriter err;

  /** Guards {@link #pending} and {@link #cancelRequested}. */
  private final Object lock = new Object();
  private @Nullable Statement pending;
  private boolean cancelRequested;

  public QueryExecutor(Connection connection, PrintWriter out,
      PrintWriter err) {
    this.connection = requireNonNull(connection, "connection");
    this.out = requireNonNull(out, "out");
    this.err = requireNonNull(err, "err");
  }

  /** Executes a statement, printing its rows in the given format as they
   * arrive, or its update count. If the statement produces several results,
   * prints each in turn.
   *
   * <p>Never throws {@link SQLException}; errors are printed, and the
   * outcome is returned as a status.
   *
   * @param sql SQL statement; must not be empty
   * @param format Output format
   * @return How execution ended
   */
  public QueryStatus execute(String sql, OutputFormat format) {
    Preconditions.checkArgument(!sql.trim().isEmpty(), "empty statement");
    final Statement statement;
    try {
      statement = connection.createStatement();
    } catch (SQLException e) {
      clearCancel();
      report("Query failed", e);
      return QueryStatus.FAILED;
    }
    if (!register(statement)) {
      return cancelled();
    }
    try {
      boolean resultSetNext = statement.execute(sql);
      for (;;) {
        if (resultSetNext) {
          try (ResultSet resultSet = statement.getResultSet()) {
            final QueryStatus status = print(resultSet, format.sink(out));
            if (status != QueryStatus.COMPLETED) {
              return status;
            }
          }
        } else {
          final int updateCount = statement.getUpdateCount();
          if (updateCount == -1) {
            break;
          }
          out.println("Command completed: " + updateCount + " rows affected");
        }
        resultSetNext = statement.getMoreResults();
      }
      out.flush();
      return QueryStatus.COMPLETED;
    } catch (SQLException e) {
      if (isCancellation(e)) {
        return cancelled();
      }
      report("Query failed", e);
      return QueryStatus.FAILED;
    } finally {
      unregister(statement);
    }
  }

  /** Makes a statement pending, so that {@link #cancel()} can reach it.
   * Returns false, and closes the statement, if cancellation was requested
   * before the statement got this far. */
  private boolean register(Statement statement) {
    synchronized (lock) {
      Preconditions.checkState(pending == null,
          "another statement is pending");
      if (!cancelRequested) {
        pending = statement;
        return true;
      }
      cancelRequested = false;
    }
    close(statement);
    return false;
  }

  private void unregister(Statement statement) {
    synchronized (lock) {
      pending = null;
      cancelRequested = false;
    }
    close(statement);
  }

  private static void close(Statement statement) {
    try {
      statement.close();
    } catch (SQLException e) {
      logger.warn("Error closing statement", e);
    }
  }

  /** Streams the rows of a result set into a sink. If reading a row fails,
   * reports the error and abandons the rest of the result set. */
  private QueryStatus print(ResultSet resultSet, RowSink sink)
      throws SQLException {
    final List<Column> columns = Column.of(resultSet.getMetaData());
    sink.start(columns);
    for (;;) {
      final Row row;
      try {
        if (!resultSet.next()) {
          break;
        }
        row = Row.read(resultSet, columns);
      } catch (SQLException e) {
        sink.end();
        if (isCancellation(e)) {
          return cancelled();
        }
        report("Error reading row", e);
        return QueryStatus.FAILED;
      }
      sink.row(row);
    }
    sink.end();
    return QueryStatus.COMPLETED;
  }

  /** Requests cancellation of the pending statement.
   *
   * <p>Returns without waiting for the statement to finish; the thread
   * that called {@link #execute} finds out when the server aborts it.
   *
   * <p>If no statement is pending yet, the request is remembered, and the
   * next statement is cancelled as soon as it is created, without being
   * sent to the server. A caller that is not sure a statement is on its
   * way should call {@link #clearCancel()} before starting the next one.
   *
   * @return whether a statement was pending
   */
  public boolean cancel() {
    final Statement statement;
    synchronized (lock) {
      cancelRequested = true;
      statement = pending;
      if (statement == null) {
        return false;
      }
    }
    try {
      statement.cancel();
    } catch (SQLException e) {
      report("Failed to cancel query", e);
    }
    return true;
  }

  /** Forgets a cancellation request that no statement has consumed. */
  public void clearCancel() {
    synchronized (lock) {
      cancelRequested = false;
    }
  }

  /** Returns whether a statement is executing. */
  public boolean isPending() {
    synchronized (lock) {
      return pending != null;
    }
  }

  /** Executes a query and returns the first column of each row, skipping
   * nulls. Used for metadata such as table names.
   *
   * <p>The statement is pending while it executes, so {@link #cancel()}
   * aborts it; it then fails with SQLSTATE {@value #QUERY_CANCELED}. */
  public List<String> fetchStrings(String sql) throws SQLException {
    final Statement statement;
    try {
      statement = connection.createStatement();
    } catch (SQLException e) {
      clearCancel();
      throw e;
    }
    if (!register(statement)) {
      throw new SQLException("canceling statement due to user request",
          QUERY_CANCELED);
    }
    final List<String> list = new ArrayList<>();
    try (ResultSet resultSet = statement.executeQuery(sql)) {
      while (resultSet.next()) {
        final String s = resultSet.getString(1);
        if (s != null) {
          list.add(s);
        }
      }
    } finally {
      unregister(statement);
    }
    return list;
  }

  private boolean isCancellation(SQLException e) {
    synchronized (lock) {
      if (cancelRequested) {
        return true;
      }
    }
    return QUERY_CANCELED.equals(e.getSQLState());
  }

  private QueryStatus cancelled() {
    out.flush();
    err.println("Query cancelled.");
    err.flush();
    return QueryStatus.CANCELLED;
  }

  private void report(String message, SQLException e) {
    out.flush();
    err.println(message + ": " + e.getMessage());
    if (QuestCli.DEBUG) {
      e.printStackTrace(err);
    }
    err.flush();
  }
}

// End QueryExecutor.java
