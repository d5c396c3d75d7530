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

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.sql.SQLException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;

import static java.util.Objects.requireNonNull;

/** Read-eval-print loop.
 *
 * <p>Reads lines from a {@link LineSource}; executes each as a meta-command
 * (if it starts with a backslash) or as a SQL statement; prints the results;
 * and repeats until the user types {@code \q} or input ends.
 *
 * <p>Three threads cooperate. A reader thread blocks waiting for a line; a
 * query thread executes statements; and the thread that calls {@link #run()}
 * coordinates them. They communicate only through a queue of events, which
 * also receives interrupts, so the coordinating thread notices Ctrl-C both
 * while the user is typing and while a statement is executing.
 *
 * <p>Lines are processed strictly in order: the reader is not asked for the
 * next line until the previous one has finished or been cancelled. */
public class Repl {
  private static final Logger logger = LoggerFactory.getLogger(Repl.class);

  static final String PROMPT = "questdb> ";

  private final SessionState state;
  private final QueryExecutor executor;
  private final MetaCommandDispatcher dispatcher;
  private final History history;
  private final LineSource lineSource;
  private final PrintWriter out;
  private final PrintWriter err;

  private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
  private final ExecutorService readerService =
      Executors.newSingleThreadExecutor(daemon("questcli-reader"));
  private final ExecutorService queryService =
      Executors.newSingleThreadExecutor(daemon("questcli-query"));

  public Repl(SessionState state, QueryExecutor executor, History history,
      LineSource lineSource, PrintWriter out, PrintWriter err) {
    this.state = requireNonNull(state, "state");
    this.executor = requireNonNull(executor, "executor");
    this.history = requireNonNull(history, "history");
    this.lineSource = requireNonNull(lineSource, "lineSource");
    this.out = requireNonNull(out, "out");
    this.err = requireNonNull(err, "err");
    this.dispatcher =
        new MetaCommandDispatcher(state,
            new MetaCommandDispatcher.QueryRunner() {
              public QueryStatus run(String sql) {
                return runQuery(sql);
              }

              public void refreshTables() throws SQLException {
                Repl.this.refreshTables();
              }
            }, out, err);
  }

  private static ThreadFactory daemon(String name) {
    return new ThreadFactoryBuilder().setNameFormat(name).setDaemon(true)
        .build();
  }

  /** Delivers an interrupt (Ctrl-C). Safe to call from any thread, such as a
   * signal handler.
   *
   * <p>If a statement is executing, it is cancelled; otherwise the user is
   * reminded how to quit. */
  public void interrupt() {
    events.add(Event.INTERRUPT);
  }

  /** Runs the loop until the user quits or input ends, then saves history.
   * Does not close the session. */
  public void run() {
    try {
      history.load();
    } catch (IOException e) {
      logger.warn("Could not load history from {}", history.file(), e);
      out.println("No previous history.");
    }
    lineSource.addHistory(history.loaded());
    try {
      refreshTables();
    } catch (SQLException e) {
      err.println("Failed to fetch table names: " + e.getMessage());
    }
    out.println("Connected to QuestDB. Type '\\q' to quit.");
    out.flush();
    try {
      loop();
    } finally {
      readerService.shutdownNow();
      queryService.shutdownNow();
      try {
        history.save();
      } catch (IOException e) {
        logger.warn("Could not save history to {}", history.file(), e);
        err.println("Failed to save history: " + e.getMessage());
      }
      out.flush();
      err.flush();
    }
  }

  private void loop() {
    requestLine();
    for (;;) {
      final Event event = take();
      switch (event.kind) {
      case LINE:
        if (!process(requireNonNull(event.line))) {
          return;
        }
        requestLine();
        break;
      case READ_INTERRUPTED:
        out.println("Use \\q to quit.");
        out.flush();
        requestLine();
        break;
      case INTERRUPT:
        // The reader is still waiting for a line; leave it waiting.
        out.println();
        out.println("Use \\q to quit.");
        out.flush();
        break;
      case END_OF_INPUT:
        out.println("Exiting...");
        return;
      case READ_ERROR:
        err.println("Error: " + event.line);
        return;
      case QUERY_DONE:
        // Late notification from a statement whose outcome was already
        // collected; nothing to do.
        break;
      default:
        throw new AssertionError(event.kind);
      }
    }
  }

  /** Processes a line. Returns false if the loop should stop. */
  private boolean process(String line) {
    final String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    history.add(trimmed);
    if (trimmed.equals(MetaCommand.QUIT.token)) {
      out.println("Goodbye!");
      return false;
    }
    if (trimmed.charAt(0) == MetaCommand.ESCAPE) {
      dispatcher.dispatch(trimmed);
    } else {
      runQuery(trimmed);
    }
    out.flush();
    err.flush();
    return true;
  }

  /** Executes a statement on the query thread and waits for it to finish,
   * cancelling it if an interrupt arrives meanwhile. */
  QueryStatus runQuery(String sql) {
    try {
      final QueryStatus status =
          onQueryThread(() -> executor.execute(sql, state.format()));
      return status == null ? QueryStatus.CANCELLED : status;
    } catch (ExecutionException e) {
      err.println("Query execution error: " + e.getCause());
      logger.error("Query execution error", e.getCause());
      return QueryStatus.FAILED;
    }
  }

  /** Reloads the table names used for completion. Runs on the query thread,
   * so an interrupt cancels it like any other statement. */
  void refreshTables() throws SQLException {
    try {
      onQueryThread(() -> {
        state.completer().refresh(executor);
        return Boolean.TRUE;
      });
    } catch (ExecutionException e) {
      final Throwable cause = requireNonNull(e.getCause());
      Throwables.throwIfInstanceOf(cause, SQLException.class);
      Throwables.throwIfUnchecked(cause);
      throw new RuntimeException(cause);
    }
  }

  /** Runs a task on the query thread and waits for it. Each interrupt that
   * arrives meanwhile is routed to {@link QueryExecutor#cancel()}; the first
   * is announced, later ones only acknowledged.
   *
   * <p>Returns null if this thread is interrupted before the task ends. */
  private <T> @Nullable T onQueryThread(Callable<T> task)
      throws ExecutionException {
    executor.clearCancel();
    final Future<T> future = queryService.submit(() -> {
      try {
        return task.call();
      } finally {
        events.add(Event.QUERY_DONE);
      }
    });
    boolean cancelling = false;
    for (;;) {
      final Event event = take();
      switch (event.kind) {
      case QUERY_DONE:
        return outcome(future);
      case INTERRUPT:
        if (cancelling) {
          err.println("Cancellation already requested.");
        } else {
          cancelling = true;
          err.println();
          err.println("Cancelling query...");
          err.flush();
          // If the statement has not been created yet, the executor
          // remembers the request and cancels it on creation.
          executor.cancel();
        }
        err.flush();
        break;
      case END_OF_INPUT:
        // This thread was interrupted; abandon the task.
        executor.cancel();
        return null;
      default:
        logger.warn("Ignoring {} while statement is executing", event.kind);
      }
    }
  }

  private <T> @Nullable T outcome(Future<T> future)
      throws ExecutionException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  /** Asks the reader thread for the next line. When it arrives (or input
   * ends, or the user interrupts) an event is queued. */
  private void requestLine() {
    readerService.submit(() -> {
      try {
        final String line = lineSource.readLine(PROMPT);
        events.add(line == null ? Event.END_OF_INPUT : Event.line(line));
      } catch (LineSource.InterruptedLineException e) {
        events.add(Event.READ_INTERRUPTED);
      } catch (IOException | RuntimeException e) {
        logger.error("Error reading line", e);
        events.add(Event.readError(String.valueOf(e)));
      }
    });
  }

  private Event take() {
    try {
      return events.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Event.END_OF_INPUT;
    }
  }

  /** Something that the coordinating thread must react to. */
  private static class Event {
    static final Event INTERRUPT = new Event(Kind.INTERRUPT, null);
    static final Event READ_INTERRUPTED =
        new Event(Kind.READ_INTERRUPTED, null);
    static final Event END_OF_INPUT = new Event(Kind.END_OF_INPUT, null);
    static final Event QUERY_DONE = new Event(Kind.QUERY_DONE, null);

    final Kind kind;
    /** The line read, or the error message. */
    final @Nullable String line;

    private Event(Kind kind, @Nullable String line) {
      this.kind = kind;
      this.line = line;
    }

    static Event line(String line) {
      return new Event(Kind.LINE, line);
    }

    static Event readError(String message) {
      return new Event(Kind.READ_ERROR, message);
    }

    enum Kind {
      LINE, READ_INTERRUPTED, INTERRUPT, END_OF_INPUT, READ_ERROR, QUERY_DONE
    }
  }
}

// End Repl.java
