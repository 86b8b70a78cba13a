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
package net.hydromatic.sqlplusplus;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Read-execute-print loop over one connection.
 *
 * <p>Each iteration reads a line, passes it to an {@link InputAccumulator},
 * and dispatches each completed, non-blank logical line as a
 * {@link Command}. If a command fails with a {@link DatabaseException}, the
 * error is printed, the active statement is discarded, and the loop
 * continues.
 *
 * <p>Not thread-safe. */
public class Session {
  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  static final String PROMPT = "SQL++ > ";
  static final String CONTINUATION_PROMPT = "SQL++ (cont.) > ";

  private final LineEditor editor;
  private final Connection connection;
  private final PrintWriter writer;
  private final PrintWriter errorWriter;
  private final int pageSize;
  private final TableRenderer renderer;
  private final InputAccumulator accumulator = new InputAccumulator();
  private final CommandDispatcher dispatcher = new CommandDispatcher();
  private final StatementSlot statements = new StatementSlot();
  private final ResultPager pager = new ResultPager();
  private final Command.Context context = new ContextImpl();
  private boolean running;

  Session(LineEditor editor, Connection connection, PrintWriter writer,
      PrintWriter errorWriter, int pageSize, boolean styled) {
    this.editor = requireNonNull(editor, "editor");
    this.connection = requireNonNull(connection, "connection");
    this.writer = requireNonNull(writer, "writer");
    this.errorWriter = requireNonNull(errorWriter, "errorWriter");
    this.pageSize = pageSize;
    this.renderer = new TableRenderer(styled);
  }

  /** Runs until end of input or {@code .exit}. Closes the active statement,
   * if any, before returning. */
  public void run() {
    running = true;
    try {
      while (running) {
        final String line = readLine();
        if (line == null) {
          break;
        }
        final String logicalLine = accumulator.accept(line);
        if (logicalLine == null || logicalLine.trim().isEmpty()) {
          continue;
        }
        execute(dispatcher.parse(logicalLine));
      }
    } finally {
      statements.clear();
      writer.flush();
      errorWriter.flush();
    }
  }

  private @Nullable String readLine() {
    final String prompt =
        accumulator.isContinuing() ? CONTINUATION_PROMPT : PROMPT;
    try {
      return editor.readLine(prompt);
    } catch (IOException e) {
      throw new RuntimeException("Error while reading next line", e);
    }
  }

  /** Executes a command, reporting any database error. */
  void execute(Command command) {
    LOGGER.debug("Executing {}", command.describe());
    try {
      command.execute(context);
    } catch (DatabaseException e) {
      statements.clear();
      writer.flush();
      errorWriter.println("Error " + e.context() + ": " + e.getMessage());
    }
    writer.flush();
    errorWriter.flush();
  }

  StatementSlot statements() {
    return statements;
  }

  InputAccumulator accumulator() {
    return accumulator;
  }

  /** Implementation of {@link Command.Context}. Most methods call through to
   * a corresponding field or method in {@link Session}. */
  private class ContextImpl implements Command.Context {
    @Override public PrintWriter writer() {
      return writer;
    }

    @Override public Connection connection() {
      return connection;
    }

    @Override public StatementSlot statements() {
      return statements;
    }

    @Override public int pageSize() {
      return pageSize;
    }

    @Override public void showPage(int maxRows) throws DatabaseException {
      final ActiveStatement statement = statements.active();
      final ResultPage page;
      try {
        page = pager.fetchPage(statement, maxRows);
      } catch (SQLException e) {
        throw new DatabaseException("fetching rows", e);
      }
      if (page.isEmpty()) {
        writer.println("No rows returned");
      } else {
        renderer.render(statement.columns(), page, writer);
        writer.println("Fetched " + page.size()
            + (page.size() == 1 ? " row" : " rows"));
      }
      if (page.wasExhausted) {
        statements.clear();
      }
    }

    @Override public void addHistory(String line) {
      editor.addHistory(line);
    }

    @Override public void exit() {
      running = false;
    }
  }
}

// End Session.java
