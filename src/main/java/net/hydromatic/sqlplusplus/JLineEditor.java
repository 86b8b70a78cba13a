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
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/** Implementation of {@link LineEditor} that uses JLine.
 *
 * <p>End of input (Ctrl-D) and interrupt (Ctrl-C) both end the input. */
public class JLineEditor implements LineEditor {
  private static final char PASSWORD_MASK = '*';

  private final Terminal terminal;
  private final LineReader reader;
  private final ExplicitHistory history;

  private JLineEditor(Terminal terminal, LineReader reader,
      ExplicitHistory history) {
    this.terminal = requireNonNull(terminal, "terminal");
    this.reader = requireNonNull(reader, "reader");
    this.history = requireNonNull(history, "history");
  }

  /** Creates an editor on the system terminal. */
  public static JLineEditor create() throws IOException {
    return create(TerminalBuilder.builder().system(true).build());
  }

  /** Creates an editor on a given terminal. The editor closes the terminal
   * when it is closed. */
  static JLineEditor create(Terminal terminal) {
    final ExplicitHistory history = new ExplicitHistory();
    final LineReader reader = LineReaderBuilder.builder()
        .terminal(terminal)
        .appName("sqlplusplus")
        .history(history)
        .option(LineReader.Option.HISTORY_TIMESTAMPED, false)
        .option(LineReader.Option.HISTORY_IGNORE_SPACE, false)
        .build();
    // No history file is set yet, so this loads nothing
    history.attach(reader);
    return new JLineEditor(terminal, reader, history);
  }

  @Override public @Nullable String readLine(String prompt) {
    try {
      return reader.readLine(prompt);
    } catch (UserInterruptException | EndOfFileException e) {
      return null;
    }
  }

  @Override public @Nullable String readPassword(String prompt) {
    try {
      return reader.readLine(prompt, PASSWORD_MASK);
    } catch (UserInterruptException | EndOfFileException e) {
      return null;
    }
  }

  @Override public boolean supportsAnsi() {
    return !terminal.getType().startsWith(Terminal.TYPE_DUMB);
  }

  @Override public void loadHistory(String path) throws IOException {
    reader.setVariable(LineReader.HISTORY_FILE, Paths.get(path));
    history.load();
  }

  @Override public void addHistory(String line) {
    history.record(line);
  }

  @Override public void saveHistory(String path) throws IOException {
    reader.setVariable(LineReader.HISTORY_FILE, Paths.get(path));
    history.save();
  }

  @Override public void setMaxHistoryLength(int maxLength) {
    reader.setVariable(LineReader.HISTORY_SIZE, maxLength);
    reader.setVariable(LineReader.HISTORY_FILE_SIZE, maxLength);
  }

  @Override public void close() throws IOException {
    terminal.close();
  }

  /** History that ignores the lines that the reader adds after each
   * {@code readLine}; only lines passed to {@link #record(String)} are
   * kept. */
  private static class ExplicitHistory extends DefaultHistory {
    @Override public void add(Instant time, String line) {
      // Lines are recorded via record(String).
    }

    void record(String line) {
      super.add(Instant.now(), line);
    }
  }
}

// End JLineEditor.java
