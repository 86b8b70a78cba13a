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
import java.io.StringWriter;
import java.io.Writer;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Interactive SQL client.
 *
 * <p>Reads statements from a {@link LineEditor}, executes them against a
 * JDBC connection, and prints results a page at a time.
 */
public class SqlPlusPlus {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SqlPlusPlus.class);

  /** Default value for {@link ConfigBuilder#withMaxHistorySize(int)}. */
  public static final int DEFAULT_MAX_HISTORY_SIZE = 10000;

  /** Name of the history file in the user's home directory. */
  public static final String HISTORY_FILE_NAME = ".sqlplusplus_history";

  /** A line editor that has no input. */
  private static final LineEditor EMPTY_LINE_EDITOR = new EmptyLineEditor();

  private final Config config;

  /** Creates a client. */
  public SqlPlusPlus(Config config) {
    this.config = Objects.requireNonNull(config);
  }

  /** Creates a {@link ConfigBuilder} with the default settings. */
  public static ConfigBuilder configBuilder() {
    return new ConfigBuilder(EMPTY_LINE_EDITOR, new StringWriter(),
        new StringWriter(), ConnectionFactories.simple(), "", "", "", null,
        DEFAULT_MAX_HISTORY_SIZE, ResultPager.DEFAULT_PAGE_SIZE, false);
  }

  /** Entry point from the operating system command line.
   *
   * <p>Calls {@link System#exit(int)} with the following status codes:
   * <ul>
   *   <li>0: success</li>
   *   <li>1: the database reported a fatal error</li>
   *   <li>2: invalid arguments or other error</li>
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

  /** Connects to the database and runs a session until the user exits or
   * input ends.
   *
   * <p>The history is loaded before the session starts and saved when it
   * ends, whether or not it ends normally.
   *
   * @throws DatabaseException if the database cannot be connected to
   */
  public void execute() throws DatabaseException {
    final LineEditor editor = config.lineEditor();
    final String historyFile = config.historyFile();
    editor.setMaxHistoryLength(config.maxHistorySize());
    if (historyFile != null) {
      try {
        editor.loadHistory(historyFile);
      } catch (IOException e) {
        LOGGER.warn("Could not load history from {}", historyFile, e);
      }
    }
    final PrintWriter writer = printWriter(config.writer());
    final PrintWriter errorWriter = printWriter(config.errorWriter());
    try (Connection connection = connect()) {
      new Session(editor, connection, writer, errorWriter,
          config.pageSize(), config.styled()).run();
    } catch (SQLException e) {
      throw new DatabaseException("closing connection", e);
    } finally {
      if (historyFile != null) {
        try {
          editor.saveHistory(historyFile);
        } catch (IOException e) {
          LOGGER.warn("Could not save history to {}", historyFile, e);
        }
      }
      writer.flush();
      errorWriter.flush();
    }
  }

  private Connection connect() throws DatabaseException {
    final String url = ConnectionFactories.jdbcUrl(config.connectionString());
    try {
      return config.connectionFactory()
          .connect(url, config.user(), config.password());
    } catch (SQLException e) {
      throw new DatabaseException("connecting", e);
    }
  }

  private static PrintWriter printWriter(Writer writer) {
    return writer instanceof PrintWriter
        ? (PrintWriter) writer
        : new PrintWriter(writer);
  }

  /** Creates a JDBC connection.
   *
   * <p>Caller must close the connection. */
  public interface ConnectionFactory {
    /** Creates a connection.
     *
     * @param url JDBC URL
     * @param user User name
     * @param password Password
     */
    Connection connect(String url, String user, String password)
        throws SQLException;
  }

  /** The information needed to start a session. */
  public interface Config {
    LineEditor lineEditor();
    Writer writer();
    Writer errorWriter();
    ConnectionFactory connectionFactory();

    /** Returns the connection string: a JDBC URL or an Oracle connect
     * string.
     *
     * @see ConnectionFactories#jdbcUrl(String) */
    String connectionString();
    String user();
    String password();

    /** Returns the file in which history is kept between sessions, or null
     * if history is not kept. */
    @Nullable String historyFile();

    /** Returns the maximum number of lines of history. The default is
     * {@link SqlPlusPlus#DEFAULT_MAX_HISTORY_SIZE}. */
    int maxHistorySize();

    /** Returns the number of rows per page. The default is
     * {@link ResultPager#DEFAULT_PAGE_SIZE}. */
    int pageSize();

    /** Returns whether to style output with ANSI escape sequences. */
    boolean styled();
  }

  /** Builds a {@link Config}. */
  public static class ConfigBuilder {
    private final LineEditor lineEditor;
    private final Writer writer;
    private final Writer errorWriter;
    private final ConnectionFactory connectionFactory;
    private final String connectionString;
    private final String user;
    private final String password;
    private final @Nullable String historyFile;
    private final int maxHistorySize;
    private final int pageSize;
    private final boolean styled;

    private ConfigBuilder(LineEditor lineEditor, Writer writer,
        Writer errorWriter, ConnectionFactory connectionFactory,
        String connectionString, String user, String password,
        @Nullable String historyFile, int maxHistorySize, int pageSize,
        boolean styled) {
      this.lineEditor = Objects.requireNonNull(lineEditor);
      this.writer = Objects.requireNonNull(writer);
      this.errorWriter = Objects.requireNonNull(errorWriter);
      this.connectionFactory = Objects.requireNonNull(connectionFactory);
      this.connectionString = Objects.requireNonNull(connectionString);
      this.user = Objects.requireNonNull(user);
      this.password = Objects.requireNonNull(password);
      this.historyFile = historyFile;
      this.maxHistorySize = maxHistorySize;
      this.pageSize = pageSize;
      this.styled = styled;
    }

    /** Returns a {@link Config}. */
    public Config build() {
      if (pageSize <= 0) {
        throw new IllegalArgumentException("pageSize must be positive: "
            + pageSize);
      }
      if (maxHistorySize < 0) {
        throw new IllegalArgumentException(
            "maxHistorySize must not be negative: " + maxHistorySize);
      }
      return new Config() {
        public LineEditor lineEditor() {
          return lineEditor;
        }

        public Writer writer() {
          return writer;
        }

        public Writer errorWriter() {
          return errorWriter;
        }

        public ConnectionFactory connectionFactory() {
          return connectionFactory;
        }

        public String connectionString() {
          return connectionString;
        }

        public String user() {
          return user;
        }

        public String password() {
          return password;
        }

        public @Nullable String historyFile() {
          return historyFile;
        }

        public int maxHistorySize() {
          return maxHistorySize;
        }

        public int pageSize() {
          return pageSize;
        }

        public boolean styled() {
          return styled;
        }
      };
    }

    /** Sets {@link Config#lineEditor}. */
    public ConfigBuilder withLineEditor(LineEditor lineEditor) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#writer}. */
    public ConfigBuilder withWriter(Writer writer) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#errorWriter}. */
    public ConfigBuilder withErrorWriter(Writer errorWriter) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#connectionFactory}. */
    public ConfigBuilder withConnectionFactory(
        ConnectionFactory connectionFactory) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#connectionString}, {@link Config#user} and
     * {@link Config#password}. */
    public ConfigBuilder withCredentials(String connectionString, String user,
        String password) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#historyFile}. */
    public ConfigBuilder withHistoryFile(@Nullable String historyFile) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#maxHistorySize}. */
    public ConfigBuilder withMaxHistorySize(int maxHistorySize) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#pageSize}. */
    public ConfigBuilder withPageSize(int pageSize) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }

    /** Sets {@link Config#styled}. */
    public ConfigBuilder withStyled(boolean styled) {
      return new ConfigBuilder(lineEditor, writer, errorWriter,
          connectionFactory, connectionString, user, password, historyFile,
          maxHistorySize, pageSize, styled);
    }
  }

  /** Line editor that is always at end of input, and keeps no history. */
  private static class EmptyLineEditor implements LineEditor {
    @Override public @Nullable String readLine(String prompt) {
      return null;
    }

    @Override public @Nullable String readPassword(String prompt) {
      return null;
    }

    @Override public void loadHistory(String path) {
    }

    @Override public void addHistory(String line) {
    }

    @Override public void saveHistory(String path) {
    }

    @Override public void setMaxHistoryLength(int maxLength) {
    }

    @Override public void close() {
    }
  }
}

// End SqlPlusPlus.java
