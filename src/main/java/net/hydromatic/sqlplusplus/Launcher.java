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

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.function.Function;

/**
 * Parses command-line arguments.
 */
class Launcher {
  private static final String[] USAGE_LINES = {
      "Usage: sqlplusplus [OPTIONS]",
      "",
      "Options:",
      "  -h, --help",
      "           Display command-line synopsis followed by the list of",
      "           available options",
      "  -c, --connectionString connectionString",
      "           Connection string to connect to the database with; a JDBC",
      "           URL, or an Oracle connect string such as host:1521/service",
      "  -u, --username username",
      "           Username to authenticate with",
      "  -p, --password password",
      "           Password to authenticate with; if omitted, you are",
      "           prompted for it",
      "  --historyFile path",
      "           File in which to keep command history (default",
      "           $HOME/" + SqlPlusPlus.HISTORY_FILE_NAME + ")",
      "  --maxHistorySize n",
      "           Maximum number of lines of history (default "
          + SqlPlusPlus.DEFAULT_MAX_HISTORY_SIZE + ")",
  };

  static final String PASSWORD_PROMPT = "Password > ";

  private final List<String> args;
  private final PrintWriter out;
  private final Function<String, String> env;

  Launcher(List<String> args, PrintWriter out, Function<String, String> env) {
    this.args = args;
    this.out = out;
    this.env = env;
  }

  /** Creates a launcher, parses command line arguments, and runs a session
   * on the system terminal.
   *
   * <p>Similar to a {@code main} method, but never calls
   * {@link System#exit(int)}.
   *
   * @param out Writer to which to print output
   * @param err Writer to which to print errors
   * @param args Command-line arguments
   *
   * @return Operating system error code (0 = success, 1 = fatal database
   * error, 2 = invalid arguments or other error)
   */
  static int main2(PrintWriter out, PrintWriter err, List<String> args) {
    return main2(out, err, args, System::getenv, JLineEditor::create,
        ConnectionFactories.simple());
  }

  /** As {@link #main2(PrintWriter, PrintWriter, List)}, but with the
   * environment, terminal and database provided by the caller. */
  static int main2(PrintWriter out, PrintWriter err, List<String> args,
      Function<String, String> env, LineEditor.Factory editorFactory,
      SqlPlusPlus.ConnectionFactory connectionFactory) {
    try {
      final Launcher launcher = new Launcher(args, out, env);
      final Options options;
      try {
        options = launcher.parse();
      } catch (ParseException e) {
        return e.code;
      }
      try (LineEditor editor = editorFactory.create()) {
        String password = options.password;
        if (password == null) {
          password = editor.readPassword(PASSWORD_PROMPT);
          if (password == null) {
            // End of input at the password prompt
            return 0;
          }
        }
        final SqlPlusPlus.Config config = SqlPlusPlus.configBuilder()
            .withLineEditor(editor)
            .withWriter(out)
            .withErrorWriter(err)
            .withConnectionFactory(connectionFactory)
            .withCredentials(options.connectionString, options.user,
                password)
            .withHistoryFile(options.historyFile)
            .withMaxHistorySize(options.maxHistorySize)
            .withStyled(editor.supportsAnsi())
            .build();
        new SqlPlusPlus(config).execute();
        return 0;
      }
    } catch (DatabaseException e) {
      out.flush();
      err.println("Fatal error " + e.context() + ": " + e.getMessage());
      return 1;
    } catch (Throwable e) {
      out.flush();
      e.printStackTrace(err);
      return 2;
    } finally {
      out.flush();
      err.flush();
    }
  }

  /** Parses the command line arguments.
   *
   * @throws ParseException if command line arguments were invalid or usage
   * was requested
   */
  public Options parse() throws ParseException {
    String connectionString = null;
    String user = null;
    String password = null;
    String historyFile = null;
    int maxHistorySize = SqlPlusPlus.DEFAULT_MAX_HISTORY_SIZE;
    for (int i = 0; i < args.size(); i += 2) {
      final String arg = args.get(i);
      if (arg.equals("-h") || arg.equals("--help")) {
        usage();
        throw new ParseException(0);
      }
      if (i + 1 >= args.size()) {
        throw error("Insufficient arguments for " + arg);
      }
      final String value = args.get(i + 1);
      switch (arg) {
      case "-c":
      case "--connectionString":
        connectionString = value;
        break;
      case "-u":
      case "--username":
        user = value;
        break;
      case "-p":
      case "--password":
        password = value;
        break;
      case "--historyFile":
        historyFile = value;
        break;
      case "--maxHistorySize":
        try {
          maxHistorySize = Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw error("Invalid value for --maxHistorySize: " + value);
        }
        if (maxHistorySize < 0) {
          throw error("Invalid value for --maxHistorySize: " + value);
        }
        break;
      default:
        throw error("Unknown argument " + arg);
      }
    }
    if (connectionString == null) {
      throw error("Missing argument --connectionString");
    }
    if (user == null) {
      throw error("Missing argument --username");
    }
    if (historyFile == null) {
      final String home = env.apply("HOME");
      if (home != null) {
        historyFile = new File(home, SqlPlusPlus.HISTORY_FILE_NAME).getPath();
      }
    }
    return new Options(connectionString, user, password, historyFile,
        maxHistorySize);
  }

  private ParseException error(String error) {
    out.println(error);
    out.println();
    usage();
    return new ParseException(2);
  }

  private void usage() {
    for (String line : USAGE_LINES) {
      out.println(line);
    }
  }

  /** Parsed command-line arguments. */
  static class Options {
    final String connectionString;
    final String user;
    /** Password, or null if the user is to be prompted. */
    final @Nullable String password;
    /** History file, or null if history is not to be kept. */
    final @Nullable String historyFile;
    final int maxHistorySize;

    Options(String connectionString, String user, @Nullable String password,
        @Nullable String historyFile, int maxHistorySize) {
      this.connectionString = connectionString;
      this.user = user;
      this.password = password;
      this.historyFile = historyFile;
      this.maxHistorySize = maxHistorySize;
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
