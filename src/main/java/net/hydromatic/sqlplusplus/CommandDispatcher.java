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

import static java.util.Objects.requireNonNull;

/** Converts logical lines into commands.
 *
 * <p>The line is trimmed, then classified; the first match wins:
 *
 * <ol>
 *   <li>{@code .exit} ends the session;</li>
 *   <li>{@code .it} fetches the next page of the active statement;</li>
 *   <li>{@code .describe name} lists the columns of table {@code name};</li>
 *   <li>anything else is SQL, sent to the database verbatim.</li>
 * </ol>
 */
public class CommandDispatcher {
  public static final String EXIT = ".exit";
  public static final String ITERATE = ".it";
  public static final String DESCRIBE_PREFIX = ".describe ";

  /** Creates a command for a logical line.
   *
   * @param line Logical line; must contain a non-space character
   */
  public Command parse(String line) {
    final String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("empty line");
    }
    if (trimmed.equals(EXIT)) {
      return new ExitCommand();
    }
    if (trimmed.equals(ITERATE)) {
      return new IterateCommand();
    }
    if (trimmed.startsWith(DESCRIBE_PREFIX)) {
      return new DescribeCommand(line,
          trimmed.substring(DESCRIBE_PREFIX.length()));
    }
    return new SqlCommand(line, trimmed);
  }

  /** Base class for commands that know the line they were parsed from. */
  abstract static class SimpleCommand implements Command {
    /** Logical line as entered. */
    protected final String line;

    SimpleCommand(String line) {
      this.line = requireNonNull(line, "line");
    }
  }

  /** Command that ends the session. */
  static class ExitCommand implements Command {
    @Override public String describe() {
      return "ExitCommand";
    }

    @Override public void execute(Context x) {
      x.exit();
    }
  }

  /** Command that fetches the next page of the active statement. */
  static class IterateCommand implements Command {
    @Override public String describe() {
      return "IterateCommand";
    }

    @Override public void execute(Context x) throws DatabaseException {
      if (!x.statements().isActive()) {
        x.writer().println("No active statement");
        return;
      }
      x.showPage(x.pageSize());
    }
  }

  /** Command that prints the columns of a table, by querying the Oracle
   * data dictionary.
   *
   * <p>The statement supersedes the active statement, and its result is
   * printed in one page. The line is added to the history before the query
   * runs. */
  static class DescribeCommand extends SimpleCommand {
    static final String DESCRIBE_SQL = "select column_name as \"Name\", "
        + "nullable as \"Null?\", "
        + "concat(concat(concat(data_type,'('),data_length),')') as \"Type\" "
        + "from all_tab_columns where table_name = ?";

    final String tableName;

    DescribeCommand(String line, String tableName) {
      super(line);
      this.tableName = requireNonNull(tableName, "tableName");
    }

    @Override public String describe() {
      return "DescribeCommand [table: " + tableName + "]";
    }

    @Override public void execute(Context x) throws DatabaseException {
      // Recorded even if the query fails, unlike SQL
      x.addHistory(line);
      x.statements().clear();
      final ActiveStatement statement =
          ActiveStatement.prepare(x.connection(), DESCRIBE_SQL);
      x.statements().activate(statement);
      statement.bind(1, tableName);
      statement.execute();
      x.showPage(ResultPager.UNBOUNDED);
    }
  }

  /** Command that executes a SQL statement and prints the first page of its
   * result. */
  static class SqlCommand extends SimpleCommand {
    final String sql;

    SqlCommand(String line, String sql) {
      super(line);
      this.sql = requireNonNull(sql, "sql");
    }

    @Override public String describe() {
      return "SqlCommand [sql: " + sql + "]";
    }

    @Override public void execute(Context x) throws DatabaseException {
      x.statements().clear();
      final ActiveStatement statement =
          ActiveStatement.prepare(x.connection(), sql);
      x.statements().activate(statement);
      final boolean query = statement.execute();
      x.addHistory(line);
      if (!query) {
        final int updateCount = statement.updateCount();
        x.statements().clear();
        x.writer().println("(" + updateCount
            + (updateCount == 1 ? " row" : " rows")
            + " modified)");
        return;
      }
      x.showPage(x.pageSize());
    }
  }
}

// End CommandDispatcher.java
