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

import java.io.PrintWriter;
import java.sql.Connection;

/** Command entered at the prompt.
 *
 * @see CommandDispatcher
 */
public interface Command {
  /** Returns a string describing this command.
   *
   * <p>For example: "SqlCommand [sql: select * from emp]"
   * or "IterateCommand". */
  String describe();

  /** Executes this command.
   *
   * @param x Execution context
   *
   * @throws DatabaseException if the database reports an error; the
   * session reports it and carries on
   */
  void execute(Context x) throws DatabaseException;

  /** Execution context for a command. */
  interface Context {
    /** Writer for results and messages. */
    PrintWriter writer();

    Connection connection();

    /** The slot holding the active statement. */
    StatementSlot statements();

    /** Number of rows to fetch for an interactive page. */
    int pageSize();

    /** Fetches a page of at most {@code maxRows} rows from the active
     * statement and prints it.
     *
     * <p>If the result set ended during the fetch, closes the statement and
     * leaves the slot idle. */
    void showPage(int maxRows) throws DatabaseException;

    /** Records a line in the history. */
    void addHistory(String line);

    /** Asks the session to stop after this command. */
    void exit();
  }
}

// End Command.java
