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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** A prepared statement and, once executed, the cursor over its results.
 *
 * <p>Lifecycle: {@link #prepare}, optionally {@link #bind}, then
 * {@link #execute}, then zero or more calls to {@link #advance} and
 * {@link #read}, then {@link #close}. A statement is never re-executed. */
public class ActiveStatement implements AutoCloseable {
  /** Position of the cursor. */
  enum Cursor {
    /** Executed, but no row has been requested yet. */
    BEFORE_FIRST,
    /** Positioned on a row that has not been read. */
    ON_ROW,
    /** The driver has reported that there are no more rows. */
    AFTER_LAST
  }

  final String sql;
  private final PreparedStatement statement;
  private @Nullable ResultSet resultSet;
  private ImmutableList<ColumnDescriptor> columns = ImmutableList.of();
  private int updateCount = -1;
  private Cursor cursor = Cursor.BEFORE_FIRST;
  private boolean closed;

  private ActiveStatement(String sql, PreparedStatement statement) {
    this.sql = requireNonNull(sql, "sql");
    this.statement = requireNonNull(statement, "statement");
  }

  /** Prepares a statement. */
  static ActiveStatement prepare(Connection connection, String sql)
      throws DatabaseException {
    try {
      return new ActiveStatement(sql, connection.prepareStatement(sql));
    } catch (SQLException e) {
      throw new DatabaseException("preparing statement", e);
    }
  }

  /** Binds a string value to a parameter. */
  ActiveStatement bind(int position, String value) throws DatabaseException {
    checkOpen();
    try {
      statement.setString(position, value);
    } catch (SQLException e) {
      throw new DatabaseException("binding parameter", e);
    }
    return this;
  }

  /** Executes the statement.
   *
   * <p>If the statement is a query, describes its columns.
   *
   * @return whether the statement returned a result set
   */
  boolean execute() throws DatabaseException {
    checkOpen();
    Preconditions.checkState(resultSet == null && updateCount < 0,
        "statement already executed");
    try {
      if (statement.execute()) {
        resultSet = statement.getResultSet();
        columns = ColumnDescriptor.describe(resultSet.getMetaData());
        return true;
      }
      updateCount = statement.getUpdateCount();
      return false;
    } catch (SQLException e) {
      throw new DatabaseException("executing statement", e);
    }
  }

  /** Returns the number of rows modified by a statement that did not
   * return a result set. */
  int updateCount() {
    return updateCount;
  }

  /** Returns the columns of the result set; fixed once executed. */
  public ImmutableList<ColumnDescriptor> columns() {
    return columns;
  }

  Cursor cursor() {
    return cursor;
  }

  /** Moves to the next row.
   *
   * @return whether there is a row
   */
  boolean advance() throws SQLException {
    final ResultSet r = openResultSet();
    Preconditions.checkState(cursor != Cursor.AFTER_LAST,
        "result set is exhausted");
    cursor = r.next() ? Cursor.ON_ROW : Cursor.AFTER_LAST;
    return cursor == Cursor.ON_ROW;
  }

  /** Reads a column of the current row. */
  CellValue read(ColumnDescriptor column) throws SQLException {
    final ResultSet r = openResultSet();
    Preconditions.checkState(cursor == Cursor.ON_ROW, "not on a row");
    return CellValue.read(r, column);
  }

  public boolean isExhausted() {
    return cursor == Cursor.AFTER_LAST;
  }

  public boolean isClosed() {
    return closed;
  }

  private ResultSet openResultSet() {
    checkOpen();
    Preconditions.checkState(resultSet != null,
        "statement has not returned a result set");
    return resultSet;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "statement is closed");
  }

  /** Closes the statement and its result set. Subsequent calls have no
   * effect. */
  @Override public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (resultSet != null) {
        resultSet.close();
      }
    } finally {
      statement.close();
    }
  }

  @Override public String toString() {
    return "ActiveStatement[" + sql + ", " + cursor + "]";
  }
}

// End ActiveStatement.java
