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

import com.google.common.collect.ImmutableList;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Fetches the rows of an {@link ActiveStatement} a page at a time.
 *
 * <p>The pager keeps the statement's cursor one row ahead of the rows it
 * has returned. After reading the last row of a page it advances once
 * more; if that fails, the page is the last one and is marked
 * {@link ResultPage#wasExhausted exhausted}. So a result set of N rows
 * fetched in pages of P rows yields pages of P rows and a final page of
 * the remainder (or P, if N is a multiple of P), and only the final page is
 * marked exhausted.
 *
 * <p>Columns are read in order of their ordinal, 1-based. */
public class ResultPager {
  /** Page size for interactive fetches. */
  public static final int DEFAULT_PAGE_SIZE = 20;

  /** Page size that returns all remaining rows in one page. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  /** Fetches up to {@code maxRows} rows.
   *
   * <p>If the statement has no rows at all, returns an empty page that is
   * marked exhausted.
   *
   * @param statement Executed statement with a result set
   * @param maxRows Maximum number of rows; must be positive
   */
  public ResultPage fetchPage(ActiveStatement statement, int maxRows)
      throws SQLException {
    if (maxRows <= 0) {
      throw new IllegalArgumentException("maxRows must be positive: "
          + maxRows);
    }
    if (statement.cursor() == ActiveStatement.Cursor.BEFORE_FIRST) {
      if (!statement.advance()) {
        return new ResultPage(ImmutableList.of(), ImmutableList.of(), true);
      }
    }
    final List<ColumnDescriptor> columns = statement.columns();
    final List<ImmutableList<String>> rows = new ArrayList<>();
    final List<List<Integer>> nullCells = new ArrayList<>();
    while (rows.size() < maxRows && !statement.isExhausted()) {
      final ImmutableList.Builder<String> row = ImmutableList.builder();
      final List<Integer> nulls = new ArrayList<>();
      for (ColumnDescriptor column : columns) {
        final CellValue value = statement.read(column);
        if (value.isNull()) {
          nulls.add(column.ordinal - 1);
        }
        row.add(ValueFormatter.format(value));
      }
      rows.add(row.build());
      nullCells.add(nulls);
      statement.advance();
    }
    return new ResultPage(rows, nullCells, statement.isExhausted());
  }
}

// End ResultPager.java
