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
import com.google.common.collect.ImmutableSortedSet;

import java.util.List;

/** Batch of formatted rows returned by one call to
 * {@link ResultPager#fetchPage(ActiveStatement, int)}.
 *
 * <p>{@link #nullColumns} holds the 0-based index of each column that was
 * null in at least one row of the page; {@link #isNull(int, int)} tells
 * whether a particular cell was null. */
public class ResultPage {
  public final ImmutableList<ImmutableList<String>> rows;
  public final ImmutableSortedSet<Integer> nullColumns;
  /** Whether the result set ended during this fetch. */
  public final boolean wasExhausted;
  /** For each row, the 0-based indexes of its null cells. */
  private final ImmutableList<ImmutableSortedSet<Integer>> nullCells;

  /** Creates a page.
   *
   * @param rows Formatted rows
   * @param nullCells For each row, the indexes of the columns that were
   *   null in that row
   * @param wasExhausted Whether the result set ended during the fetch
   */
  ResultPage(List<ImmutableList<String>> rows,
      List<? extends Iterable<Integer>> nullCells, boolean wasExhausted) {
    Preconditions.checkArgument(rows.size() == nullCells.size(),
        "one null mask per row");
    this.rows = ImmutableList.copyOf(rows);
    final ImmutableList.Builder<ImmutableSortedSet<Integer>> b =
        ImmutableList.builder();
    final ImmutableSortedSet.Builder<Integer> union =
        ImmutableSortedSet.naturalOrder();
    for (Iterable<Integer> mask : nullCells) {
      final ImmutableSortedSet<Integer> set = ImmutableSortedSet.copyOf(mask);
      b.add(set);
      union.addAll(set);
    }
    this.nullCells = b.build();
    this.nullColumns = union.build();
    this.wasExhausted = wasExhausted;
  }

  /** Returns whether the page has no rows. This only happens if the result
   * set had no rows at all. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  /** Returns whether the cell at the given position holds a null value. */
  public boolean isNull(int row, int column) {
    return nullCells.get(row).contains(column);
  }
}

// End ResultPage.java
