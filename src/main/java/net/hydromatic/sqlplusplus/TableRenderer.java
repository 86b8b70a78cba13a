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

import com.google.common.base.Strings;

import java.io.PrintWriter;
import java.util.List;

/** Prints a page of rows as a text table.
 *
 * <p>Example:
 *
 * <blockquote><pre>
 *   +--------+--------+--------+
 *   | ENAME  | DEPTNO | COMM   |
 *   +--------+--------+--------+
 *   | "KING" |     10 | &lt;null&gt; |
 *   +--------+--------+--------+
 * </pre></blockquote>
 *
 * <p>Numeric columns are right-justified. If styling is enabled, the header
 * is bold and null values are italic, using ANSI escape sequences; widths
 * are computed without them. */
public class TableRenderer {
  private static final String BOLD = "\u001B[1m";
  private static final String ITALIC = "\u001B[3m";
  private static final String RESET = "\u001B[0m";

  private final boolean styled;

  public TableRenderer(boolean styled) {
    this.styled = styled;
  }

  /** Prints a page. */
  public void render(List<ColumnDescriptor> columns, ResultPage page,
      PrintWriter w) {
    final int n = columns.size();
    final int[] widths = new int[n];
    final boolean[] rights = new boolean[n];
    for (int i = 0; i < n; i++) {
      widths[i] = columns.get(i).name.length();
      rights[i] = columns.get(i).type.isNumeric();
    }
    for (List<String> row : page.rows) {
      for (int i = 0; i < n; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    // Compute "+-----+---+"
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < n; i++) {
      buf.append('+').append(Strings.repeat("-", widths[i] + 2));
    }
    buf.append('+');
    final String hyphens = flush(buf);

    // Print "| FOO | B |"
    w.println(hyphens);
    for (int i = 0; i < n; i++) {
      buf.append(i > 0 ? " | " : "| ");
      final String label = pad(columns.get(i).name, widths[i], false);
      buf.append(styled ? BOLD + label + RESET : label);
    }
    buf.append(" |");
    w.println(flush(buf));
    w.println(hyphens);

    for (int r = 0; r < page.size(); r++) {
      final List<String> row = page.rows.get(r);
      for (int i = 0; i < n; i++) {
        buf.append(i > 0 ? " | " : "| ");
        final String s = pad(row.get(i), widths[i], rights[i]);
        buf.append(styled && page.isNull(r, i) ? ITALIC + s + RESET : s);
      }
      buf.append(" |");
      w.println(flush(buf));
    }
    w.println(hyphens);
  }

  private static String pad(String s, int width, boolean right) {
    return right
        ? Strings.padStart(s, width, ' ')
        : Strings.padEnd(s, width, ' ');
  }

  /** Returns the contents of a StringBuilder and clears it for the next use. */
  private static String flush(StringBuilder buf) {
    final String s = buf.toString();
    buf.setLength(0);
    return s;
  }
}

// End TableRenderer.java
