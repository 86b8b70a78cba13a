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

import java.io.Closeable;
import java.io.IOException;

/** Source of input lines, with a line-editing history.
 *
 * @see JLineEditor
 */
public interface LineEditor extends Closeable {
  /** Reads a line.
   *
   * @param prompt Prompt to display
   * @return Line without its terminator, or null at end of input
   */
  @Nullable String readLine(String prompt) throws IOException;

  /** Reads a line without echoing it.
   *
   * <p>Masking lasts only for the duration of the call, including when the
   * call fails. The line is never recorded in the history.
   *
   * @return Line, or null at end of input
   */
  @Nullable String readPassword(String prompt) throws IOException;

  /** Whether the terminal understands ANSI escape sequences. */
  default boolean supportsAnsi() {
    return false;
  }

  /** Replaces the history with the contents of a file. A file that does not
   * exist is treated as empty. */
  void loadHistory(String path) throws IOException;

  /** Appends a line to the history. */
  void addHistory(String line);

  /** Writes the history to a file. */
  void saveHistory(String path) throws IOException;

  /** Sets the maximum number of lines kept in the history. */
  void setMaxHistoryLength(int maxLength);

  /** Creates a {@link LineEditor}. */
  @FunctionalInterface
  interface Factory {
    LineEditor create() throws IOException;
  }
}

// End LineEditor.java
