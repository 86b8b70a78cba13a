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

import static java.util.Objects.requireNonNull;

/** Joins raw input lines into logical lines.
 *
 * <p>A line whose last character is {@link #CONTINUATION_MARKER} is held,
 * without its marker, until a line without the marker arrives; then all
 * held fragments and that line are concatenated, in order, into one
 * logical line. Fragments are joined verbatim, with no separator.
 *
 * <p>An empty line in {@link State#NORMAL NORMAL} state yields an empty
 * logical line, which the caller should ignore. */
public class InputAccumulator {
  public static final char CONTINUATION_MARKER = '\\';

  /** State of an {@link InputAccumulator}. */
  public enum State {
    /** No fragments are pending. */
    NORMAL,
    /** The previous line ended with a continuation marker. */
    CONTINUATION
  }

  private final StringBuilder pending = new StringBuilder();
  private State state = State.NORMAL;

  public State state() {
    return state;
  }

  /** Returns whether the previous line ended with a continuation marker,
   * so the next prompt should say that more input is expected. */
  public boolean isContinuing() {
    return state == State.CONTINUATION;
  }

  /** Accepts a line of input.
   *
   * @param line Line, not including the line terminator
   * @return The completed logical line, or null if the line was continued
   */
  public @Nullable String accept(String line) {
    requireNonNull(line, "line");
    if (!line.isEmpty()
        && line.charAt(line.length() - 1) == CONTINUATION_MARKER) {
      pending.append(line, 0, line.length() - 1);
      state = State.CONTINUATION;
      return null;
    }
    pending.append(line);
    final String logicalLine = pending.toString();
    pending.setLength(0);
    state = State.NORMAL;
    return logicalLine;
  }
}

// End InputAccumulator.java
