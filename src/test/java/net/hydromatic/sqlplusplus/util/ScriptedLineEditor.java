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
package net.hydromatic.sqlplusplus.util;

import net.hydromatic.sqlplusplus.LineEditor;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Line editor that returns lines from a script, remembers the prompts it
 * was asked to display, and keeps history in memory.
 *
 * <p>History files contain one line per entry. */
public class ScriptedLineEditor implements LineEditor {
  private final Deque<String> lines;
  private final Deque<String> passwords = new ArrayDeque<>();
  private final List<String> prompts = new ArrayList<>();
  private final List<String> history = new ArrayList<>();
  private int maxHistoryLength = Integer.MAX_VALUE;
  private boolean closed;

  public ScriptedLineEditor(List<String> lines) {
    this.lines = new ArrayDeque<>(lines);
  }

  public ScriptedLineEditor(String... lines) {
    this(ImmutableList.copyOf(lines));
  }

  /** Adds a response to the next password prompt. */
  public ScriptedLineEditor withPassword(String password) {
    passwords.add(password);
    return this;
  }

  @Override public @Nullable String readLine(String prompt) {
    prompts.add(prompt);
    return lines.poll();
  }

  @Override public @Nullable String readPassword(String prompt) {
    prompts.add(prompt);
    return passwords.poll();
  }

  @Override public void loadHistory(String path) throws IOException {
    history.clear();
    final File file = new File(path);
    if (file.exists()) {
      for (String line : Files.asCharSource(file, Charsets.UTF_8)
          .readLines()) {
        addHistory(line);
      }
    }
  }

  @Override public void addHistory(String line) {
    history.add(line);
    while (history.size() > maxHistoryLength) {
      history.remove(0);
    }
  }

  @Override public void saveHistory(String path) throws IOException {
    final StringBuilder b = new StringBuilder();
    for (String line : history) {
      b.append(line).append('\n');
    }
    Files.asCharSink(new File(path), Charsets.UTF_8).write(b);
  }

  @Override public void setMaxHistoryLength(int maxLength) {
    this.maxHistoryLength = maxLength;
  }

  @Override public void close() {
    closed = true;
  }

  /** Returns the prompts displayed so far. */
  public ImmutableList<String> prompts() {
    return ImmutableList.copyOf(prompts);
  }

  /** Returns the lines currently in the history. */
  public ImmutableList<String> history() {
    return ImmutableList.copyOf(history);
  }

  public boolean isClosed() {
    return closed;
  }
}

// End ScriptedLineEditor.java
