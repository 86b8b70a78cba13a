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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Holds the session's active statement, if any.
 *
 * <p>The slot is either {@link State#IDLE IDLE} or
 * {@link State#ACTIVE ACTIVE}. At most one statement is active; activating
 * a statement closes the one it supersedes, and clearing the slot closes
 * the active statement. */
public class StatementSlot {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(StatementSlot.class);

  /** State of a {@link StatementSlot}. */
  public enum State {
    /** No active statement; ".it" has nothing to fetch. */
    IDLE,
    /** A statement has been executed and may have unfetched rows. */
    ACTIVE
  }

  private @Nullable ActiveStatement statement;

  public State state() {
    return statement == null ? State.IDLE : State.ACTIVE;
  }

  public boolean isActive() {
    return statement != null;
  }

  /** Returns the active statement.
   *
   * @throws IllegalStateException if the slot is idle
   */
  public ActiveStatement active() {
    Preconditions.checkState(statement != null, "no active statement");
    return statement;
  }

  /** Makes a statement active, closing the previously active statement. */
  public void activate(ActiveStatement statement) {
    requireNonNull(statement, "statement");
    clear();
    LOGGER.debug("Activating {}", statement);
    this.statement = statement;
  }

  /** Closes the active statement, if any, and returns to
   * {@link State#IDLE}. */
  public void clear() {
    final ActiveStatement s = statement;
    if (s == null) {
      return;
    }
    statement = null;
    LOGGER.debug("Clearing {}", s);
    try {
      s.close();
    } catch (SQLException e) {
      LOGGER.warn("Error while closing statement [{}]", s.sql, e);
    }
  }
}

// End StatementSlot.java
