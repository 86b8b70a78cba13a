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

import net.hydromatic.scott.data.hsqldb.ScottHsqldb;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link StatementSlot}. */
class StatementSlotTest {
  @Test void testLifecycle() throws Exception {
    try (Connection connection =
             DriverManager.getConnection(ScottHsqldb.URI, ScottHsqldb.USER,
                 ScottHsqldb.PASSWORD)) {
      final StatementSlot slot = new StatementSlot();
      assertThat(slot.state(), is(StatementSlot.State.IDLE));
      assertThat(slot.isActive(), is(false));
      assertThrows(IllegalStateException.class, slot::active);

      final ActiveStatement s1 =
          ActiveStatement.prepare(connection, "select * from scott.emp");
      slot.activate(s1);
      assertThat(slot.state(), is(StatementSlot.State.ACTIVE));
      assertThat(slot.active(), sameInstance(s1));

      // Activating another statement closes the first
      final ActiveStatement s2 =
          ActiveStatement.prepare(connection, "select * from scott.dept");
      slot.activate(s2);
      assertThat(s1.isClosed(), is(true));
      assertThat(s2.isClosed(), is(false));
      assertThat(slot.active(), sameInstance(s2));

      slot.clear();
      assertThat(s2.isClosed(), is(true));
      assertThat(slot.state(), is(StatementSlot.State.IDLE));

      // Clearing an idle slot has no effect
      slot.clear();
      assertThat(slot.state(), is(StatementSlot.State.IDLE));
    }
  }
}

// End StatementSlotTest.java
