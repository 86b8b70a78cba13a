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

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests {@link CommandDispatcher}. */
class CommandDispatcherTest {
  private final CommandDispatcher dispatcher = new CommandDispatcher();

  @Test void testExit() {
    assertThat(dispatcher.parse(".exit"),
        instanceOf(CommandDispatcher.ExitCommand.class));
    assertThat(dispatcher.parse("  .exit  "),
        instanceOf(CommandDispatcher.ExitCommand.class));
    // Commands are case-sensitive; this is SQL
    assertThat(dispatcher.parse(".EXIT"),
        instanceOf(CommandDispatcher.SqlCommand.class));
  }

  @Test void testIterate() {
    assertThat(dispatcher.parse(".it"),
        instanceOf(CommandDispatcher.IterateCommand.class));
    assertThat(dispatcher.parse("\t.it "),
        instanceOf(CommandDispatcher.IterateCommand.class));
    assertThat(dispatcher.parse(".iterate"),
        instanceOf(CommandDispatcher.SqlCommand.class));
  }

  @Test void testDescribe() {
    final Command command = dispatcher.parse(".describe EMP");
    assertThat(command, instanceOf(CommandDispatcher.DescribeCommand.class));
    assertThat(((CommandDispatcher.DescribeCommand) command).tableName,
        is("EMP"));
    assertThat(command.describe(), is("DescribeCommand [table: EMP]"));

    // Table name is taken verbatim after the prefix
    final Command command2 = dispatcher.parse(" .describe  emp ");
    assertThat(((CommandDispatcher.DescribeCommand) command2).tableName,
        is(" emp"));

    // Without a table name, the line is not a describe command
    assertThat(dispatcher.parse(".describe"),
        instanceOf(CommandDispatcher.SqlCommand.class));
  }

  @Test void testSql() {
    final Command command = dispatcher.parse("  select * from emp ");
    assertThat(command, instanceOf(CommandDispatcher.SqlCommand.class));
    assertThat(((CommandDispatcher.SqlCommand) command).sql,
        is("select * from emp"));
    assertThat(command.describe(), is("SqlCommand [sql: select * from emp]"));
  }

  @Test void testEmpty() {
    assertThrows(IllegalArgumentException.class, () -> dispatcher.parse(""));
    assertThrows(IllegalArgumentException.class,
        () -> dispatcher.parse("   "));
  }
}

// End CommandDispatcherTest.java
