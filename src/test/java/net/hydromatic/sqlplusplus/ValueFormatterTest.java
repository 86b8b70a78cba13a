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

import java.lang.reflect.Proxy;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link ValueFormatter} and {@link NativeType}. */
class ValueFormatterTest {
  private static String format(NativeType type, Object payload) {
    return ValueFormatter.format(CellValue.of(type, payload));
  }

  @Test void testNull() {
    for (NativeType type : NativeType.values()) {
      assertThat(ValueFormatter.format(CellValue.ofNull(type)), is("<null>"));
    }
  }

  @Test void testBoolean() {
    assertThat(format(NativeType.BOOLEAN, true), is("TRUE"));
    assertThat(format(NativeType.BOOLEAN, false), is("FALSE"));
  }

  @Test void testBytes() {
    assertThat(format(NativeType.BYTES, "ab c"), is("\"ab c\""));
    assertThat(format(NativeType.BYTES, ""), is("\"\""));
    // Embedded quotes are not escaped
    assertThat(format(NativeType.BYTES, "say \"hi\""), is("\"say \"hi\"\""));
  }

  @Test void testNumbers() {
    assertThat(format(NativeType.DOUBLE, 1.5d), is("1.5"));
    assertThat(format(NativeType.DOUBLE, 800d), is("800.0"));
    assertThat(format(NativeType.FLOAT, 0.25f), is("0.25"));
    assertThat(format(NativeType.INT64, -42L), is("-42"));
    assertThat(format(NativeType.INT64, Long.MIN_VALUE),
        is("-9223372036854775808"));
    assertThat(format(NativeType.UINT64, 42L), is("42"));
    assertThat(format(NativeType.UINT64, -1L), is("18446744073709551615"));
  }

  @Test void testTimestamp() {
    final OffsetDateTime t =
        OffsetDateTime.of(2024, 1, 5, 3, 4, 5, 120_000_000,
            ZoneOffset.ofHours(-5));
    assertThat(format(NativeType.TIMESTAMP, t),
        is("2024-1-5 3:4:5.120000000 Z-5"));

    final OffsetDateTime t2 =
        OffsetDateTime.of(1999, 12, 31, 23, 59, 0, 0, ZoneOffset.ofHours(9));
    assertThat(format(NativeType.TIMESTAMP, t2),
        is("1999-12-31 23:59:0.0 Z9"));

    final OffsetDateTime t3 =
        OffsetDateTime.of(2000, 2, 29, 0, 0, 0, 7, ZoneOffset.UTC);
    assertThat(format(NativeType.TIMESTAMP, t3), is("2000-2-29 0:0:0.7 Z0"));
  }

  @Test void testTimestampFractionalOffset() {
    // Offsets are shown in whole hours, truncated
    final OffsetDateTime t =
        OffsetDateTime.of(2024, 6, 1, 12, 0, 0, 0,
            ZoneOffset.ofHoursMinutes(5, 30));
    assertThat(format(NativeType.TIMESTAMP, t), is("2024-6-1 12:0:0.0 Z5"));
  }

  /** Reading a timestamp uses the zone flag of the column, and does not
   * consult the result set's metadata for each value. */
  @Test void testReadTimestamp() throws SQLException {
    final OffsetDateTime t =
        OffsetDateTime.of(2024, 1, 5, 3, 4, 5, 120_000_000,
            ZoneOffset.ofHours(-5));
    final ResultSet resultSet = (ResultSet) Proxy.newProxyInstance(
        ValueFormatterTest.class.getClassLoader(),
        new Class[]{ResultSet.class}, (proxy, method, args) -> {
          if (method.getName().equals("getObject")
              && args.length == 2
              && args[0].equals(3)
              && args[1] == OffsetDateTime.class) {
            return t;
          }
          throw new AssertionError("unexpected call " + method.getName());
        });
    final ColumnDescriptor column =
        new ColumnDescriptor("TS", 3, NativeType.TIMESTAMP,
            "TIMESTAMP WITH TIME ZONE", true);
    final CellValue value = CellValue.read(resultSet, column);
    assertThat(ValueFormatter.format(value),
        is("2024-1-5 3:4:5.120000000 Z-5"));
  }

  @Test void testUnsupported() {
    assertThat(format(NativeType.OTHER, new Object()),
        is("unsupported type"));
    assertThat(format(NativeType.OTHER, "abc"), is("unsupported type"));
  }

  @Test void testNumeric() {
    assertThat(NativeType.INT64.isNumeric(), is(true));
    assertThat(NativeType.UINT64.isNumeric(), is(true));
    assertThat(NativeType.DOUBLE.isNumeric(), is(true));
    assertThat(NativeType.FLOAT.isNumeric(), is(true));
    assertThat(NativeType.BYTES.isNumeric(), is(false));
    assertThat(NativeType.BOOLEAN.isNumeric(), is(false));
    assertThat(NativeType.TIMESTAMP.isNumeric(), is(false));
    assertThat(NativeType.OTHER.isNumeric(), is(false));
  }

  @Test void testClassify() {
    assertThat(NativeType.of(Types.BOOLEAN, 0, 0, false),
        is(NativeType.BOOLEAN));
    assertThat(NativeType.of(Types.VARCHAR, 10, 0, false),
        is(NativeType.BYTES));
    assertThat(NativeType.of(Types.VARBINARY, 4, 0, false),
        is(NativeType.BYTES));
    assertThat(NativeType.of(Types.INTEGER, 10, 0, true),
        is(NativeType.INT64));
    assertThat(NativeType.of(Types.BIGINT, 20, 0, false),
        is(NativeType.UINT64));
    assertThat(NativeType.of(Types.REAL, 0, 0, true), is(NativeType.FLOAT));
    assertThat(NativeType.of(NativeType.ORACLE_BINARY_FLOAT, 0, 0, true),
        is(NativeType.FLOAT));
    assertThat(NativeType.of(NativeType.ORACLE_BINARY_DOUBLE, 0, 0, true),
        is(NativeType.DOUBLE));
    assertThat(NativeType.of(Types.TIMESTAMP_WITH_TIMEZONE, 0, 0, false),
        is(NativeType.TIMESTAMP));
    assertThat(NativeType.of(NativeType.ORACLE_TIMESTAMPTZ, 0, 0, false),
        is(NativeType.TIMESTAMP));
    assertThat(NativeType.of(Types.TIME, 0, 0, false), is(NativeType.OTHER));
    assertThat(NativeType.of(Types.CLOB, 0, 0, false), is(NativeType.OTHER));
  }

  /** Oracle reports every NUMBER column as NUMERIC; integral ones that fit
   * in a long are integers, the rest are doubles. */
  @Test void testClassifyNumber() {
    assertThat(NativeType.of(Types.NUMERIC, 4, 0, true),
        is(NativeType.INT64));
    assertThat(NativeType.of(Types.NUMERIC, 18, 0, true),
        is(NativeType.INT64));
    assertThat(NativeType.of(Types.NUMERIC, 19, 0, true),
        is(NativeType.DOUBLE));
    assertThat(NativeType.of(Types.NUMERIC, 7, 2, true),
        is(NativeType.DOUBLE));
    // Unconstrained NUMBER has precision 0
    assertThat(NativeType.of(Types.NUMERIC, 0, -127, true),
        is(NativeType.DOUBLE));
  }
}

// End ValueFormatterTest.java
