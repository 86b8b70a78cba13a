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

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Native type of a column value, as classified by the driver.
 *
 * <p>Each constant knows how to read a value of its type from the current
 * row of a {@link ResultSet}, and how to render a non-null value as text.
 * A read method returns null if and only if the value is SQL NULL. */
public enum NativeType {
  /** Rendered as {@code TRUE} or {@code FALSE}. */
  BOOLEAN {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      final boolean b = resultSet.getBoolean(column.ordinal);
      return resultSet.wasNull() ? null : b;
    }

    @Override public String render(Object value) {
      return (Boolean) value ? "TRUE" : "FALSE";
    }
  },

  /** Character or binary data, rendered in double quotes. Embedded quotes
   * are not escaped. */
  BYTES {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      return resultSet.getString(column.ordinal);
    }

    @Override public String render(Object value) {
      return "\"" + value + "\"";
    }
  },

  DOUBLE {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      final double d = resultSet.getDouble(column.ordinal);
      return resultSet.wasNull() ? null : d;
    }

    @Override public String render(Object value) {
      return Double.toString((Double) value);
    }

    @Override public boolean isNumeric() {
      return true;
    }
  },

  FLOAT {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      final float f = resultSet.getFloat(column.ordinal);
      return resultSet.wasNull() ? null : f;
    }

    @Override public String render(Object value) {
      return Float.toString((Float) value);
    }

    @Override public boolean isNumeric() {
      return true;
    }
  },

  INT64 {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      final long n = resultSet.getLong(column.ordinal);
      return resultSet.wasNull() ? null : n;
    }

    @Override public String render(Object value) {
      return Long.toString((Long) value);
    }

    @Override public boolean isNumeric() {
      return true;
    }
  },

  /** Unsigned 64-bit integer. The value is held in a {@code long}, and
   * rendered without a sign even if the top bit is set. */
  UINT64 {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      final BigDecimal d = resultSet.getBigDecimal(column.ordinal);
      return d == null ? null : d.toBigInteger().longValue();
    }

    @Override public String render(Object value) {
      return Long.toUnsignedString((Long) value);
    }

    @Override public boolean isNumeric() {
      return true;
    }
  },

  /** Date-time with a time zone offset.
   *
   * <p>Rendered as "{@code year-month-day hour:minute:second.nanos Zoffset}",
   * each field without zero-padding, and the offset in whole hours; for
   * example "{@code 2024-1-5 3:4:5.120000000 Z-5}". */
  TIMESTAMP {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      if (column.zoned) {
        return resultSet.getObject(column.ordinal, OffsetDateTime.class);
      }
      final Timestamp t = resultSet.getTimestamp(column.ordinal);
      return t == null
          ? null
          : t.toLocalDateTime().atOffset(ZoneOffset.UTC);
    }

    @Override public String render(Object value) {
      final OffsetDateTime t = (OffsetDateTime) value;
      return t.getYear() + "-" + t.getMonthValue() + "-" + t.getDayOfMonth()
          + " " + t.getHour() + ":" + t.getMinute() + ":" + t.getSecond()
          + "." + t.getNano()
          + " Z" + t.getOffset().getTotalSeconds() / 3600;
    }
  },

  /** A type that cannot be displayed. The value is read only to find out
   * whether it is null. */
  OTHER {
    @Override public @Nullable Object read(ResultSet resultSet,
        ColumnDescriptor column) throws SQLException {
      return resultSet.getObject(column.ordinal);
    }

    @Override public String render(Object value) {
      return "unsupported type";
    }
  };

  /** Oracle's {@code BINARY_FLOAT} (oracle.jdbc.OracleTypes). */
  static final int ORACLE_BINARY_FLOAT = 100;
  /** Oracle's {@code BINARY_DOUBLE}. */
  static final int ORACLE_BINARY_DOUBLE = 101;
  /** Oracle's {@code TIMESTAMP WITH TIME ZONE}. */
  static final int ORACLE_TIMESTAMPTZ = -101;
  /** Oracle's {@code TIMESTAMP WITH LOCAL TIME ZONE}. */
  static final int ORACLE_TIMESTAMPLTZ = -102;

  /** Largest precision of a scale-0 decimal that always fits in a
   * {@code long}. */
  private static final int MAX_LONG_PRECISION = 18;

  /** Reads the value of a column in the current row.
   *
   * @param resultSet Result set positioned on a row
   * @param column Column, described when the statement was executed
   * @return Value, or null if the value is SQL NULL
   */
  public abstract @Nullable Object read(ResultSet resultSet,
      ColumnDescriptor column) throws SQLException;

  /** Renders a non-null value of this type. */
  public abstract String render(Object value);

  /** Returns whether values of this type are numbers, and should be
   * right-justified. */
  public boolean isNumeric() {
    return false;
  }

  /** Returns whether values of a JDBC column type carry their own time zone
   * offset. */
  public static boolean isZoned(int jdbcType) {
    return jdbcType == Types.TIMESTAMP_WITH_TIMEZONE
        || jdbcType == ORACLE_TIMESTAMPTZ;
  }

  /** Classifies a JDBC column type.
   *
   * @param jdbcType Type code, per {@link Types} or the Oracle driver
   * @param precision Precision (0 if not known)
   * @param scale Scale
   * @param signed Whether the driver reports the column as signed
   */
  public static NativeType of(int jdbcType, int precision, int scale,
      boolean signed) {
    switch (jdbcType) {
    case Types.BOOLEAN:
    case Types.BIT:
      return BOOLEAN;
    case Types.CHAR:
    case Types.VARCHAR:
    case Types.LONGVARCHAR:
    case Types.NCHAR:
    case Types.NVARCHAR:
    case Types.LONGNVARCHAR:
    case Types.BINARY:
    case Types.VARBINARY:
    case Types.LONGVARBINARY:
      return BYTES;
    case Types.TINYINT:
    case Types.SMALLINT:
    case Types.INTEGER:
    case Types.BIGINT:
      return signed ? INT64 : UINT64;
    case Types.NUMERIC:
    case Types.DECIMAL:
      return scale == 0 && precision > 0 && precision <= MAX_LONG_PRECISION
          ? INT64
          : DOUBLE;
    case Types.DOUBLE:
    case Types.FLOAT:
    case ORACLE_BINARY_DOUBLE:
      return DOUBLE;
    case Types.REAL:
    case ORACLE_BINARY_FLOAT:
      return FLOAT;
    case Types.DATE:
    case Types.TIMESTAMP:
    case Types.TIMESTAMP_WITH_TIMEZONE:
    case ORACLE_TIMESTAMPTZ:
    case ORACLE_TIMESTAMPLTZ:
      return TIMESTAMP;
    default:
      return OTHER;
    }
  }
}

// End NativeType.java
