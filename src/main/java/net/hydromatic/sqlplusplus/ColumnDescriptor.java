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

import com.google.common.collect.ImmutableList;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Name and native type of a column of a statement's result. */
public class ColumnDescriptor {
  /** Column label, as the statement names it. */
  public final String name;
  /** Ordinal, 1-based. */
  public final int ordinal;
  public final NativeType type;
  /** Database type name, for example "VARCHAR2". */
  public final String typeName;
  /** Whether each value carries its own time zone offset; only
   * {@link NativeType#TIMESTAMP} columns can be zoned. */
  public final boolean zoned;

  public ColumnDescriptor(String name, int ordinal, NativeType type,
      String typeName, boolean zoned) {
    this.name = requireNonNull(name, "name");
    this.ordinal = ordinal;
    this.type = requireNonNull(type, "type");
    this.typeName = requireNonNull(typeName, "typeName");
    this.zoned = zoned;
  }

  public ColumnDescriptor(String name, int ordinal, NativeType type,
      String typeName) {
    this(name, ordinal, type, typeName, false);
  }

  /** Describes every column of a result set. */
  static ImmutableList<ColumnDescriptor> describe(ResultSetMetaData metaData)
      throws SQLException {
    final ImmutableList.Builder<ColumnDescriptor> b = ImmutableList.builder();
    final int n = metaData.getColumnCount();
    for (int i = 1; i <= n; i++) {
      final int jdbcType = metaData.getColumnType(i);
      final NativeType type =
          NativeType.of(jdbcType, metaData.getPrecision(i),
              metaData.getScale(i), metaData.isSigned(i));
      final String typeName = metaData.getColumnTypeName(i);
      b.add(
          new ColumnDescriptor(metaData.getColumnLabel(i), i, type,
              typeName == null ? type.name() : typeName,
              NativeType.isZoned(jdbcType)));
    }
    return b.build();
  }

  @Override public String toString() {
    return name + ":" + typeName + "(" + type + ")";
  }
}

// End ColumnDescriptor.java
