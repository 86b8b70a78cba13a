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

import java.sql.ResultSet;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Value of one column in one row, tagged with its native type.
 *
 * <p>A null payload means SQL NULL. */
public class CellValue {
  public final NativeType type;
  public final @Nullable Object payload;

  private CellValue(NativeType type, @Nullable Object payload) {
    this.type = requireNonNull(type, "type");
    this.payload = payload;
  }

  /** Creates a value. */
  public static CellValue of(NativeType type, @Nullable Object payload) {
    return new CellValue(type, payload);
  }

  /** Creates a null value of a given type. */
  public static CellValue ofNull(NativeType type) {
    return new CellValue(type, null);
  }

  /** Reads a column of the current row of a result set. */
  static CellValue read(ResultSet resultSet, ColumnDescriptor column)
      throws SQLException {
    return new CellValue(column.type, column.type.read(resultSet, column));
  }

  public boolean isNull() {
    return payload == null;
  }

  @Override public String toString() {
    return type + ":" + payload;
  }
}

// End CellValue.java
