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

/** Converts column values into display text. */
public abstract class ValueFormatter {
  /** Text displayed for a null value of any type. */
  public static final String NULL_TEXT = "<null>";

  private ValueFormatter() {}

  /** Formats a value.
   *
   * <p>Nulls are checked first, regardless of type; every other value is
   * rendered by its {@link NativeType}. */
  public static String format(CellValue value) {
    if (value.payload == null) {
      return NULL_TEXT;
    }
    return value.type.render(value.payload);
  }
}

// End ValueFormatter.java
