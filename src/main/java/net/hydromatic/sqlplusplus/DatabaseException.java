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

import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Error returned by the database driver, with a description of what the
 * client was doing at the time. */
public class DatabaseException extends Exception {
  private final String context;

  /** Creates a DatabaseException.
   *
   * @param context What the client was doing, for example
   *   "executing statement"
   * @param cause Error from the driver
   */
  public DatabaseException(String context, SQLException cause) {
    super(cause.getMessage(), cause);
    this.context = requireNonNull(context, "context");
  }

  public String context() {
    return context;
  }
}

// End DatabaseException.java
