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

/** Utilities for {@link SqlPlusPlus.ConnectionFactory}. */
public abstract class ConnectionFactories {
  /** Prefix that turns an Oracle connect string into a JDBC URL. */
  static final String ORACLE_THIN_PREFIX = "jdbc:oracle:thin:@";

  private ConnectionFactories() {}

  /** Creates a connection factory that calls
   * {@link java.sql.DriverManager}. */
  public static SqlPlusPlus.ConnectionFactory simple() {
    return new SimpleConnectionFactory();
  }

  /** Converts a connection string into a JDBC URL.
   *
   * <p>A string that is already a JDBC URL, such as
   * "{@code jdbc:hsqldb:mem:db}", is returned unchanged. Any other string
   * is assumed to be an Oracle connect string, such as
   * "{@code dbhost:1521/ORCLPDB1}" or a TNS alias, and is converted to a
   * URL for Oracle's thin driver. */
  public static String jdbcUrl(String connectionString) {
    if (connectionString.startsWith("jdbc:")) {
      return connectionString;
    }
    return ORACLE_THIN_PREFIX + connectionString;
  }
}

// End ConnectionFactories.java
