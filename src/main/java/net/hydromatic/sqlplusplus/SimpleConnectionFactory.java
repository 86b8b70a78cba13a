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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/** Connection factory that gets connections from
 * {@link DriverManager}, using any JDBC driver on the class path. */
class SimpleConnectionFactory implements SqlPlusPlus.ConnectionFactory {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SimpleConnectionFactory.class);

  @Override public Connection connect(String url, String user,
      String password) throws SQLException {
    LOGGER.debug("Connecting to {} as {}", url, user);
    return DriverManager.getConnection(url, user, password);
  }
}

// End SimpleConnectionFactory.java
