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
package net.hydromatic.questcli;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Opens connections to the server over the PostgreSQL wire protocol. */
public abstract class Connections {
  private Connections() {}

  /** Socket factory that accepts any server certificate. */
  static final String NON_VALIDATING_FACTORY =
      "org.postgresql.ssl.NonValidatingFactory";

  /** Returns the JDBC URL for a configuration, for example
   * "jdbc:postgresql://localhost:8812/qdb". */
  public static String url(QuestCli.Config config) {
    return "jdbc:postgresql://" + config.host() + ":" + config.port() + "/"
        + config.database();
  }

  /** Returns the connection properties for a configuration: credentials and
   * TLS settings. */
  public static Properties properties(QuestCli.Config config) {
    final Properties properties = new Properties();
    properties.setProperty("user", config.user());
    properties.setProperty("password", config.password());
    properties.setProperty("ApplicationName", "questcli");
    if (config.useTls()) {
      properties.setProperty("sslmode", "require");
      if (config.allowInvalidCert()) {
        properties.setProperty("sslfactory", NON_VALIDATING_FACTORY);
      }
    } else {
      properties.setProperty("sslmode", "disable");
    }
    return properties;
  }

  /** Opens a connection. Authentication and TLS negotiation happen here, so
   * any failure is fatal to the session. */
  public static Connection connect(QuestCli.Config config)
      throws SQLException {
    return DriverManager.getConnection(url(config), properties(config));
  }
}

// End Connections.java
