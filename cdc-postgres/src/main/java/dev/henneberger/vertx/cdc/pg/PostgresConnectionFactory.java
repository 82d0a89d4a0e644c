/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.cdc.pg;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Opens short-lived JDBC connections, plus the dedicated replication-protocol connection.
 */
public final class PostgresConnectionFactory {

  private final PostgresReplicationOptions options;

  public PostgresConnectionFactory(PostgresReplicationOptions options) {
    this.options = new PostgresReplicationOptions(Objects.requireNonNull(options, "options"));
  }

  public Connection openConnection() throws SQLException {
    return DriverManager.getConnection(options.jdbcUrl(), connectionProperties());
  }

  public Connection openReplicationConnection() throws SQLException {
    Properties props = connectionProperties();
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
    return DriverManager.getConnection(options.jdbcUrl(), props);
  }

  private Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, options.getUser());
    PGProperty.APPLICATION_NAME.set(props, options.getApplicationName());

    String password = options.resolvePassword();
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (Boolean.TRUE.equals(options.getSsl())) {
      props.setProperty("ssl", "true");
    }
    return props;
  }
}
