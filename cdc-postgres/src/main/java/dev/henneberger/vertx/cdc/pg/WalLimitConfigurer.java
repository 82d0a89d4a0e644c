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

import dev.henneberger.vertx.cdc.core.WalLimits;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps {@code max_slot_wal_keep_size} from the free disk measured at startup. Requires a role
 * allowed to run {@code ALTER SYSTEM}; without one the server keeps its current setting.
 */
public final class WalLimitConfigurer {

  private static final Logger LOG = LoggerFactory.getLogger(WalLimitConfigurer.class);

  private final PostgresConnectionFactory connections;
  private final WalLimits limits;

  public WalLimitConfigurer(PostgresConnectionFactory connections, WalLimits limits) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.limits = Objects.requireNonNull(limits, "limits");
  }

  static String alterSystemSql(long megabytes) {
    return "ALTER SYSTEM SET max_slot_wal_keep_size = '" + megabytes + "MB'";
  }

  public boolean apply(long freeDiskBytes) {
    long megabytes = limits.maxSlotWalKeepMegabytes(freeDiskBytes);
    try (Connection conn = connections.openConnection();
         Statement statement = conn.createStatement()) {
      statement.execute(alterSystemSql(megabytes));
      statement.execute("SELECT pg_reload_conf()");
      LOG.info("max_slot_wal_keep_size={}MB freeDiskBytes={} applied", megabytes, freeDiskBytes);
      return true;
    } catch (SQLException e) {
      LOG.warn("max_slot_wal_keep_size={}MB sqlState={} could not be applied: {}",
        megabytes, e.getSQLState(), e.getMessage());
      return false;
    }
  }
}
