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

import dev.henneberger.vertx.cdc.core.ResourceProbe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Reads WAL retained by the replication slot and usable space on the volume holding the data
 * directory.
 */
public final class PostgresResourceProbe implements ResourceProbe {

  static final String SLOT_RETAINED_WAL_SQL =
    "SELECT pg_wal_lsn_diff(pg_current_wal_lsn(), restart_lsn) "
      + "FROM pg_replication_slots WHERE slot_name = ? AND restart_lsn IS NOT NULL";

  private final PostgresConnectionFactory connections;
  private final String slotName;
  private final Path diskPath;

  public PostgresResourceProbe(PostgresConnectionFactory connections, String slotName, Path diskPath) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.diskPath = Objects.requireNonNull(diskPath, "diskPath");
  }

  /**
   * A slot that does not exist yet retains nothing.
   */
  @Override
  public long walRetainedBytes() throws SQLException {
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(SLOT_RETAINED_WAL_SQL)) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Math.max(0L, rs.getLong(1)) : 0L;
      }
    }
  }

  @Override
  public long freeDiskBytes() throws IOException {
    return Files.getFileStore(diskPath).getUsableSpace();
  }
}
