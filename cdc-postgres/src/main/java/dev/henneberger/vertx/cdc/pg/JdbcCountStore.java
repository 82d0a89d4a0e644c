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

import dev.henneberger.vertx.cdc.core.CountDelta;
import dev.henneberger.vertx.cdc.core.CountStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Denormalized counters stored as a jsonb object per context row. Every key of a delta is merged in
 * the same statement as {@code GREATEST(0, current + delta)}.
 */
public final class JdbcCountStore implements CountStore {

  private final PostgresConnectionFactory connections;

  public JdbcCountStore(PostgresConnectionFactory connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  static String upsertSql(int keyCount) {
    if (keyCount < 1) {
      throw new IllegalArgumentException("keyCount must be >= 1");
    }
    List<String> initial = new ArrayList<>();
    List<String> merged = new ArrayList<>();
    for (int i = 0; i < keyCount; i++) {
      initial.add("?::text, GREATEST(0, ?::int)");
      merged.add("?::text, GREATEST(0, COALESCE((context_counters.counts ->> ?::text)::int, 0) + ?::int)");
    }
    return "INSERT INTO context_counters (context_key, seq, m_seq, counts, updated_at) "
      + "VALUES (?, 0, 0, jsonb_build_object(" + String.join(", ", initial) + "), now()) "
      + "ON CONFLICT (context_key) DO UPDATE SET "
      + "counts = context_counters.counts || jsonb_build_object(" + String.join(", ", merged) + "), "
      + "updated_at = now()";
  }

  @Override
  public void apply(CountDelta delta) throws SQLException {
    Map<String, Integer> deltas = delta.deltas();
    if (deltas.isEmpty()) {
      return;
    }
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(upsertSql(deltas.size()))) {
      int index = 1;
      statement.setString(index++, delta.contextKey());
      for (Map.Entry<String, Integer> entry : deltas.entrySet()) {
        statement.setString(index++, entry.getKey());
        statement.setInt(index++, entry.getValue());
      }
      for (Map.Entry<String, Integer> entry : deltas.entrySet()) {
        statement.setString(index++, entry.getKey());
        statement.setString(index++, entry.getKey());
        statement.setInt(index++, entry.getValue());
      }
      statement.executeUpdate();
    }
  }
}
