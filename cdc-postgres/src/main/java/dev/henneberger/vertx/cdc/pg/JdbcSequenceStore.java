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

import dev.henneberger.vertx.cdc.core.SeqScope;
import dev.henneberger.vertx.cdc.core.SequenceStore;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Sequence counters in {@code context_counters}. Each increment is a single upsert that returns the
 * new value, so concurrent callers never observe the same number.
 */
public final class JdbcSequenceStore implements SequenceStore {

  private final PostgresConnectionFactory connections;

  public JdbcSequenceStore(PostgresConnectionFactory connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  static String incrementSql(SeqScope.Column column) {
    String name = column.columnName();
    String seqValue = column == SeqScope.Column.SEQ ? "1" : "0";
    String membershipValue = column == SeqScope.Column.MEMBERSHIP_SEQ ? "1" : "0";
    return "INSERT INTO context_counters (context_key, seq, m_seq, counts, updated_at) "
      + "VALUES (?, " + seqValue + ", " + membershipValue + ", '{}'::jsonb, now()) "
      + "ON CONFLICT (context_key) DO UPDATE SET " + name + " = context_counters." + name + " + 1, "
      + "updated_at = now() "
      + "RETURNING " + name;
  }

  @Override
  public long increment(SeqScope scope) throws SQLException {
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(incrementSql(scope.column()))) {
      statement.setString(1, scope.contextKey());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("sequence upsert returned no row for " + scope);
        }
        return rs.getLong(1);
      }
    }
  }
}
