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

import dev.henneberger.vertx.cdc.core.Activity;
import dev.henneberger.vertx.cdc.core.ActivityStore;
import dev.henneberger.vertx.cdc.core.InsertOutcome;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Activity rows in the {@code activities} table. Both inserts ignore an existing id, so replays and
 * repeated dead-letter writes leave a single row.
 */
public final class JdbcActivityStore implements ActivityStore {

  static final String INSERT_SQL =
    "INSERT INTO activities (id, tenant_id, user_id, entity_type, resource_type, action, table_name, type, "
      + "entity_id, context_ids, changed_keys, stx, seq, created_at, error) "
      + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?::jsonb) "
      + "ON CONFLICT (id) DO NOTHING";

  // The outer SELECT reads the snapshot from before the insert, so it only sees a conflicting row.
  static final String INSERT_OR_REPORT_SQL =
    "WITH inserted AS (" + INSERT_SQL + " RETURNING seq) "
      + "SELECT true, seq, false FROM inserted "
      + "UNION ALL "
      + "SELECT false, seq, error IS NOT NULL FROM activities "
      + "WHERE id = ? AND NOT EXISTS (SELECT 1 FROM inserted)";

  private final PostgresConnectionFactory connections;

  public JdbcActivityStore(PostgresConnectionFactory connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public InsertOutcome insertIfAbsent(Activity activity) throws SQLException {
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(INSERT_OR_REPORT_SQL)) {
      int next = bind(statement, activity);
      statement.setString(next, activity.id());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("activity " + activity.id() + " was neither inserted nor found");
        }
        if (rs.getBoolean(1)) {
          return InsertOutcome.inserted();
        }
        long seq = rs.getLong(2);
        Long storedSeq = rs.wasNull() ? null : seq;
        return rs.getBoolean(3)
          ? InsertOutcome.deadLetterPresent(storedSeq)
          : InsertOutcome.alreadyPresent(storedSeq);
      }
    }
  }

  @Override
  public boolean insertDeadLetter(Activity activity) throws SQLException {
    if (activity.error() == null) {
      throw new IllegalArgumentException("dead-letter activity " + activity.id() + " carries no error");
    }
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(INSERT_SQL)) {
      bind(statement, activity);
      return statement.executeUpdate() == 1;
    }
  }

  /**
   * Binds the fifteen insert columns and returns the next free parameter index.
   */
  private static int bind(PreparedStatement statement, Activity activity) throws SQLException {
    statement.setString(1, activity.id());
    statement.setString(2, activity.tenantId());
    statement.setString(3, activity.userId());
    statement.setString(4, activity.entityType());
    statement.setString(5, activity.resourceType());
    statement.setString(6, activity.action().wireName());
    statement.setString(7, activity.tableName());
    statement.setString(8, activity.type());
    statement.setString(9, activity.entityId());
    statement.setString(10, new JsonObject(new LinkedHashMap<>(activity.contextIds())).encode());
    statement.setString(11, activity.changedKeys() == null
      ? null
      : new JsonArray(new ArrayList<>(activity.changedKeys())).encode());
    statement.setString(12, activity.syncMeta() == null ? null : activity.syncMeta().toJson().encode());
    if (activity.seq() == null) {
      statement.setNull(13, Types.BIGINT);
    } else {
      statement.setLong(13, activity.seq());
    }
    statement.setTimestamp(14, Timestamp.from(activity.createdAt()));
    statement.setString(15, activity.error() == null ? null : activity.error().toJson().encode());
    return 16;
  }
}
