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

import dev.henneberger.vertx.cdc.core.ReplicationMessage;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoder for the native PostgreSQL {@code pgoutput} logical replication format (protocol version 1).
 *
 * <p>Every wire message becomes exactly one {@link ReplicationMessage}; transaction boundaries,
 * relation metadata and the other control messages decode to {@link ReplicationMessage.Tag#OTHER} so
 * their positions are acknowledged like any other.
 */
public final class PgOutputChangeDecoder {

  public static final String PLUGIN = "pgoutput";

  private static final long PG_EPOCH_SECONDS = 946684800L;

  private static final int OID_BOOL = 16;
  private static final int OID_INT2 = 21;
  private static final int OID_INT4 = 23;
  private static final int OID_INT8 = 20;
  private static final int OID_FLOAT4 = 700;
  private static final int OID_FLOAT8 = 701;
  private static final int OID_NUMERIC = 1700;
  private static final int OID_JSON = 114;
  private static final int OID_JSONB = 3802;

  private final Map<Integer, Relation> relations = new HashMap<>();
  private volatile Instant currentTxTimestamp;

  public synchronized ReplicationMessage decode(byte[] payload, String lsn) {
    Cursor cursor = new Cursor(payload);
    if (!cursor.hasRemaining()) {
      return ReplicationMessage.other(lsn);
    }

    char messageType = (char) cursor.readByte();
    switch (messageType) {
      case 'B':
        decodeBegin(cursor);
        return ReplicationMessage.other(lsn);
      case 'C':
        decodeCommit(cursor);
        return ReplicationMessage.other(lsn);
      case 'R':
        decodeRelation(cursor);
        return ReplicationMessage.other(lsn);
      case 'I':
        return decodeInsert(cursor, lsn);
      case 'U':
        return decodeUpdate(cursor, lsn);
      case 'D':
        return decodeDelete(cursor, lsn);
      case 'T':
      case 'Y':
      case 'O':
      case 'M':
        return ReplicationMessage.other(lsn);
      default:
        throw new IllegalArgumentException("Unsupported pgoutput message type: " + messageType);
    }
  }

  private void decodeBegin(Cursor cursor) {
    cursor.readLong();
    currentTxTimestamp = fromPgEpochMicros(cursor.readLong());
    cursor.readInt();
  }

  private void decodeCommit(Cursor cursor) {
    cursor.readByte();
    cursor.readLong();
    cursor.readLong();
    currentTxTimestamp = fromPgEpochMicros(cursor.readLong());
  }

  private void decodeRelation(Cursor cursor) {
    int relationId = cursor.readInt();
    String schema = cursor.readCString();
    String table = cursor.readCString();
    cursor.readByte();
    int columnCount = cursor.readUnsignedShort();
    List<Column> columns = new ArrayList<>(columnCount);

    for (int i = 0; i < columnCount; i++) {
      cursor.readByte();
      String name = cursor.readCString();
      int typeOid = cursor.readInt();
      cursor.readInt();
      columns.add(new Column(name, typeOid));
    }

    relations.put(relationId, new Relation(schema, table, columns));
  }

  private ReplicationMessage decodeInsert(Cursor cursor, String lsn) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker != 'N') {
      throw new IllegalArgumentException("Unexpected tuple marker for INSERT: " + marker);
    }

    Map<String, Object> row = decodeTuple(cursor, relation, Map.of());
    return new ReplicationMessage(ReplicationMessage.Tag.INSERT, relation.schema, relation.table,
      row, null, lsn, currentTxTimestamp);
  }

  private ReplicationMessage decodeUpdate(Cursor cursor, String lsn) {
    Relation relation = relation(cursor.readInt());

    Map<String, Object> oldRow = null;
    Map<String, Object> newRow = Map.of();

    char marker = (char) cursor.readByte();
    if (marker == 'K' || marker == 'O') {
      oldRow = decodeTuple(cursor, relation, Map.of());
      marker = (char) cursor.readByte();
    }
    if (marker == 'N') {
      newRow = decodeTuple(cursor, relation, oldRow == null ? Map.of() : oldRow);
    }

    return new ReplicationMessage(ReplicationMessage.Tag.UPDATE, relation.schema, relation.table,
      newRow, oldRow, lsn, currentTxTimestamp);
  }

  private ReplicationMessage decodeDelete(Cursor cursor, String lsn) {
    Relation relation = relation(cursor.readInt());
    char marker = (char) cursor.readByte();
    if (marker != 'K' && marker != 'O') {
      throw new IllegalArgumentException("Unexpected tuple marker for DELETE: " + marker);
    }

    Map<String, Object> oldRow = decodeTuple(cursor, relation, Map.of());
    return new ReplicationMessage(ReplicationMessage.Tag.DELETE, relation.schema, relation.table,
      null, oldRow, lsn, currentTxTimestamp);
  }

  /**
   * Unchanged TOASTed columns ({@code 'u'}) take their value from {@code unchangedSource} when the
   * before-image carries it, and are left out otherwise.
   */
  private Map<String, Object> decodeTuple(Cursor cursor, Relation relation, Map<String, Object> unchangedSource) {
    int colCount = cursor.readUnsignedShort();
    Map<String, Object> values = new LinkedHashMap<>();

    for (int i = 0; i < colCount; i++) {
      Column column = i < relation.columns.size()
        ? relation.columns.get(i)
        : new Column("col_" + i, 0);
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          values.put(column.name, null);
          break;
        case 'u':
          if (unchangedSource.containsKey(column.name)) {
            values.put(column.name, unchangedSource.get(column.name));
          }
          break;
        case 't': {
          int len = cursor.readInt();
          values.put(column.name, convertTextValue(cursor.readString(len), column.typeOid));
          break;
        }
        case 'b': {
          int len = cursor.readInt();
          values.put(column.name, "base64:" + Base64.getEncoder().encodeToString(cursor.readBytes(len)));
          break;
        }
        default:
          throw new IllegalArgumentException("Unsupported tuple column kind: " + kind);
      }
    }

    return values;
  }

  private static Object convertTextValue(String raw, int typeOid) {
    try {
      switch (typeOid) {
        case OID_BOOL:
          return "t".equalsIgnoreCase(raw) || "true".equalsIgnoreCase(raw);
        case OID_INT2:
        case OID_INT4:
          return Integer.parseInt(raw);
        case OID_INT8:
          return Long.parseLong(raw);
        case OID_FLOAT4:
          return Float.parseFloat(raw);
        case OID_FLOAT8:
          return Double.parseDouble(raw);
        case OID_NUMERIC:
          return raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0
            ? (Object) Long.parseLong(raw)
            : (Object) Double.parseDouble(raw);
        case OID_JSON:
        case OID_JSONB:
          return parseJson(raw);
        default:
          return raw;
      }
    } catch (RuntimeException unparsable) {
      return raw;
    }
  }

  private static Object parseJson(String raw) {
    String trimmed = raw.trim();
    if (trimmed.startsWith("{")) {
      return new JsonObject(trimmed);
    }
    if (trimmed.startsWith("[")) {
      return new JsonArray(trimmed);
    }
    return raw;
  }

  private Relation relation(int relationId) {
    Relation relation = relations.get(relationId);
    if (relation == null) {
      throw new IllegalArgumentException("pgoutput relation metadata missing for relation id " + relationId);
    }
    return relation;
  }

  private static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  private static final class Relation {
    private final String schema;
    private final String table;
    private final List<Column> columns;

    private Relation(String schema, String table, List<Column> columns) {
      this.schema = schema;
      this.table = table;
      this.columns = columns;
    }
  }

  private static final class Column {
    private final String name;
    private final int typeOid;

    private Column(String name, int typeOid) {
      this.name = name;
      this.typeOid = typeOid;
    }
  }

  private static final class Cursor {
    private final byte[] bytes;
    private int index;

    private Cursor(byte[] bytes) {
      this.bytes = bytes;
    }

    private boolean hasRemaining() {
      return index < bytes.length;
    }

    private int readUnsignedShort() {
      return ((bytes[index++] & 0xff) << 8) | (bytes[index++] & 0xff);
    }

    private byte readByte() {
      return bytes[index++];
    }

    private int readInt() {
      int value = ((bytes[index] & 0xff) << 24)
        | ((bytes[index + 1] & 0xff) << 16)
        | ((bytes[index + 2] & 0xff) << 8)
        | (bytes[index + 3] & 0xff);
      index += 4;
      return value;
    }

    private long readLong() {
      long high = readInt() & 0xffffffffL;
      long low = readInt() & 0xffffffffL;
      return (high << 32) | low;
    }

    private String readCString() {
      int start = index;
      while (index < bytes.length && bytes[index] != 0) {
        index++;
      }
      String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
      index++;
      return out;
    }

    private String readString(int len) {
      String out = new String(bytes, index, len, StandardCharsets.UTF_8);
      index += len;
      return out;
    }

    private byte[] readBytes(int len) {
      byte[] out = new byte[len];
      System.arraycopy(bytes, index, out, 0, len);
      index += len;
      return out;
    }
  }
}
