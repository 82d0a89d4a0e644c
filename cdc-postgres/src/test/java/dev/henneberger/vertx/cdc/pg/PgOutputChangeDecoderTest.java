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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.ReplicationMessage;
import io.vertx.core.json.JsonObject;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PgOutputChangeDecoderTest {

  private static final int TEXT = 25;
  private static final int INT4 = 23;
  private static final int NUMERIC = 1700;
  private static final int JSONB = 3802;

  @Test
  void decodesInsertWithRelationMetadata() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();

    assertEquals(ReplicationMessage.Tag.OTHER, decoder.decode(beginMessage(), "0/1").tag());
    assertEquals(ReplicationMessage.Tag.OTHER, decoder.decode(pagesRelation(), "0/1").tag());

    ReplicationMessage message = decoder.decode(insertMessage("p1", "o1", "draft"), "0/16B3748");

    assertEquals(ReplicationMessage.Tag.INSERT, message.tag());
    assertTrue(message.isRowChange());
    assertEquals("public", message.schema());
    assertEquals("pages", message.relationName());
    assertEquals("0/16B3748", message.lsn());
    assertEquals(Instant.parse("2000-01-01T00:00:01Z"), message.commitTimestamp());
    Map<?, ?> row = (Map<?, ?>) message.newImage();
    assertEquals("p1", row.get("id"));
    assertEquals("o1", row.get("organization_id"));
    assertEquals("draft", row.get("name"));
    assertNull(message.oldImage());
  }

  @Test
  void updateKeepsBeforeImageAndFillsUnchangedToastColumns() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();
    decoder.decode(pagesRelation(), "0/1");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'U');
    writeInt(out, 7);
    writeByte(out, 'O');
    writeShort(out, 3);
    writeText(out, "p1");
    writeText(out, "o1");
    writeText(out, "old title");
    writeByte(out, 'N');
    writeShort(out, 3);
    writeText(out, "p1");
    writeByte(out, 'u');
    writeText(out, "new title");

    ReplicationMessage message = decoder.decode(out.toByteArray(), "0/20");

    assertEquals(ReplicationMessage.Tag.UPDATE, message.tag());
    Map<?, ?> oldRow = (Map<?, ?>) message.oldImage();
    Map<?, ?> newRow = (Map<?, ?>) message.newImage();
    assertEquals("old title", oldRow.get("name"));
    assertEquals("new title", newRow.get("name"));
    assertEquals("o1", newRow.get("organization_id"));
  }

  @Test
  void updateWithoutBeforeImageLeavesUnchangedToastColumnsOut() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();
    decoder.decode(pagesRelation(), "0/1");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'U');
    writeInt(out, 7);
    writeByte(out, 'N');
    writeShort(out, 3);
    writeText(out, "p1");
    writeByte(out, 'u');
    writeByte(out, 'n');

    ReplicationMessage message = decoder.decode(out.toByteArray(), "0/21");

    Map<?, ?> newRow = (Map<?, ?>) message.newImage();
    assertNull(message.oldImage());
    assertFalse(newRow.containsKey("organization_id"));
    assertTrue(newRow.containsKey("name"));
    assertNull(newRow.get("name"));
  }

  @Test
  void decodesDeleteFromReplicaIdentity() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();
    decoder.decode(pagesRelation(), "0/1");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'D');
    writeInt(out, 7);
    writeByte(out, 'O');
    writeShort(out, 3);
    writeText(out, "p1");
    writeText(out, "o1");
    writeText(out, "gone");

    ReplicationMessage message = decoder.decode(out.toByteArray(), "0/30");

    assertEquals(ReplicationMessage.Tag.DELETE, message.tag());
    assertNull(message.newImage());
    assertEquals("gone", ((Map<?, ?>) message.oldImage()).get("name"));
  }

  @Test
  void convertsTypedColumns() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();

    ByteArrayOutputStream relation = new ByteArrayOutputStream();
    writeByte(relation, 'R');
    writeInt(relation, 9);
    writeCString(relation, "public");
    writeCString(relation, "memberships");
    writeByte(relation, 'f');
    writeShort(relation, 4);
    writeColumn(relation, "order", INT4);
    writeColumn(relation, "whole", NUMERIC);
    writeColumn(relation, "fraction", NUMERIC);
    writeColumn(relation, "stx", JSONB);
    decoder.decode(relation.toByteArray(), "0/1");

    ByteArrayOutputStream insert = new ByteArrayOutputStream();
    writeByte(insert, 'I');
    writeInt(insert, 9);
    writeByte(insert, 'N');
    writeShort(insert, 4);
    writeText(insert, "3");
    writeText(insert, "42");
    writeText(insert, "1.5");
    writeText(insert, "{\"mutationId\":\"m1\",\"version\":2}");

    Map<?, ?> row = (Map<?, ?>) decoder.decode(insert.toByteArray(), "0/40").newImage();

    assertEquals(3, row.get("order"));
    assertEquals(42L, row.get("whole"));
    assertEquals(1.5d, row.get("fraction"));
    assertEquals(new JsonObject().put("mutationId", "m1").put("version", 2), row.get("stx"));
  }

  @Test
  void controlMessagesAndEmptyPayloadsDecodeToOther() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();

    assertEquals(ReplicationMessage.Tag.OTHER, decoder.decode(new byte[0], "0/1").tag());
    assertEquals(ReplicationMessage.Tag.OTHER, decoder.decode(new byte[] {'Y'}, "0/2").tag());
    ReplicationMessage commit = decoder.decode(commitMessage(), "0/3");
    assertEquals(ReplicationMessage.Tag.OTHER, commit.tag());
    assertFalse(commit.isRowChange());
    assertEquals("0/3", commit.lsn());
  }

  @Test
  void rowChangeForUnknownRelationFails() {
    PgOutputChangeDecoder decoder = new PgOutputChangeDecoder();

    assertThrows(IllegalArgumentException.class, () -> decoder.decode(insertMessage("p1", "o1", "x"), "0/5"));
  }

  private static byte[] beginMessage() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'B');
    writeLong(out, 0L);
    writeLong(out, 1_000_000L);
    writeInt(out, 42);
    return out.toByteArray();
  }

  private static byte[] commitMessage() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'C');
    writeByte(out, 0);
    writeLong(out, 1L);
    writeLong(out, 2L);
    writeLong(out, 2_000_000L);
    return out.toByteArray();
  }

  private static byte[] pagesRelation() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'R');
    writeInt(out, 7);
    writeCString(out, "public");
    writeCString(out, "pages");
    writeByte(out, 'f');
    writeShort(out, 3);
    writeColumn(out, "id", TEXT);
    writeColumn(out, "organization_id", TEXT);
    writeColumn(out, "name", TEXT);
    return out.toByteArray();
  }

  private static byte[] insertMessage(String id, String organizationId, String name) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeByte(out, 'I');
    writeInt(out, 7);
    writeByte(out, 'N');
    writeShort(out, 3);
    writeText(out, id);
    writeText(out, organizationId);
    writeText(out, name);
    return out.toByteArray();
  }

  private static void writeColumn(ByteArrayOutputStream out, String name, int typeOid) {
    writeByte(out, 0);
    writeCString(out, name);
    writeInt(out, typeOid);
    writeInt(out, -1);
  }

  private static void writeText(ByteArrayOutputStream out, String value) {
    writeByte(out, 't');
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    writeInt(out, bytes.length);
    out.writeBytes(bytes);
  }

  private static void writeByte(ByteArrayOutputStream out, int value) {
    out.write(value);
  }

  private static void writeShort(ByteArrayOutputStream out, int value) {
    out.write((value >>> 8) & 0xff);
    out.write(value & 0xff);
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    out.write((value >>> 24) & 0xff);
    out.write((value >>> 16) & 0xff);
    out.write((value >>> 8) & 0xff);
    out.write(value & 0xff);
  }

  private static void writeLong(ByteArrayOutputStream out, long value) {
    writeInt(out, (int) (value >>> 32));
    writeInt(out, (int) value);
  }

  private static void writeCString(ByteArrayOutputStream out, String value) {
    out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
    out.write(0);
  }
}
