package dev.henneberger.vertx.cdc.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A decoded logical replication message. Row images are kept in their wire shape (a row map or the
 * legacy column array) and normalized by the router.
 */
public final class ReplicationMessage {

  public enum Tag {
    INSERT,
    UPDATE,
    DELETE,
    OTHER
  }

  private final Tag tag;
  private final String schema;
  private final String relationName;
  private final Object newImage;
  private final Object oldImage;
  private final String lsn;
  private final Instant commitTimestamp;

  public ReplicationMessage(Tag tag,
                            String schema,
                            String relationName,
                            Object newImage,
                            Object oldImage,
                            String lsn,
                            Instant commitTimestamp) {
    this.tag = Objects.requireNonNull(tag, "tag");
    this.schema = schema;
    this.relationName = relationName;
    this.newImage = newImage;
    this.oldImage = oldImage;
    this.lsn = Objects.requireNonNull(lsn, "lsn");
    this.commitTimestamp = commitTimestamp;
  }

  public static ReplicationMessage insert(String relationName, Object newImage, String lsn) {
    return new ReplicationMessage(Tag.INSERT, "public", relationName, newImage, null, lsn, null);
  }

  public static ReplicationMessage update(String relationName, Object newImage, Object oldImage, String lsn) {
    return new ReplicationMessage(Tag.UPDATE, "public", relationName, newImage, oldImage, lsn, null);
  }

  public static ReplicationMessage delete(String relationName, Object oldImage, String lsn) {
    return new ReplicationMessage(Tag.DELETE, "public", relationName, null, oldImage, lsn, null);
  }

  public static ReplicationMessage other(String lsn) {
    return new ReplicationMessage(Tag.OTHER, null, null, null, null, lsn, null);
  }

  public Tag tag() {
    return tag;
  }

  public boolean isRowChange() {
    return tag != Tag.OTHER;
  }

  public String schema() {
    return schema;
  }

  public String relationName() {
    return relationName;
  }

  public Object newImage() {
    return newImage;
  }

  public Object oldImage() {
    return oldImage;
  }

  public String lsn() {
    return lsn;
  }

  public Instant commitTimestamp() {
    return commitTimestamp;
  }

  @Override
  public String toString() {
    return "ReplicationMessage{" +
      "tag=" + tag +
      ", relation='" + (schema == null ? "" : schema + '.') + relationName + '\'' +
      ", lsn='" + lsn + '\'' +
      '}';
  }
}
