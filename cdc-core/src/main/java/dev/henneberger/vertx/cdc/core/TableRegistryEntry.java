package dev.henneberger.vertx.cdc.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A tracked table, tagged as either an entity table or a resource table.
 */
public final class TableRegistryEntry {

  public enum Kind {
    ENTITY,
    RESOURCE
  }

  private final Kind kind;
  private final String table;
  private final String type;

  private TableRegistryEntry(Kind kind, String table, String type) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.table = Objects.requireNonNull(table, "table");
    this.type = Objects.requireNonNull(type, "type");
  }

  public static TableRegistryEntry entity(String table, String type) {
    return new TableRegistryEntry(Kind.ENTITY, table, type);
  }

  public static TableRegistryEntry resource(String table, String type) {
    return new TableRegistryEntry(Kind.RESOURCE, table, type);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isEntity() {
    return kind == Kind.ENTITY;
  }

  public String table() {
    return table;
  }

  public String type() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableRegistryEntry)) {
      return false;
    }
    TableRegistryEntry that = (TableRegistryEntry) o;
    return kind == that.kind && table.equals(that.table) && type.equals(that.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, table, type);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + ':' + table + "->" + type;
  }
}
