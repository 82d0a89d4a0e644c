package dev.henneberger.vertx.cdc.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup from physical table name to its registry entry.
 */
public final class TableRegistry {

  private final Map<String, TableRegistryEntry> entries;

  private TableRegistry(Map<String, TableRegistryEntry> entries) {
    this.entries = Collections.unmodifiableMap(entries);
  }

  public static TableRegistry fromSchema(TrackedSchema schema) {
    Objects.requireNonNull(schema, "schema");
    Map<String, TableRegistryEntry> entries = new LinkedHashMap<>();
    schema.entityTables().forEach((table, type) -> register(entries, TableRegistryEntry.entity(table, type)));
    schema.resourceTables().forEach((table, type) -> register(entries, TableRegistryEntry.resource(table, type)));
    return new TableRegistry(entries);
  }

  private static void register(Map<String, TableRegistryEntry> entries, TableRegistryEntry entry) {
    TableRegistryEntry previous = entries.putIfAbsent(entry.table(), entry);
    if (previous != null) {
      throw new IllegalArgumentException("table '" + entry.table() + "' is registered twice ("
        + previous + ", " + entry + ")");
    }
  }

  public Optional<TableRegistryEntry> lookup(String tableName) {
    if (tableName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(tableName));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Collection<TableRegistryEntry> entries() {
    return entries.values();
  }

  /**
   * Preflight issue reported when nothing is tracked; the worker refuses to start on it.
   */
  public Optional<PreflightIssue> emptinessIssue() {
    if (!entries.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new PreflightIssue(
      PreflightIssue.Severity.ERROR,
      "NO_TABLES_REGISTERED",
      "No entity or resource tables are registered for change capture",
      "Declare at least one tracked table in the schema configuration."
    ));
  }
}
