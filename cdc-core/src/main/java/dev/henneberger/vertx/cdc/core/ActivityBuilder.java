package dev.henneberger.vertx.cdc.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Derives the canonical activity for a camelCased row of a tracked table.
 */
public final class ActivityBuilder {

  static final String SYNC_META_COLUMN = "stx";
  private static final List<String> USER_COLUMNS = List.of("modifiedBy", "createdBy", "userId");

  private final Collection<String> relatableContextTypes;

  public ActivityBuilder(Collection<String> relatableContextTypes) {
    this.relatableContextTypes = List.copyOf(Objects.requireNonNull(relatableContextTypes, "relatableContextTypes"));
  }

  public Activity build(TableRegistryEntry entry, Map<String, Object> row, ActivityAction action) {
    return build(entry, row, action, UnaryOperator.identity());
  }

  public Activity build(TableRegistryEntry entry,
                        Map<String, Object> row,
                        ActivityAction action,
                        UnaryOperator<Activity.Builder> overrides) {
    Objects.requireNonNull(entry, "entry");
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(action, "action");

    Activity.Builder builder = Activity.builder()
      .action(action)
      .tableName(entry.table())
      .type(activityType(entry, action))
      .tenantId(stringValue(row.get("tenantId")))
      .userId(userId(row))
      .syncMeta(SyncMeta.fromValue(row.get(SYNC_META_COLUMN)));

    switch (entry.kind()) {
      case ENTITY:
        builder.entityType(entry.type()).entityId(stringValue(row.get("id")));
        break;
      case RESOURCE:
        builder.resourceType(entry.type());
        break;
      default:
        throw new IllegalStateException("Unknown registry kind " + entry.kind());
    }

    for (String contextType : relatableContextTypes) {
      String key = contextIdKey(contextType);
      builder.contextId(key, stringValue(row.get(key)));
    }

    Activity.Builder resolved = overrides == null ? builder : overrides.apply(builder);
    return resolved.build();
  }

  public static String activityType(TableRegistryEntry entry, ActivityAction action) {
    return entry.type() + '.' + action.verb();
  }

  public static String contextIdKey(String contextType) {
    return RowNormalizer.toCamelCase(contextType) + "Id";
  }

  private static String userId(Map<String, Object> row) {
    for (String column : USER_COLUMNS) {
      String value = stringValue(row.get(column));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  static String stringValue(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
