package dev.henneberger.vertx.cdc.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the counter changes implied by a captured row change and applies them.
 *
 * <ul>
 *   <li>membership create/delete: {@code m:{role}} and {@code m:total} by &plusmn;1</li>
 *   <li>membership role change: {@code m:{oldRole}} -1, {@code m:{newRole}} +1</li>
 *   <li>inactive membership: {@code m:pending} follows the {@code rejectedAt} null edges</li>
 *   <li>product entity create/delete: {@code e:{type}} by &plusmn;1; updates never count</li>
 * </ul>
 */
public final class CountUpdater {

  static final String MEMBERSHIP_TOTAL = "m:total";
  static final String MEMBERSHIP_PENDING = "m:pending";

  private final TrackedSchema schema;
  private final CountStore store;

  public CountUpdater(TrackedSchema schema, CountStore store) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.store = Objects.requireNonNull(store, "store");
  }

  public Optional<CountDelta> deltasFor(TableRegistryEntry entry,
                                        ActivityAction action,
                                        Map<String, Object> newRow,
                                        Map<String, Object> oldRow) {
    String organizationId = stringValue(newRow, "organizationId");
    if (organizationId == null) {
      organizationId = stringValue(oldRow, "organizationId");
    }
    if (organizationId == null) {
      return Optional.empty();
    }

    switch (entry.kind()) {
      case RESOURCE:
        if (schema.membershipType().equals(entry.type())) {
          return membershipDelta(action, organizationId, newRow, oldRow);
        }
        if (schema.inactiveMembershipType().equals(entry.type())) {
          return pendingDelta(action, organizationId, newRow, oldRow);
        }
        return Optional.empty();
      case ENTITY:
        if (!schema.isProductType(entry.type()) || action == ActivityAction.UPDATE) {
          return Optional.empty();
        }
        int change = action == ActivityAction.CREATE ? 1 : -1;
        return Optional.of(new CountDelta(organizationId, Map.of("e:" + entry.type(), change)));
      default:
        return Optional.empty();
    }
  }

  public Optional<CountDelta> deltasFor(RoutedChange change) {
    return deltasFor(change.entry(), change.action(), change.entityData(), change.oldEntityData());
  }

  public void apply(CountDelta delta) throws Exception {
    if (delta.deltas().isEmpty()) {
      return;
    }
    store.apply(delta);
  }

  private static Optional<CountDelta> membershipDelta(ActivityAction action,
                                                      String organizationId,
                                                      Map<String, Object> newRow,
                                                      Map<String, Object> oldRow) {
    switch (action) {
      case CREATE: {
        String role = stringValue(newRow, "role");
        return role == null ? Optional.empty() : Optional.of(roleDelta(organizationId, role, 1));
      }
      case DELETE: {
        String role = stringValue(newRow, "role");
        if (role == null) {
          role = stringValue(oldRow, "role");
        }
        return role == null ? Optional.empty() : Optional.of(roleDelta(organizationId, role, -1));
      }
      case UPDATE: {
        String oldRole = stringValue(oldRow, "role");
        String newRole = stringValue(newRow, "role");
        if (oldRole == null || newRole == null || oldRole.equals(newRole)) {
          return Optional.empty();
        }
        Map<String, Integer> deltas = new LinkedHashMap<>();
        deltas.put("m:" + oldRole, -1);
        deltas.put("m:" + newRole, 1);
        return Optional.of(new CountDelta(organizationId, deltas));
      }
      default:
        return Optional.empty();
    }
  }

  private static CountDelta roleDelta(String organizationId, String role, int change) {
    Map<String, Integer> deltas = new LinkedHashMap<>();
    deltas.put("m:" + role, change);
    deltas.put(MEMBERSHIP_TOTAL, change);
    return new CountDelta(organizationId, deltas);
  }

  private static Optional<CountDelta> pendingDelta(ActivityAction action,
                                                   String organizationId,
                                                   Map<String, Object> newRow,
                                                   Map<String, Object> oldRow) {
    switch (action) {
      case CREATE:
        if (value(newRow, "rejectedAt") != null) {
          return Optional.empty();
        }
        return Optional.of(new CountDelta(organizationId, Map.of(MEMBERSHIP_PENDING, 1)));
      case DELETE: {
        Object rejectedAt = value(newRow, "rejectedAt");
        if (rejectedAt == null) {
          rejectedAt = value(oldRow, "rejectedAt");
        }
        if (rejectedAt != null) {
          return Optional.empty();
        }
        return Optional.of(new CountDelta(organizationId, Map.of(MEMBERSHIP_PENDING, -1)));
      }
      case UPDATE: {
        if (oldRow == null || oldRow.isEmpty()) {
          return Optional.empty();
        }
        boolean wasPending = value(oldRow, "rejectedAt") == null;
        boolean isPending = value(newRow, "rejectedAt") == null;
        if (wasPending && !isPending) {
          return Optional.of(new CountDelta(organizationId, Map.of(MEMBERSHIP_PENDING, -1)));
        }
        if (!wasPending && isPending) {
          return Optional.of(new CountDelta(organizationId, Map.of(MEMBERSHIP_PENDING, 1)));
        }
        return Optional.empty();
      }
      default:
        return Optional.empty();
    }
  }

  private static Object value(Map<String, Object> row, String key) {
    return row == null ? null : row.get(key);
  }

  private static String stringValue(Map<String, Object> row, String key) {
    Object value = value(row, key);
    return value instanceof String ? (String) value : null;
  }
}
