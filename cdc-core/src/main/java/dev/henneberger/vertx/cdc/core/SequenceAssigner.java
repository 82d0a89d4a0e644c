package dev.henneberger.vertx.cdc.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stamps activities with a per-scope order number.
 */
public final class SequenceAssigner {

  private final TrackedSchema schema;
  private final SequenceStore store;

  public SequenceAssigner(TrackedSchema schema, SequenceStore store) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Product entities count in their organization (or the {@code public:{type}} pseudo-scope when they
   * have none); memberships count in their organization's membership column. Everything else is
   * unsequenced.
   */
  public Optional<SeqScope> scopeFor(TableRegistryEntry entry, Map<String, Object> row) {
    Object organizationId = row.get("organizationId");
    switch (entry.kind()) {
      case ENTITY:
        if (!schema.isProductType(entry.type())) {
          return Optional.empty();
        }
        String contextKey = organizationId == null
          ? SeqScope.publicContextKey(entry.type())
          : String.valueOf(organizationId);
        return Optional.of(new SeqScope(contextKey, SeqScope.Column.SEQ));
      case RESOURCE:
        if (!schema.membershipType().equals(entry.type()) || organizationId == null) {
          return Optional.empty();
        }
        return Optional.of(new SeqScope(String.valueOf(organizationId), SeqScope.Column.MEMBERSHIP_SEQ));
      default:
        return Optional.empty();
    }
  }

  public long next(SeqScope scope) throws Exception {
    return store.increment(Objects.requireNonNull(scope, "scope"));
  }

  /**
   * Next number for the change's scope, or {@code null} when the change is unsequenced.
   */
  public Long assign(RoutedChange change) throws Exception {
    Optional<SeqScope> scope = scopeFor(change.entry(), change.entityData());
    if (scope.isEmpty()) {
      return null;
    }
    return next(scope.get());
  }
}
