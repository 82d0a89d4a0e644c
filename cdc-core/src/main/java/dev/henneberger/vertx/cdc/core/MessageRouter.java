package dev.henneberger.vertx.cdc.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches decoded replication messages to per-action handlers that build activities. An empty
 * result means the message carries nothing to record.
 */
public final class MessageRouter {

  private static final Logger LOG = LoggerFactory.getLogger(MessageRouter.class);
  private static final String SEED_ID_PREFIX = "gen-";

  private final TableRegistry registry;
  private final ActivityBuilder activityBuilder;
  private final TrackedSchema schema;

  public MessageRouter(TableRegistry registry, TrackedSchema schema) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.activityBuilder = new ActivityBuilder(schema.relatableContextTypes());
  }

  public Optional<RoutedChange> route(ReplicationMessage message) {
    Objects.requireNonNull(message, "message");
    if (!message.isRowChange()) {
      return Optional.empty();
    }

    Optional<TableRegistryEntry> entry = registry.lookup(message.relationName());
    if (entry.isEmpty()) {
      LOG.debug("table={} lsn={} not tracked, ignoring", message.relationName(), message.lsn());
      return Optional.empty();
    }

    switch (message.tag()) {
      case INSERT:
        return handleInsert(entry.get(), message);
      case UPDATE:
        return handleUpdate(entry.get(), message);
      case DELETE:
        return handleDelete(entry.get(), message);
      default:
        return Optional.empty();
    }
  }

  /**
   * Seed scripts insert rows whose id starts with {@code gen-}; those never become activities.
   */
  public static boolean isSeededData(ReplicationMessage message) {
    if (!message.isRowChange()) {
      return false;
    }
    Object image = message.tag() == ReplicationMessage.Tag.DELETE ? message.oldImage() : message.newImage();
    if (image == null) {
      image = message.oldImage();
    }
    Object id = RowNormalizer.extractRow(image).get("id");
    return id instanceof String && ((String) id).startsWith(SEED_ID_PREFIX);
  }

  private Optional<RoutedChange> handleInsert(TableRegistryEntry entry, ReplicationMessage message) {
    Map<String, Object> row = normalize(message.newImage());
    Activity activity = activityBuilder.build(entry, row, ActivityAction.CREATE);
    return Optional.of(new RoutedChange(entry, activity, row, null));
  }

  private Optional<RoutedChange> handleUpdate(TableRegistryEntry entry, ReplicationMessage message) {
    Map<String, Object> row = normalize(message.newImage());
    Map<String, Object> oldRow = normalize(message.oldImage());

    // Without a before-image the change set is unknown, not empty.
    List<String> changedKeys = oldRow.isEmpty()
      ? null
      : RowNormalizer.diffKeys(oldRow, row, schema.volatileColumn());
    if (changedKeys != null && changedKeys.isEmpty()) {
      LOG.debug("table={} lsn={} update changed no tracked columns, skipping", entry.table(), message.lsn());
      return Optional.empty();
    }

    Activity activity = activityBuilder.build(entry, row, ActivityAction.UPDATE,
      builder -> builder.changedKeys(changedKeys));
    return Optional.of(new RoutedChange(entry, activity, row, oldRow));
  }

  private Optional<RoutedChange> handleDelete(TableRegistryEntry entry, ReplicationMessage message) {
    Map<String, Object> row = normalize(message.oldImage());
    boolean deletedUser = entry.isEntity() && schema.userType().equals(entry.type());

    // A deleted user row cannot be referenced by its own activity.
    Activity activity = activityBuilder.build(entry, row, ActivityAction.DELETE,
      builder -> deletedUser ? builder.userId(null) : builder);
    return Optional.of(new RoutedChange(entry, activity, row, row));
  }

  private static Map<String, Object> normalize(Object image) {
    return RowNormalizer.toCamelKeys(RowNormalizer.extractRow(image));
  }
}
