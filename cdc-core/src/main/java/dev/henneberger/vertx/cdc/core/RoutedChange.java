package dev.henneberger.vertx.cdc.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Result of routing one row change: the activity (without id and seq yet) and the camelCased row
 * images it was derived from.
 */
public final class RoutedChange {

  private final TableRegistryEntry entry;
  private final Activity activity;
  private final Map<String, Object> entityData;
  private final Map<String, Object> oldEntityData;

  public RoutedChange(TableRegistryEntry entry,
                      Activity activity,
                      Map<String, Object> entityData,
                      Map<String, Object> oldEntityData) {
    this.entry = Objects.requireNonNull(entry, "entry");
    this.activity = Objects.requireNonNull(activity, "activity");
    this.entityData = Objects.requireNonNull(entityData, "entityData");
    this.oldEntityData = oldEntityData == null ? Collections.emptyMap() : oldEntityData;
  }

  public TableRegistryEntry entry() {
    return entry;
  }

  public Activity activity() {
    return activity;
  }

  public ActivityAction action() {
    return activity.action();
  }

  /**
   * The new image for inserts and updates, the old image for deletes.
   */
  public Map<String, Object> entityData() {
    return entityData;
  }

  public Map<String, Object> oldEntityData() {
    return oldEntityData;
  }
}
