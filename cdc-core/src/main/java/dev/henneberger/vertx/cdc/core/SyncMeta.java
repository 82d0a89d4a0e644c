package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sync-engine metadata a client attaches to a mutated row.
 */
public final class SyncMeta {

  private final String mutationId;
  private final String sourceId;
  private final long version;
  private final Map<String, Object> fieldVersions;

  public SyncMeta(String mutationId, String sourceId, long version, Map<String, Object> fieldVersions) {
    this.mutationId = Objects.requireNonNull(mutationId, "mutationId");
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.version = version;
    this.fieldVersions = fieldVersions == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(fieldVersions));
  }

  /**
   * Reads the metadata object off a row value. Returns {@code null} unless the value is an object with
   * string {@code mutationId}, string {@code sourceId} and numeric {@code version}.
   */
  @SuppressWarnings("unchecked")
  public static SyncMeta fromValue(Object value) {
    Map<String, Object> map;
    if (value instanceof JsonObject) {
      map = ((JsonObject) value).getMap();
    } else if (value instanceof Map) {
      map = (Map<String, Object>) value;
    } else {
      return null;
    }

    Object mutationId = map.get("mutationId");
    Object sourceId = map.get("sourceId");
    Object version = map.get("version");
    if (!(mutationId instanceof String) || !(sourceId instanceof String) || !(version instanceof Number)) {
      return null;
    }

    Object fieldVersions = map.get("fieldVersions");
    Map<String, Object> versions = null;
    if (fieldVersions instanceof JsonObject) {
      versions = ((JsonObject) fieldVersions).getMap();
    } else if (fieldVersions instanceof Map) {
      versions = (Map<String, Object>) fieldVersions;
    }
    return new SyncMeta((String) mutationId, (String) sourceId, ((Number) version).longValue(), versions);
  }

  public String mutationId() {
    return mutationId;
  }

  public String sourceId() {
    return sourceId;
  }

  public long version() {
    return version;
  }

  public Map<String, Object> fieldVersions() {
    return fieldVersions;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("mutationId", mutationId)
      .put("sourceId", sourceId)
      .put("version", version)
      .put("fieldVersions", new JsonObject(new LinkedHashMap<>(fieldVersions)));
  }
}
