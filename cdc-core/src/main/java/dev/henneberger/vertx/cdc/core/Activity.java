package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the activity log. Built per replicated change, persisted once, never mutated.
 */
public final class Activity {

  private final String id;
  private final String tenantId;
  private final String userId;
  private final String entityType;
  private final String resourceType;
  private final ActivityAction action;
  private final String tableName;
  private final String type;
  private final String entityId;
  private final Map<String, String> contextIds;
  private final List<String> changedKeys;
  private final SyncMeta syncMeta;
  private final Long seq;
  private final Instant createdAt;
  private final DeadLetterError error;

  private Activity(Builder builder) {
    this.id = builder.id;
    this.tenantId = builder.tenantId;
    this.userId = builder.userId;
    this.entityType = builder.entityType;
    this.resourceType = builder.resourceType;
    this.action = Objects.requireNonNull(builder.action, "action");
    this.tableName = Objects.requireNonNull(builder.tableName, "tableName");
    this.type = Objects.requireNonNull(builder.type, "type");
    this.entityId = builder.entityId;
    this.contextIds = Collections.unmodifiableMap(new LinkedHashMap<>(builder.contextIds));
    this.changedKeys = builder.changedKeys == null
      ? null
      : Collections.unmodifiableList(new ArrayList<>(builder.changedKeys));
    this.syncMeta = builder.syncMeta;
    this.seq = builder.seq;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    this.error = builder.error;
    if (entityType != null && resourceType != null) {
      throw new IllegalArgumentException("activity cannot carry both entityType and resourceType");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder = new Builder()
      .id(id)
      .tenantId(tenantId)
      .userId(userId)
      .entityType(entityType)
      .resourceType(resourceType)
      .action(action)
      .tableName(tableName)
      .type(type)
      .entityId(entityId)
      .changedKeys(changedKeys)
      .syncMeta(syncMeta)
      .seq(seq)
      .createdAt(createdAt)
      .error(error);
    builder.contextIds.putAll(contextIds);
    return builder;
  }

  public Activity withId(String id) {
    return toBuilder().id(id).build();
  }

  public Activity withSeq(Long seq) {
    return toBuilder().seq(seq).build();
  }

  public Activity withError(DeadLetterError error) {
    return toBuilder().error(error).build();
  }

  public String id() {
    return id;
  }

  public String tenantId() {
    return tenantId;
  }

  public String userId() {
    return userId;
  }

  public String entityType() {
    return entityType;
  }

  public String resourceType() {
    return resourceType;
  }

  public ActivityAction action() {
    return action;
  }

  public String tableName() {
    return tableName;
  }

  public String type() {
    return type;
  }

  public String entityId() {
    return entityId;
  }

  public Map<String, String> contextIds() {
    return contextIds;
  }

  public String organizationId() {
    return contextIds.get("organizationId");
  }

  public List<String> changedKeys() {
    return changedKeys;
  }

  public SyncMeta syncMeta() {
    return syncMeta;
  }

  public Long seq() {
    return seq;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public DeadLetterError error() {
    return error;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("id", id)
      .put("tenantId", tenantId)
      .put("userId", userId)
      .put("entityType", entityType)
      .put("resourceType", resourceType)
      .put("action", action.wireName())
      .put("tableName", tableName)
      .put("type", type)
      .put("entityId", entityId);
    contextIds.forEach(json::put);
    json.put("changedKeys", changedKeys == null ? null : new JsonArray(new ArrayList<>(changedKeys)))
      .put("syncMeta", syncMeta == null ? null : syncMeta.toJson())
      .put("seq", seq)
      .put("createdAt", createdAt.toString());
    if (error != null) {
      json.put("error", error.toJson());
    }
    return json;
  }

  @Override
  public String toString() {
    return "Activity{" +
      "id='" + id + '\'' +
      ", type='" + type + '\'' +
      ", tableName='" + tableName + '\'' +
      ", entityId='" + entityId + '\'' +
      ", contextIds=" + contextIds +
      ", seq=" + seq +
      '}';
  }

  public static final class Builder {
    private String id;
    private String tenantId;
    private String userId;
    private String entityType;
    private String resourceType;
    private ActivityAction action;
    private String tableName;
    private String type;
    private String entityId;
    private final Map<String, String> contextIds = new LinkedHashMap<>();
    private List<String> changedKeys;
    private SyncMeta syncMeta;
    private Long seq;
    private Instant createdAt;
    private DeadLetterError error;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder entityType(String entityType) {
      this.entityType = entityType;
      return this;
    }

    public Builder resourceType(String resourceType) {
      this.resourceType = resourceType;
      return this;
    }

    public Builder action(ActivityAction action) {
      this.action = action;
      return this;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder entityId(String entityId) {
      this.entityId = entityId;
      return this;
    }

    public Builder contextId(String key, String value) {
      this.contextIds.put(key, value);
      return this;
    }

    public Builder changedKeys(List<String> changedKeys) {
      this.changedKeys = changedKeys;
      return this;
    }

    public Builder syncMeta(SyncMeta syncMeta) {
      this.syncMeta = syncMeta;
      return this;
    }

    public Builder seq(Long seq) {
      this.seq = seq;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder error(DeadLetterError error) {
      this.error = error;
      return this;
    }

    public Activity build() {
      return new Activity(this);
    }
  }
}
