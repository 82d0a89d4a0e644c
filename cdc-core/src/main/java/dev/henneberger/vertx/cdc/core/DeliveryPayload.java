package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire message sent downstream for every created or replayed activity.
 */
public final class DeliveryPayload {

  private DeliveryPayload() {
  }

  public static JsonObject of(Activity activity, Map<String, Object> entity, String lsn) {
    return new JsonObject()
      .put("activity", activity.toJson())
      .put("entity", new JsonObject(new LinkedHashMap<>(entity)))
      .putNull("cacheToken")
      .put("_trace", new JsonObject()
        .put("traceId", activity.id())
        .put("lsn", lsn));
  }
}
