package dev.henneberger.vertx.cdc.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryCountStore implements CountStore {
  private final ConcurrentMap<String, Map<String, Integer>> counts = new ConcurrentHashMap<>();

  @Override
  public void apply(CountDelta delta) {
    counts.compute(delta.contextKey(), (key, current) -> {
      Map<String, Integer> next = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
      delta.deltas().forEach((counter, change) ->
        next.put(counter, Math.max(0, next.getOrDefault(counter, 0) + change)));
      return next;
    });
  }

  public Map<String, Integer> counts(String contextKey) {
    Map<String, Integer> current = counts.get(contextKey);
    return current == null ? Collections.emptyMap() : Collections.unmodifiableMap(current);
  }
}
