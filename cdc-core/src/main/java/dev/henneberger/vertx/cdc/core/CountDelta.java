package dev.henneberger.vertx.cdc.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Signed increments for the denormalized counters of one context row, e.g.
 * {@code {"m:admin": 1, "m:total": 1}} or {@code {"e:attachment": -1}}.
 */
public final class CountDelta {

  private final String contextKey;
  private final Map<String, Integer> deltas;

  public CountDelta(String contextKey, Map<String, Integer> deltas) {
    OptionValidation.require("contextKey", contextKey);
    this.contextKey = contextKey;
    this.deltas = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(deltas, "deltas")));
  }

  public String contextKey() {
    return contextKey;
  }

  public Map<String, Integer> deltas() {
    return deltas;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CountDelta)) {
      return false;
    }
    CountDelta that = (CountDelta) o;
    return contextKey.equals(that.contextKey) && deltas.equals(that.deltas);
  }

  @Override
  public int hashCode() {
    return Objects.hash(contextKey, deltas);
  }

  @Override
  public String toString() {
    return "CountDelta{" + contextKey + ' ' + deltas + '}';
  }
}
