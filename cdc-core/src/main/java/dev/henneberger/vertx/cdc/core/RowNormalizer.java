package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts replicated row images into camelCase key/value maps and compares before/after images.
 */
public final class RowNormalizer {

  private RowNormalizer() {
  }

  /**
   * Accepts a plain row map or the legacy column array ({@code [{name, value}, ...]}); anything else,
   * including {@code null}, yields an empty map.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> extractRow(Object wireRow) {
    if (wireRow == null) {
      return Collections.emptyMap();
    }
    if (wireRow instanceof JsonObject) {
      return ((JsonObject) wireRow).getMap();
    }
    if (wireRow instanceof Map) {
      return (Map<String, Object>) wireRow;
    }
    List<?> columns;
    if (wireRow instanceof JsonArray) {
      columns = ((JsonArray) wireRow).getList();
    } else if (wireRow instanceof List) {
      columns = (List<?>) wireRow;
    } else {
      return Collections.emptyMap();
    }

    Map<String, Object> row = new LinkedHashMap<>();
    for (Object column : columns) {
      Map<String, Object> fields;
      if (column instanceof JsonObject) {
        fields = ((JsonObject) column).getMap();
      } else if (column instanceof Map) {
        fields = (Map<String, Object>) column;
      } else {
        continue;
      }
      Object name = fields.get("name");
      if (name != null) {
        row.put(String.valueOf(name), fields.get("value"));
      }
    }
    return row;
  }

  public static Map<String, Object> toCamelKeys(Map<String, Object> row) {
    Objects.requireNonNull(row, "row");
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : row.entrySet()) {
      out.put(toCamelCase(entry.getKey()), entry.getValue());
    }
    return out;
  }

  public static String toCamelCase(String key) {
    if (key == null || key.indexOf('_') < 0) {
      return key;
    }
    StringBuilder sb = new StringBuilder(key.length());
    boolean upperNext = false;
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (c == '_' && sb.length() > 0) {
        upperNext = true;
        continue;
      }
      sb.append(upperNext ? Character.toUpperCase(c) : c);
      upperNext = false;
    }
    return sb.toString();
  }

  /**
   * camelCased keys of {@code newRow} whose JSON encoding differs from {@code oldRow}, ignoring the
   * volatile column. The caller decides what an empty {@code oldRow} means.
   */
  public static List<String> diffKeys(Map<String, Object> oldRow, Map<String, Object> newRow, String volatileColumn) {
    Objects.requireNonNull(oldRow, "oldRow");
    Objects.requireNonNull(newRow, "newRow");
    String volatileCamel = toCamelCase(volatileColumn);

    List<String> changed = new ArrayList<>();
    for (Map.Entry<String, Object> entry : newRow.entrySet()) {
      String key = entry.getKey();
      if (key.equals(volatileColumn) || key.equals(volatileCamel)) {
        continue;
      }
      String before = encode(oldRow.get(key));
      String after = encode(entry.getValue());
      if (!before.equals(after)) {
        changed.add(toCamelCase(key));
      }
    }
    return changed;
  }

  private static String encode(Object value) {
    return value == null ? "null" : Json.encode(value);
  }
}
