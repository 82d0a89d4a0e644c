package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

public enum ResourceSeverity {
  OK,
  WARNING,
  EMERGENCY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
