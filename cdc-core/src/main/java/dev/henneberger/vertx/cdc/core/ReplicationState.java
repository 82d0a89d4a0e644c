package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

public enum ReplicationState {
  STOPPED,
  ACTIVE,
  PAUSED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
