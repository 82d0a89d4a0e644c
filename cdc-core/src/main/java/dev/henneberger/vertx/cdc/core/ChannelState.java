package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

public enum ChannelState {
  CONNECTING,
  OPEN,
  RECONNECTING,
  CLOSED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
