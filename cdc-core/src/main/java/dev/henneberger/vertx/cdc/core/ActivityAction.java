package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

public enum ActivityAction {
  CREATE("created"),
  UPDATE("updated"),
  DELETE("deleted");

  private final String verb;

  ActivityAction(String verb) {
    this.verb = verb;
  }

  /**
   * Past-tense verb used in activity types, e.g. {@code attachment.created}.
   */
  public String verb() {
    return verb;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
