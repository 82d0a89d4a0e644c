package dev.henneberger.vertx.cdc.core;

/**
 * Activity ids derive from the WAL position, so a replayed message maps to the row it already wrote.
 */
public final class ActivityIds {

  private ActivityIds() {
  }

  public static String fromLsn(String lsn) {
    OptionValidation.require("lsn", lsn);
    return lsn.replace('/', '-');
  }
}
