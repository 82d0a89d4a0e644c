package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Error context stored on a dead-lettered activity row.
 */
public final class DeadLetterError {

  private final String lsn;
  private final String message;
  private final String code;
  private final long retryCount;
  private final boolean resolved;

  public DeadLetterError(String lsn, String message, String code, long retryCount, boolean resolved) {
    this.lsn = Objects.requireNonNull(lsn, "lsn");
    this.message = message == null ? "" : message;
    this.code = code;
    this.retryCount = retryCount;
    this.resolved = resolved;
  }

  public static DeadLetterError from(String lsn, Throwable error, long retryCount) {
    String message = error.getMessage() == null ? error.toString() : error.getMessage();
    return new DeadLetterError(lsn, message, RetryHelper.errorCode(error), retryCount, false);
  }

  public String lsn() {
    return lsn;
  }

  public String message() {
    return message;
  }

  public String code() {
    return code;
  }

  public long retryCount() {
    return retryCount;
  }

  public boolean resolved() {
    return resolved;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("lsn", lsn)
      .put("message", message)
      .put("code", code)
      .put("retryCount", retryCount)
      .put("resolved", resolved);
  }
}
