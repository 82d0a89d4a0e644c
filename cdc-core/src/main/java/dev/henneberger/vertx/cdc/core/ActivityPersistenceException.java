package dev.henneberger.vertx.cdc.core;

/**
 * Why an activity could not be written after the retry budget was spent.
 */
public final class ActivityPersistenceException extends RuntimeException {

  private final String activityId;
  private final String sqlState;
  private final long attempts;
  private final boolean transientFailure;

  public ActivityPersistenceException(String activityId, RetryResult<?> result) {
    super("failed to persist activity " + activityId + ": " + result.error().getMessage(), result.error());
    this.activityId = activityId;
    this.sqlState = RetryHelper.errorCode(result.error());
    this.attempts = result.attempts();
    this.transientFailure = result.isTransient();
  }

  public String activityId() {
    return activityId;
  }

  public String sqlState() {
    return sqlState;
  }

  public long attempts() {
    return attempts;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }
}
