package dev.henneberger.vertx.cdc.core;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Insert-or-ignore persistence with bounded retries and a dead-letter fallback.
 */
public final class ActivityPersistence {

  private static final Logger LOG = LoggerFactory.getLogger(ActivityPersistence.class);
  static final Marker FATAL = MarkerFactory.getMarker("FATAL");

  private final ActivityStore store;
  private final RetryPolicy retryPolicy;

  public ActivityPersistence(ActivityStore store, RetryPolicy retryPolicy) {
    this.store = Objects.requireNonNull(store, "store");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy").copy();
    if (this.retryPolicy.isUnbounded()) {
      throw new IllegalArgumentException("retryPolicy must bound maxAttempts");
    }
  }

  /**
   * Writes the activity. A replayed id is reported with the seq of the stored row.
   *
   * <p>When the write cannot succeed, a dead-letter row is attempted and the outcome is
   * {@link InsertOutcome.Status#DEAD_LETTERED}, whether or not that row could be written.
   */
  public InsertOutcome persist(Activity activity, String lsn) {
    Objects.requireNonNull(activity, "activity");
    RetryResult<InsertOutcome> result = RetryHelper.withRetry(
      () -> store.insertIfAbsent(activity), retryPolicy, "insert activity " + activity.id());

    if (result.succeeded()) {
      InsertOutcome outcome = result.value();
      switch (outcome.status()) {
        case ALREADY_PRESENT:
          LOG.debug("activity={} lsn={} already present, skipping insert", activity.id(), lsn);
          break;
        case DEAD_LETTERED:
          LOG.warn("activity={} lsn={} already recorded as a dead letter", activity.id(), lsn);
          break;
        default:
          if (result.attempts() > 1) {
            LOG.info("activity={} lsn={} attempts={} persisted after retry",
              activity.id(), lsn, result.attempts());
          }
      }
      return outcome;
    }

    deadLetter(lsn, activity.id(), activity, result.error(), result.attempts());
    return InsertOutcome.deadLettered(new ActivityPersistenceException(activity.id(), result));
  }

  /**
   * Records a failed activity. Never throws: a failure here is logged at the highest severity.
   */
  public void deadLetter(String lsn, String activityId, Activity activity, Throwable error, long retryCount) {
    DeadLetterError record = DeadLetterError.from(lsn, error, retryCount);
    Activity failed = activity.toBuilder().id(activityId).error(record).build();
    try {
      store.insertDeadLetter(failed);
      LOG.error("activity={} lsn={} code={} retries={} recorded dead letter: {}",
        activityId, lsn, record.code(), retryCount, record.message());
    } catch (Exception e) {
      LOG.error(FATAL, "activity={} lsn={} failed to record dead letter; original error code={} message={}",
        activityId, lsn, record.code(), record.message(), e);
    }
  }
}
