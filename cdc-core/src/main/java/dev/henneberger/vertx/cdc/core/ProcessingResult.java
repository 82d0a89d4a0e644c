package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * What happened to one replication message, and whether its position may be acknowledged.
 */
public final class ProcessingResult {

  public enum Outcome {
    /** A new activity row was written. */
    CREATED,
    /** The activity id already existed; the stream is replaying. */
    REPLAYED,
    /** Nothing to record: control message, untracked table, seed data or a no-op update. */
    SKIPPED,
    /** The activity could not be written and went to the dead-letter path; nothing was delivered. */
    DEAD_LETTERED,
    FAILED
  }

  private final Outcome outcome;
  private final String lsn;
  private final Activity activity;
  private final boolean acknowledge;
  private final Throwable error;

  private ProcessingResult(Outcome outcome, String lsn, Activity activity, boolean acknowledge, Throwable error) {
    this.outcome = Objects.requireNonNull(outcome, "outcome");
    this.lsn = lsn;
    this.activity = activity;
    this.acknowledge = acknowledge;
    this.error = error;
  }

  public static ProcessingResult created(String lsn, Activity activity, boolean acknowledge) {
    return new ProcessingResult(Outcome.CREATED, lsn, activity, acknowledge, null);
  }

  public static ProcessingResult replayed(String lsn, Activity activity, boolean acknowledge) {
    return new ProcessingResult(Outcome.REPLAYED, lsn, activity, acknowledge, null);
  }

  public static ProcessingResult skipped(String lsn, boolean acknowledge) {
    return new ProcessingResult(Outcome.SKIPPED, lsn, null, acknowledge, null);
  }

  public static ProcessingResult deadLettered(String lsn, Activity activity, boolean acknowledge) {
    return new ProcessingResult(Outcome.DEAD_LETTERED, lsn, activity, acknowledge, null);
  }

  public static ProcessingResult failed(String lsn, Throwable error) {
    return new ProcessingResult(Outcome.FAILED, lsn, null, false, Objects.requireNonNull(error, "error"));
  }

  public Outcome outcome() {
    return outcome;
  }

  public String lsn() {
    return lsn;
  }

  public Activity activity() {
    return activity;
  }

  public boolean acknowledge() {
    return acknowledge;
  }

  public Throwable error() {
    return error;
  }

  @Override
  public String toString() {
    return "ProcessingResult{" + outcome + " lsn=" + lsn + " ack=" + acknowledge + '}';
  }
}
