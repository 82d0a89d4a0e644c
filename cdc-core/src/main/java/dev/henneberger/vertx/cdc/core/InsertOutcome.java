package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * Result of writing one activity row.
 */
public final class InsertOutcome {

  public enum Status {
    INSERTED,
    /** A regular row with the same id exists; {@link #storedSeq()} is the seq it was written with. */
    ALREADY_PRESENT,
    /** The id belongs to a dead-letter row, either just written or left by an earlier attempt. */
    DEAD_LETTERED
  }

  private static final InsertOutcome INSERTED = new InsertOutcome(Status.INSERTED, null, null);

  private final Status status;
  private final Long storedSeq;
  private final Throwable error;

  private InsertOutcome(Status status, Long storedSeq, Throwable error) {
    this.status = status;
    this.storedSeq = storedSeq;
    this.error = error;
  }

  public static InsertOutcome inserted() {
    return INSERTED;
  }

  public static InsertOutcome alreadyPresent(Long storedSeq) {
    return new InsertOutcome(Status.ALREADY_PRESENT, storedSeq, null);
  }

  public static InsertOutcome deadLetterPresent(Long storedSeq) {
    return new InsertOutcome(Status.DEAD_LETTERED, storedSeq, null);
  }

  public static InsertOutcome deadLettered(Throwable error) {
    return new InsertOutcome(Status.DEAD_LETTERED, null, Objects.requireNonNull(error, "error"));
  }

  public Status status() {
    return status;
  }

  public boolean isInserted() {
    return status == Status.INSERTED;
  }

  public Long storedSeq() {
    return storedSeq;
  }

  /**
   * Failure that sent the activity to the dead-letter path during this call; {@code null} otherwise.
   */
  public Throwable error() {
    return error;
  }

  @Override
  public String toString() {
    return "InsertOutcome{" + status + (storedSeq == null ? "" : " storedSeq=" + storedSeq) + '}';
  }
}
