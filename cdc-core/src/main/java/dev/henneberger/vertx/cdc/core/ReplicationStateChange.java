package dev.henneberger.vertx.cdc.core;

public final class ReplicationStateChange {
  private final ReplicationState previousState;
  private final ReplicationState state;
  private final Throwable cause;
  private final long attempt;

  public ReplicationStateChange(ReplicationState previousState,
                                ReplicationState state,
                                Throwable cause,
                                long attempt) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public ReplicationState previousState() {
    return previousState;
  }

  public ReplicationState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  /**
   * Subscription attempt that caused the transition, {@code 0} for channel-driven changes.
   */
  public long attempt() {
    return attempt;
  }
}
