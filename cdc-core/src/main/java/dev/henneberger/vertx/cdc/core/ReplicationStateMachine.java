package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Handler;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owner of the replication state. Channel callbacks move it between {@link ReplicationState#ACTIVE}
 * and {@link ReplicationState#PAUSED}; the subscription lifecycle starts and stops it. Everything
 * else only reads.
 */
public final class ReplicationStateMachine implements ChannelListener {

  private final Clock clock;
  private final List<Handler<ReplicationStateChange>> stateHandlers = new CopyOnWriteArrayList<>();

  private volatile ReplicationState state = ReplicationState.STOPPED;
  private volatile Instant pausedAt;
  private volatile String lastLsn;
  private volatile Instant lastMessageAt;

  public ReplicationStateMachine() {
    this(Clock.systemUTC());
  }

  public ReplicationStateMachine(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void onConnect() {
    synchronized (this) {
      pausedAt = null;
      transition(ReplicationState.ACTIVE, null, 0);
    }
  }

  @Override
  public void onDisconnect() {
    synchronized (this) {
      if (pausedAt == null) {
        pausedAt = clock.instant();
      }
      transition(ReplicationState.PAUSED, null, 0);
    }
  }

  /**
   * Called each time the subscription loop (re)starts streaming.
   */
  public synchronized void beginSubscription(boolean channelOpen, long attempt) {
    if (channelOpen) {
      pausedAt = null;
      transition(ReplicationState.ACTIVE, null, attempt);
    } else {
      if (pausedAt == null) {
        pausedAt = clock.instant();
      }
      transition(ReplicationState.PAUSED, null, attempt);
    }
  }

  public synchronized void markStopped(Throwable cause, long attempt) {
    transition(ReplicationState.STOPPED, cause, attempt);
  }

  public void recordMessage(String lsn) {
    lastLsn = lsn;
    lastMessageAt = clock.instant();
  }

  public ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler) {
    Handler<ReplicationStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  public ReplicationState state() {
    return state;
  }

  public Instant pausedAt() {
    return pausedAt;
  }

  public String lastLsn() {
    return lastLsn;
  }

  public Instant lastMessageAt() {
    return lastMessageAt;
  }

  private void transition(ReplicationState nextState, Throwable cause, long attempt) {
    ReplicationState previous = state;
    if (previous == nextState && cause == null) {
      return;
    }
    state = nextState;
    ReplicationStateChange change = new ReplicationStateChange(previous, nextState, cause, attempt);
    for (Handler<ReplicationStateChange> handler : stateHandlers) {
      handler.handle(change);
    }
  }
}
