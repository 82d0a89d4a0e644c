package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Vertx;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches retained WAL and free disk while replication is paused and triggers an emergency shutdown
 * before the database host runs out of space.
 *
 * <p>The guard only reads the replication state. Its periodic timer runs on the Vert.x event loop and
 * the probe calls run as blocking tasks, so the replication read loop is never held up.
 */
public final class ResourceGuard implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ResourceGuard.class);

  private final Vertx vertx;
  private final ResourceThresholds thresholds;
  private final ResourceProbe probe;
  private final ReplicationStateMachine stateMachine;
  private final Runnable emergencyShutdown;
  private final Clock clock;
  private final AtomicBoolean shutdownTriggered = new AtomicBoolean(false);
  private final AtomicBoolean tickInFlight = new AtomicBoolean(false);

  private volatile long timerId = -1;
  private volatile ResourceStatus lastStatus;
  private ReplicationSubscription stateSubscription;

  public ResourceGuard(Vertx vertx,
                       ResourceThresholds thresholds,
                       ResourceProbe probe,
                       ReplicationStateMachine stateMachine,
                       Runnable emergencyShutdown) {
    this(vertx, thresholds, probe, stateMachine, emergencyShutdown, Clock.systemUTC());
  }

  public ResourceGuard(Vertx vertx,
                       ResourceThresholds thresholds,
                       ResourceProbe probe,
                       ReplicationStateMachine stateMachine,
                       Runnable emergencyShutdown,
                       Clock clock) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.thresholds = new ResourceThresholds(Objects.requireNonNull(thresholds, "thresholds"));
    this.thresholds.validate();
    this.probe = Objects.requireNonNull(probe, "probe");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.emergencyShutdown = Objects.requireNonNull(emergencyShutdown, "emergencyShutdown");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs the guard only while the state machine reports {@link ReplicationState#PAUSED}.
   */
  public synchronized void attach() {
    if (stateSubscription != null) {
      return;
    }
    stateSubscription = stateMachine.onStateChange(change -> {
      if (change.state() == ReplicationState.PAUSED) {
        start();
      } else {
        stop();
      }
    });
    if (stateMachine.state() == ReplicationState.PAUSED) {
      start();
    }
  }

  public synchronized void start() {
    if (timerId >= 0 || shutdownTriggered.get()) {
      return;
    }
    long interval = thresholds.getCheckInterval().toMillis();
    timerId = vertx.setPeriodic(interval, id -> scheduleTick());
    LOG.info("resource guard started intervalMs={}", interval);
  }

  public synchronized void stop() {
    long id = timerId;
    if (id < 0) {
      return;
    }
    timerId = -1;
    vertx.cancelTimer(id);
    LOG.info("resource guard stopped");
  }

  public boolean isRunning() {
    return timerId >= 0;
  }

  public ResourceStatus lastStatus() {
    return lastStatus;
  }

  /**
   * Takes one reading and acts on it. Blocking; callers on the event loop go through
   * {@link Vertx#executeBlocking}.
   */
  public ResourceStatus tick() throws Exception {
    long walBytes = probe.walRetainedBytes();
    long freeDisk = probe.freeDiskBytes();
    Instant pausedAt = stateMachine.pausedAt();
    Duration pausedFor = pausedAt == null ? Duration.ZERO : Duration.between(pausedAt, clock.instant());

    ResourceStatus status = ResourceStatus.classify(walBytes, freeDisk, pausedFor, thresholds);
    lastStatus = status;

    switch (status.severity()) {
      case EMERGENCY:
        triggerShutdown(status);
        break;
      case WARNING:
        LOG.warn("resource warning state={} walRetainedBytes={} freeDiskBytes={} pausedMs={} reasons={}",
          stateMachine.state(), walBytes, freeDisk, pausedFor.toMillis(), status.reasons());
        break;
      default:
        LOG.debug("resource check ok walRetainedBytes={} freeDiskBytes={} pausedMs={}",
          walBytes, freeDisk, pausedFor.toMillis());
    }
    return status;
  }

  public boolean shutdownTriggered() {
    return shutdownTriggered.get();
  }

  @Override
  public synchronized void close() {
    stop();
    if (stateSubscription != null) {
      stateSubscription.cancel();
      stateSubscription = null;
    }
  }

  private void scheduleTick() {
    if (!tickInFlight.compareAndSet(false, true)) {
      return;
    }
    vertx.executeBlocking(this::tick, false)
      .onComplete(ar -> {
        tickInFlight.set(false);
        if (ar.failed()) {
          LOG.warn("resource check failed cause={}", ar.cause().toString());
        }
      });
  }

  private void triggerShutdown(ResourceStatus status) {
    if (!shutdownTriggered.compareAndSet(false, true)) {
      return;
    }
    LOG.error("emergency shutdown walRetainedBytes={} freeDiskBytes={} pausedMs={} reasons={}",
      status.walRetainedBytes(), status.freeDiskBytes(), status.pausedFor().toMillis(), status.reasons());
    stop();
    emergencyShutdown.run();
  }
}
