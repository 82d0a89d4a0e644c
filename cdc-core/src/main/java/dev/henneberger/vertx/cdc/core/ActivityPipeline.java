package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one replication message into a sequenced, persisted and delivered activity.
 *
 * <p>Messages are processed one at a time in stream order. A position may be acknowledged only when
 * the delivery channel is open at the end of processing. An activity that cannot be written is
 * dead-lettered and the stream moves on; only a {@link ProcessingResult.Outcome#FAILED} result is
 * withheld for redelivery.
 */
public final class ActivityPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(ActivityPipeline.class);

  private final MessageRouter router;
  private final SequenceAssigner sequenceAssigner;
  private final ActivityPersistence persistence;
  private final CountUpdater countUpdater;
  private final DeliveryChannel channel;
  private final ReplicationStateMachine stateMachine;
  private final CdcMetrics metrics;

  public ActivityPipeline(MessageRouter router,
                          SequenceAssigner sequenceAssigner,
                          ActivityPersistence persistence,
                          CountUpdater countUpdater,
                          DeliveryChannel channel,
                          ReplicationStateMachine stateMachine,
                          CdcMetrics metrics) {
    this.router = Objects.requireNonNull(router, "router");
    this.sequenceAssigner = Objects.requireNonNull(sequenceAssigner, "sequenceAssigner");
    this.persistence = Objects.requireNonNull(persistence, "persistence");
    this.countUpdater = Objects.requireNonNull(countUpdater, "countUpdater");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public ProcessingResult process(ReplicationMessage message) {
    Objects.requireNonNull(message, "message");
    String lsn = message.lsn();
    stateMachine.recordMessage(lsn);

    if (MessageRouter.isSeededData(message)) {
      return ProcessingResult.skipped(lsn, acknowledgeAllowed(lsn));
    }
    Activity activity = null;
    try {
      if (!message.isRowChange()) {
        metrics.messageProcessed();
        return ProcessingResult.skipped(lsn, acknowledgeAllowed(lsn));
      }

      Optional<RoutedChange> routed = router.route(message);
      if (routed.isEmpty()) {
        metrics.messageProcessed();
        return ProcessingResult.skipped(lsn, acknowledgeAllowed(lsn));
      }

      RoutedChange change = routed.get();
      activity = change.activity().withId(ActivityIds.fromLsn(lsn));
      activity = activity.withSeq(sequenceAssigner.assign(change));

      InsertOutcome stored = persistence.persist(activity, lsn);
      switch (stored.status()) {
        case DEAD_LETTERED:
          if (stored.error() != null) {
            metrics.error();
          }
          metrics.messageProcessed();
          return ProcessingResult.deadLettered(lsn, activity, acknowledgeAllowed(lsn));
        case ALREADY_PRESENT:
          activity = activity.withSeq(stored.storedSeq());
          break;
        default:
          metrics.activityCreated();
          LOG.info("Activity created type={} entityId={} activity={} lsn={} changedKeys={}",
            activity.type(), activity.entityId(), activity.id(), lsn, activity.changedKeys());
          applyCounts(change, activity);
      }

      deliver(activity, change, lsn);
      metrics.messageProcessed();

      boolean acknowledge = acknowledgeAllowed(lsn);
      return stored.isInserted()
        ? ProcessingResult.created(lsn, activity, acknowledge)
        : ProcessingResult.replayed(lsn, activity, acknowledge);
    } catch (Exception e) {
      metrics.error();
      LOG.error("lsn={} table={} code={} failed to process message: {}",
        lsn, message.relationName(), RetryHelper.errorCode(e), e.getMessage(), e);
      if (activity == null || RetryHelper.isTransient(e)) {
        return ProcessingResult.failed(lsn, e);
      }
      persistence.deadLetter(lsn, activity.id(), activity, e, 1);
      metrics.messageProcessed();
      return ProcessingResult.deadLettered(lsn, activity, acknowledgeAllowed(lsn));
    }
  }

  /**
   * Keepalives from the server follow the same rule as messages.
   */
  public boolean acknowledgeHeartbeat(String lsn) {
    return acknowledgeAllowed(lsn);
  }

  private void applyCounts(RoutedChange change, Activity activity) {
    Optional<CountDelta> delta = countUpdater.deltasFor(change);
    if (delta.isEmpty()) {
      return;
    }
    try {
      countUpdater.apply(delta.get());
    } catch (Exception e) {
      metrics.error();
      LOG.warn("activity={} context={} deltas={} code={} failed to update counts: {}",
        activity.id(), delta.get().contextKey(), delta.get().deltas(), RetryHelper.errorCode(e), e.getMessage());
    }
  }

  private void deliver(Activity activity, RoutedChange change, String lsn) {
    JsonObject payload = DeliveryPayload.of(activity, change.entityData(), lsn);
    if (channel.send(payload)) {
      metrics.messageSent();
    } else {
      metrics.sendFailed();
      LOG.debug("activity={} lsn={} channel={} not delivered", activity.id(), lsn, channel.state());
    }
  }

  private boolean acknowledgeAllowed(String lsn) {
    if (channel.isOpen()) {
      return true;
    }
    LOG.debug("lsn={} channel={} holding acknowledgment", lsn, channel.state());
    return false;
  }
}
