package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Read-only view over the channel, the replication state and the metrics.
 */
public final class HealthReporter {

  private final DeliveryChannel channel;
  private final ReplicationStateMachine stateMachine;
  private final CdcMetrics metrics;
  private final Supplier<ResourceStatus> resources;

  public HealthReporter(DeliveryChannel channel,
                        ReplicationStateMachine stateMachine,
                        CdcMetrics metrics,
                        Supplier<ResourceStatus> resources) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.resources = resources == null ? () -> null : resources;
  }

  public HealthStatus status() {
    return HealthStatus.derive(channel.state(), stateMachine.state());
  }

  public JsonObject snapshot() {
    ChannelState channelState = channel.state();
    ReplicationState replicationState = stateMachine.state();
    Instant lastMessageAt = stateMachine.lastMessageAt();
    ResourceStatus resourceStatus = resources.get();

    JsonObject metricsJson = metrics.toJson().mergeIn(channel.stats());
    return new JsonObject()
      .put("status", HealthStatus.derive(channelState, replicationState).wireName())
      .put("wsState", channelState.wireName())
      .put("replicationState", replicationState.wireName())
      .put("lastLsn", stateMachine.lastLsn())
      .put("lastMessageAt", lastMessageAt == null ? null : lastMessageAt.toString())
      .put("metrics", metricsJson)
      .put("resources", resourceStatus == null ? null : resourceStatus.toJson());
  }
}
