package dev.henneberger.vertx.cdc.core;

import java.util.Locale;

public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY;

  /**
   * Healthy only when the channel is open and replication is active; a closed channel is unhealthy;
   * every transitional combination is degraded.
   */
  public static HealthStatus derive(ChannelState channelState, ReplicationState replicationState) {
    if (channelState == ChannelState.CLOSED) {
      return UNHEALTHY;
    }
    if (channelState == ChannelState.OPEN && replicationState == ReplicationState.ACTIVE) {
      return HEALTHY;
    }
    return DEGRADED;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
