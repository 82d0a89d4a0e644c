package dev.henneberger.vertx.cdc.core;

/**
 * Connection callbacks fired by a {@link DeliveryChannel}. {@link #onDisconnect()} only follows a
 * connection that had reached {@link ChannelState#OPEN}.
 */
public interface ChannelListener {
  void onConnect();

  void onDisconnect();
}
