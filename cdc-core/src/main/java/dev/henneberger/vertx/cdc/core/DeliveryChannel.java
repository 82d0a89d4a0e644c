package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * One logical, authenticated connection to the downstream consumer.
 */
public interface DeliveryChannel extends AutoCloseable {

  /**
   * Starts connecting. The future completes on the first successful handshake; later drops are
   * handled by reconnecting in the background.
   */
  Future<Void> connect();

  /**
   * Non-blocking send.
   *
   * @return {@code false} when the channel is not open; nothing is queued
   */
  boolean send(JsonObject payload);

  ChannelState state();

  default boolean isOpen() {
    return state() == ChannelState.OPEN;
  }

  void setListener(ChannelListener listener);

  /**
   * Connection counters for the health snapshot.
   */
  default JsonObject stats() {
    return new JsonObject();
  }

  /**
   * Intentional shutdown; the channel ends in {@link ChannelState#CLOSED} and stops reconnecting.
   */
  @Override
  void close();
}
