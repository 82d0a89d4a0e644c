/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.cdc.pg;

import dev.henneberger.vertx.cdc.core.ChannelListener;
import dev.henneberger.vertx.cdc.core.ChannelState;
import dev.henneberger.vertx.cdc.core.DeliveryChannel;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivery channel over a Vert.x WebSocket client.
 *
 * <p>States move {@code connecting -> open -> reconnecting -> connecting}; only {@link #close()}
 * reaches {@code closed}. Reconnect delays come from the reconnect policy, and the attempt counter
 * resets on every successful handshake. The listener hears {@code onDisconnect} only when an open
 * connection is lost.
 */
public class VertxWebSocketDeliveryChannel implements DeliveryChannel {

  public static final String SECRET_HEADER = "x-cdc-secret";

  private static final Logger LOG = LoggerFactory.getLogger(VertxWebSocketDeliveryChannel.class);
  private static final ChannelListener NO_OP_LISTENER = new ChannelListener() {
    @Override
    public void onConnect() {
    }

    @Override
    public void onDisconnect() {
    }
  };

  private final Vertx vertx;
  private final DeliveryChannelOptions options;
  private final URI target;
  private final Clock clock;
  private final AtomicLong messagesSent = new AtomicLong();

  private volatile ChannelState state = ChannelState.CLOSED;
  private volatile ChannelListener listener = NO_OP_LISTENER;
  private volatile WebSocket socket;
  private volatile Instant lastMessageAt;
  private volatile Instant disconnectedAt;
  private WebSocketClient client;
  private Promise<Void> firstOpen;
  private long reconnectAttempt;
  private long pingTimerId = -1;
  private long reconnectTimerId = -1;
  private boolean closed;

  public VertxWebSocketDeliveryChannel(Vertx vertx, DeliveryChannelOptions options) {
    this(vertx, options, Clock.systemUTC());
  }

  public VertxWebSocketDeliveryChannel(Vertx vertx, DeliveryChannelOptions options, Clock clock) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new DeliveryChannelOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.target = parseTarget(this.options.getUrl());
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized Future<Void> connect() {
    if (closed) {
      return Future.failedFuture(new IllegalStateException("delivery channel is closed"));
    }
    if (!options.hasSecret()) {
      return Future.failedFuture(new IllegalStateException("delivery secret is not configured"));
    }
    if (firstOpen != null) {
      return firstOpen.future();
    }

    firstOpen = Promise.promise();
    client = vertx.createWebSocketClient(new WebSocketClientOptions()
      .setConnectTimeout((int) options.getConnectTimeoutMs()));
    attemptConnect();
    return firstOpen.future();
  }

  @Override
  public boolean send(JsonObject payload) {
    WebSocket ws = socket;
    if (state != ChannelState.OPEN || ws == null) {
      return false;
    }
    ws.writeTextMessage(payload.encode())
      .onFailure(err -> LOG.debug("url={} send failed: {}", options.getUrl(), err.getMessage()));
    messagesSent.incrementAndGet();
    lastMessageAt = clock.instant();
    return true;
  }

  @Override
  public ChannelState state() {
    return state;
  }

  @Override
  public void setListener(ChannelListener listener) {
    this.listener = listener == null ? NO_OP_LISTENER : listener;
  }

  @Override
  public JsonObject stats() {
    Instant lastMessage = lastMessageAt;
    Instant disconnected = disconnectedAt;
    return new JsonObject()
      .put("messagesSent", messagesSent.get())
      .put("lastMessageAt", lastMessage == null ? null : lastMessage.toString())
      .put("disconnectedDuration", disconnected == null
        ? null
        : Duration.between(disconnected, clock.instant()).toMillis());
  }

  @Override
  public void close() {
    WebSocket ws;
    boolean wasOpen;
    WebSocketClient currentClient;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      cancelTimers();
      ws = socket;
      socket = null;
      wasOpen = state == ChannelState.OPEN;
      state = ChannelState.CLOSED;
      currentClient = client;
      client = null;
      if (firstOpen != null && !firstOpen.future().isComplete()) {
        firstOpen.fail("delivery channel closed before connecting");
      }
    }
    LOG.info("url={} delivery channel closed", options.getUrl());
    if (ws != null) {
      ws.close();
    }
    if (currentClient != null) {
      currentClient.close();
    }
    if (wasOpen) {
      listener.onDisconnect();
    }
  }

  private void attemptConnect() {
    WebSocketClient currentClient;
    synchronized (this) {
      if (closed) {
        return;
      }
      state = ChannelState.CONNECTING;
      currentClient = client;
    }

    currentClient.connect(connectOptions(target, options.getSecret()))
      .onSuccess(this::onOpen)
      .onFailure(err -> {
        LOG.warn("url={} attempt={} connect failed: {}", options.getUrl(), reconnectAttempt + 1, err.getMessage());
        synchronized (this) {
          if (closed) {
            return;
          }
          state = ChannelState.RECONNECTING;
          scheduleReconnect();
        }
      });
  }

  static WebSocketConnectOptions connectOptions(URI target, String secret) {
    boolean secure = "wss".equalsIgnoreCase(target.getScheme());
    String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
    if (target.getRawQuery() != null) {
      path = path + '?' + target.getRawQuery();
    }

    WebSocketConnectOptions connectOptions = new WebSocketConnectOptions();
    connectOptions.setHost(target.getHost());
    connectOptions.setPort(target.getPort() > 0 ? target.getPort() : (secure ? 443 : 80));
    connectOptions.setURI(path);
    connectOptions.setSsl(secure);
    connectOptions.addHeader(SECRET_HEADER, secret);
    return connectOptions;
  }

  private void onOpen(WebSocket ws) {
    Promise<Void> opened;
    synchronized (this) {
      if (closed) {
        ws.close();
        return;
      }
      socket = ws;
      reconnectAttempt = 0;
      disconnectedAt = null;
      state = ChannelState.OPEN;
      opened = firstOpen;

      ws.closeHandler(v -> onConnectionLost(ws, null));
      ws.exceptionHandler(err -> onConnectionLost(ws, err));
      ws.pongHandler(data -> LOG.debug("url={} pong", options.getUrl()));
      ws.textMessageHandler(text -> LOG.debug("url={} message={}", options.getUrl(), text));
      pingTimerId = vertx.setPeriodic(options.getPingIntervalMs(), id -> ping(ws));
    }

    LOG.info("url={} delivery channel open", options.getUrl());
    listener.onConnect();
    if (opened != null) {
      opened.tryComplete();
    }
  }

  private void ping(WebSocket ws) {
    if (socket != ws || ws.isClosed()) {
      return;
    }
    ws.writePing(Buffer.buffer("ping"))
      .onFailure(err -> onConnectionLost(ws, err));
  }

  private void onConnectionLost(WebSocket ws, Throwable cause) {
    boolean wasOpen;
    synchronized (this) {
      if (socket != ws) {
        return;
      }
      socket = null;
      if (pingTimerId >= 0) {
        vertx.cancelTimer(pingTimerId);
        pingTimerId = -1;
      }
      if (closed) {
        return;
      }
      wasOpen = state == ChannelState.OPEN;
      disconnectedAt = clock.instant();
      state = ChannelState.RECONNECTING;
      scheduleReconnect();
    }

    if (cause == null) {
      LOG.warn("url={} delivery channel disconnected", options.getUrl());
    } else {
      LOG.warn("url={} delivery channel disconnected: {}", options.getUrl(), cause.getMessage());
    }
    if (wasOpen) {
      listener.onDisconnect();
    }
  }

  private void scheduleReconnect() {
    reconnectAttempt++;
    long delay = Math.max(1L, options.getReconnectPolicy().computeDelayMillis(reconnectAttempt));
    LOG.debug("url={} attempt={} reconnecting in {}ms", options.getUrl(), reconnectAttempt, delay);
    reconnectTimerId = vertx.setTimer(delay, id -> {
      synchronized (this) {
        reconnectTimerId = -1;
      }
      attemptConnect();
    });
  }

  private static URI parseTarget(String url) {
    URI uri = URI.create(url);
    String scheme = uri.getScheme();
    if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
      throw new IllegalArgumentException("url must use ws or wss: " + url);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("url has no host: " + url);
    }
    return uri;
  }

  private void cancelTimers() {
    if (pingTimerId >= 0) {
      vertx.cancelTimer(pingTimerId);
      pingTimerId = -1;
    }
    if (reconnectTimerId >= 0) {
      vertx.cancelTimer(reconnectTimerId);
      reconnectTimerId = -1;
    }
  }
}
