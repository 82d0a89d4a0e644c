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

import dev.henneberger.vertx.cdc.core.OptionValidation;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Target and reconnect behavior of the WebSocket delivery channel.
 */
@DataObject
@JsonGen(publicConverter = false)
public class DeliveryChannelOptions {

  public static final long DEFAULT_PING_INTERVAL_MS = 30_000L;
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

  private String url;
  private String secret;
  private long pingIntervalMs;
  private long connectTimeoutMs;
  private RetryPolicy reconnectPolicy;

  public DeliveryChannelOptions() {
    init();
  }

  public DeliveryChannelOptions(JsonObject json) {
    init();
    DeliveryChannelOptionsConverter.fromJson(json, this);
  }

  public DeliveryChannelOptions(DeliveryChannelOptions other) {
    this.url = other.url;
    this.secret = other.secret;
    this.pingIntervalMs = other.pingIntervalMs;
    this.connectTimeoutMs = other.connectTimeoutMs;
    this.reconnectPolicy = other.reconnectPolicy.copy();
  }

  public String getUrl() {
    return url;
  }

  public DeliveryChannelOptions setUrl(String url) {
    this.url = url;
    return this;
  }

  public String getSecret() {
    return secret;
  }

  /**
   * Shared secret sent in the {@code x-cdc-secret} handshake header.
   */
  public DeliveryChannelOptions setSecret(String secret) {
    this.secret = secret;
    return this;
  }

  public long getPingIntervalMs() {
    return pingIntervalMs;
  }

  public DeliveryChannelOptions setPingIntervalMs(long pingIntervalMs) {
    this.pingIntervalMs = pingIntervalMs;
    return this;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public DeliveryChannelOptions setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
    return this;
  }

  public RetryPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public DeliveryChannelOptions setReconnectPolicy(RetryPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  public boolean hasSecret() {
    return secret != null && !secret.isBlank();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    DeliveryChannelOptionsConverter.toJson(this, json);
    return json;
  }

  void validate() {
    OptionValidation.require("url", url);
    OptionValidation.requireMin("pingIntervalMs", pingIntervalMs, 1);
    OptionValidation.requireMin("connectTimeoutMs", connectTimeoutMs, 1);
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
  }

  private void init() {
    pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
    connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    reconnectPolicy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofSeconds(1))
      .setMaxDelay(Duration.ofSeconds(30))
      .setMultiplier(2.0d)
      .setJitter(0.2d);
  }
}
