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

import io.vertx.core.json.JsonObject;

final class DeliveryChannelOptionsConverter {

  private DeliveryChannelOptionsConverter() {
  }

  static void fromJson(JsonObject json, DeliveryChannelOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("url")) {
      options.setUrl(json.getString("url"));
    }
    if (json.containsKey("secret")) {
      options.setSecret(json.getString("secret"));
    }
    if (json.containsKey("pingIntervalMs")) {
      options.setPingIntervalMs(json.getLong("pingIntervalMs"));
    }
    if (json.containsKey("connectTimeoutMs")) {
      options.setConnectTimeoutMs(json.getLong("connectTimeoutMs"));
    }
    JsonObject reconnect = json.getJsonObject("reconnectPolicy");
    if (reconnect != null) {
      options.setReconnectPolicy(
        PostgresReplicationOptionsConverter.retryPolicyFromJson(reconnect, options.getReconnectPolicy()));
    }
  }

  static void toJson(DeliveryChannelOptions options, JsonObject json) {
    json.put("url", options.getUrl());
    json.put("secret", options.getSecret());
    json.put("pingIntervalMs", options.getPingIntervalMs());
    json.put("connectTimeoutMs", options.getConnectTimeoutMs());
    json.put("reconnectPolicy", PostgresReplicationOptionsConverter.retryPolicyToJson(options.getReconnectPolicy()));
  }
}
