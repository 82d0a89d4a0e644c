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

import dev.henneberger.vertx.cdc.core.RetryPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresReplicationOptionsConverter {

  private PostgresReplicationOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresReplicationOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("publicationName")) {
      options.setPublicationName(json.getString("publicationName"));
    }
    if (json.containsKey("applicationName")) {
      options.setApplicationName(json.getString("applicationName"));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }

    JsonObject subscriptionRetry = json.getJsonObject("subscriptionRetryPolicy");
    if (subscriptionRetry != null) {
      options.setSubscriptionRetryPolicy(retryPolicyFromJson(subscriptionRetry, options.getSubscriptionRetryPolicy()));
    }
    JsonObject persistenceRetry = json.getJsonObject("persistenceRetryPolicy");
    if (persistenceRetry != null) {
      options.setPersistenceRetryPolicy(retryPolicyFromJson(persistenceRetry, options.getPersistenceRetryPolicy()));
    }
  }

  static void toJson(PostgresReplicationOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("publicationName", options.getPublicationName());
    json.put("applicationName", options.getApplicationName());
    json.put("preflightEnabled", options.isPreflightEnabled());
    json.put("subscriptionRetryPolicy", retryPolicyToJson(options.getSubscriptionRetryPolicy()));
    json.put("persistenceRetryPolicy", retryPolicyToJson(options.getPersistenceRetryPolicy()));
  }

  static RetryPolicy retryPolicyFromJson(JsonObject json, RetryPolicy defaults) {
    RetryPolicy parsed = defaults.copy();
    parsed.setInitialDelay(Duration.ofMillis(json.getLong("initialDelayMs", defaults.getInitialDelay().toMillis())));
    parsed.setMaxDelay(Duration.ofMillis(json.getLong("maxDelayMs", defaults.getMaxDelay().toMillis())));
    parsed.setMultiplier(json.getDouble("multiplier", defaults.getMultiplier()));
    parsed.setJitter(json.getDouble("jitter", defaults.getJitter()));
    parsed.setMaxAttempts(json.getLong("maxAttempts", defaults.getMaxAttempts()));
    return parsed;
  }

  static JsonObject retryPolicyToJson(RetryPolicy retryPolicy) {
    return new JsonObject()
      .put("initialDelayMs", retryPolicy.getInitialDelay().toMillis())
      .put("maxDelayMs", retryPolicy.getMaxDelay().toMillis())
      .put("multiplier", retryPolicy.getMultiplier())
      .put("jitter", retryPolicy.getJitter())
      .put("maxAttempts", retryPolicy.getMaxAttempts());
  }
}
