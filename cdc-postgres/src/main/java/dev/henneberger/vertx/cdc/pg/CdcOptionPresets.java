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
import java.time.Duration;
import java.util.Objects;

public final class CdcOptionPresets {

  private CdcOptionPresets() {
  }

  public static void applyProductionDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(true)
      .setSubscriptionRetryPolicy(RetryPolicy.fixedDelay(Duration.ofSeconds(5)))
      .setPersistenceRetryPolicy(
        RetryPolicy.bounded(3, Duration.ofMillis(100), 2.0d, Duration.ofSeconds(2)));
  }

  public static void applyProductionDefaults(DeliveryChannelOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPingIntervalMs(DeliveryChannelOptions.DEFAULT_PING_INTERVAL_MS)
      .setReconnectPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofSeconds(1))
          .setMaxDelay(Duration.ofSeconds(30))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  public static void applyLocalDevDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(false)
      .setSubscriptionRetryPolicy(RetryPolicy.fixedDelay(Duration.ofMillis(500)))
      .setPersistenceRetryPolicy(
        RetryPolicy.bounded(3, Duration.ofMillis(20), 2.0d, Duration.ofMillis(200)));
  }

  public static void applyLocalDevDefaults(DeliveryChannelOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPingIntervalMs(5_000L)
      .setReconnectPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(100))
          .setMaxDelay(Duration.ofSeconds(2))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
      );
  }
}
