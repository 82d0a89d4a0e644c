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

import dev.henneberger.vertx.cdc.core.ResourceThresholds;
import dev.henneberger.vertx.cdc.core.WalLimits;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Worker settings read from the process environment.
 */
public final class CdcWorkerConfig {

  public static final int DEFAULT_HEALTH_PORT = 4001;
  public static final String DEFAULT_WS_URL = "ws://localhost:4000/internal/cdc";
  public static final String FULL_MODE = "full";

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final String slotName;
  private final String publicationName;
  private final String wsUrl;
  private final String secret;
  private final int healthPort;
  private final String workerMode;
  private final Path diskPath;
  private final ResourceThresholds thresholds;
  private final WalLimits walLimits;

  private CdcWorkerConfig(Builder builder) {
    this.pgHost = builder.pgHost;
    this.pgPort = builder.pgPort;
    this.pgDatabase = builder.pgDatabase;
    this.pgUser = builder.pgUser;
    this.pgPasswordEnv = builder.pgPasswordEnv;
    this.ssl = builder.ssl;
    this.slotName = builder.slotName;
    this.publicationName = builder.publicationName;
    this.wsUrl = builder.wsUrl;
    this.secret = builder.secret;
    this.healthPort = builder.healthPort;
    this.workerMode = builder.workerMode;
    this.diskPath = builder.diskPath;
    this.thresholds = builder.thresholds;
    this.walLimits = builder.walLimits;
  }

  public static CdcWorkerConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static CdcWorkerConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    Builder builder = new Builder();
    builder.pgHost = envOrDefault(env, "PGHOST", PostgresReplicationOptions.DEFAULT_HOST);
    builder.pgPort = intEnvOrDefault(env, "PGPORT", PostgresReplicationOptions.DEFAULT_PORT);
    builder.pgDatabase = envOrDefault(env, "PGDATABASE", "postgres");
    builder.pgUser = envOrDefault(env, "PGUSER", "postgres");
    builder.pgPasswordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    builder.ssl = boolEnvOrDefault(env, "PGSSL", false);
    builder.slotName = envOrDefault(env, "CDC_SLOT_NAME", PostgresReplicationOptions.DEFAULT_SLOT_NAME);
    builder.publicationName = envOrDefault(env, "CDC_PUBLICATION_NAME",
      PostgresReplicationOptions.DEFAULT_PUBLICATION_NAME);
    builder.wsUrl = envOrDefault(env, "API_WS_URL", DEFAULT_WS_URL);
    builder.secret = envOrDefault(env, "CDC_INTERNAL_SECRET", null);
    builder.healthPort = intEnvOrDefault(env, "CDC_HEALTH_PORT", DEFAULT_HEALTH_PORT);
    builder.workerMode = envOrDefault(env, "CDC_WORKER_MODE", "");
    builder.diskPath = Path.of(envOrDefault(env, "CDC_DISK_PATH", "/"));

    builder.thresholds = new ResourceThresholds()
      .setWalWarningBytes(longEnvOrDefault(env, "CDC_WAL_WARNING_BYTES", ResourceThresholds.DEFAULT_WAL_WARNING_BYTES))
      .setWalShutdownBytes(longEnvOrDefault(env, "CDC_WAL_SHUTDOWN_BYTES",
        ResourceThresholds.DEFAULT_WAL_SHUTDOWN_BYTES))
      .setDiskWarningBytes(longEnvOrDefault(env, "CDC_DISK_WARNING_BYTES",
        ResourceThresholds.DEFAULT_DISK_WARNING_BYTES))
      .setDiskShutdownBytes(longEnvOrDefault(env, "CDC_DISK_SHUTDOWN_BYTES",
        ResourceThresholds.DEFAULT_DISK_SHUTDOWN_BYTES))
      .setPauseWarning(Duration.ofMillis(longEnvOrDefault(env, "CDC_PAUSE_WARNING_MS",
        ResourceThresholds.DEFAULT_PAUSE_WARNING.toMillis())))
      .setCheckInterval(Duration.ofMillis(longEnvOrDefault(env, "CDC_GUARD_INTERVAL_MS",
        ResourceThresholds.DEFAULT_CHECK_INTERVAL.toMillis())));

    builder.walLimits = new WalLimits(
      intEnvOrDefault(env, "CDC_WAL_LIMIT_PERCENT", WalLimits.DEFAULT_PERCENT),
      longEnvOrDefault(env, "CDC_WAL_LIMIT_MIN_BYTES", WalLimits.DEFAULT_MIN_BYTES),
      longEnvOrDefault(env, "CDC_WAL_LIMIT_MAX_BYTES", WalLimits.DEFAULT_MAX_BYTES),
      longEnvOrDefault(env, "CDC_MIN_FREE_DISK_BYTES", WalLimits.DEFAULT_MIN_FREE_DISK_BYTES));

    return new CdcWorkerConfig(builder);
  }

  public boolean isFullMode() {
    return FULL_MODE.equalsIgnoreCase(workerMode);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public String slotName() {
    return slotName;
  }

  public String publicationName() {
    return publicationName;
  }

  public String wsUrl() {
    return wsUrl;
  }

  public boolean hasSecret() {
    return secret != null && !secret.isBlank();
  }

  public int healthPort() {
    return healthPort;
  }

  public String workerMode() {
    return workerMode;
  }

  public Path diskPath() {
    return diskPath;
  }

  public ResourceThresholds thresholds() {
    return new ResourceThresholds(thresholds);
  }

  public WalLimits walLimits() {
    return walLimits;
  }

  public PostgresReplicationOptions toReplicationOptions() {
    PostgresReplicationOptions options = new PostgresReplicationOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setSlotName(slotName)
      .setPublicationName(publicationName);
    CdcOptionPresets.applyProductionDefaults(options);
    return options;
  }

  public DeliveryChannelOptions toDeliveryOptions() {
    DeliveryChannelOptions options = new DeliveryChannelOptions()
      .setUrl(wsUrl)
      .setSecret(secret);
    CdcOptionPresets.applyProductionDefaults(options);
    return options;
  }

  @Override
  public String toString() {
    return "CdcWorkerConfig{pgHost=" + pgHost + ", pgPort=" + pgPort + ", pgDatabase=" + pgDatabase
      + ", slotName=" + slotName + ", publicationName=" + publicationName + ", wsUrl=" + wsUrl
      + ", secret=" + (hasSecret() ? "***" : "<unset>") + ", healthPort=" + healthPort
      + ", workerMode=" + workerMode + ", diskPath=" + diskPath + '}';
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static long longEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }

  private static final class Builder {
    private String pgHost;
    private int pgPort;
    private String pgDatabase;
    private String pgUser;
    private String pgPasswordEnv;
    private boolean ssl;
    private String slotName;
    private String publicationName;
    private String wsUrl;
    private String secret;
    private int healthPort;
    private String workerMode;
    private Path diskPath;
    private ResourceThresholds thresholds;
    private WalLimits walLimits;
  }
}
