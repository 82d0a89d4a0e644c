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
 * Connection, slot and publication configuration for the activity subscription.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PostgresReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_SLOT_NAME = "cdc_slot";
  public static final String DEFAULT_PUBLICATION_NAME = "cdc_pub";
  public static final String DEFAULT_APPLICATION_NAME = "activity-cdc-worker";
  public static final Duration DEFAULT_SUBSCRIPTION_RETRY_DELAY = Duration.ofSeconds(5);

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String publicationName;
  private String applicationName;
  private boolean preflightEnabled;
  private RetryPolicy subscriptionRetryPolicy;
  private RetryPolicy persistenceRetryPolicy;

  public PostgresReplicationOptions() {
    init();
  }

  public PostgresReplicationOptions(JsonObject json) {
    init();
    PostgresReplicationOptionsConverter.fromJson(json, this);
  }

  public PostgresReplicationOptions(PostgresReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.publicationName = other.publicationName;
    this.applicationName = other.applicationName;
    this.preflightEnabled = other.preflightEnabled;
    this.subscriptionRetryPolicy = other.subscriptionRetryPolicy.copy();
    this.persistenceRetryPolicy = other.persistenceRetryPolicy.copy();
  }

  public String getHost() {
    return host;
  }

  public PostgresReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresReplicationOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresReplicationOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublicationName() {
    return publicationName;
  }

  public PostgresReplicationOptions setPublicationName(String publicationName) {
    this.publicationName = publicationName;
    return this;
  }

  public String getApplicationName() {
    return applicationName;
  }

  public PostgresReplicationOptions setApplicationName(String applicationName) {
    this.applicationName = applicationName;
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresReplicationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public RetryPolicy getSubscriptionRetryPolicy() {
    return subscriptionRetryPolicy;
  }

  /**
   * Delay schedule for re-opening the replication stream after a subscription-level failure. The
   * subscription always retries, whatever {@code maxAttempts} says.
   */
  @GenIgnore
  public PostgresReplicationOptions setSubscriptionRetryPolicy(RetryPolicy subscriptionRetryPolicy) {
    this.subscriptionRetryPolicy = Objects.requireNonNull(subscriptionRetryPolicy, "subscriptionRetryPolicy");
    return this;
  }

  public RetryPolicy getPersistenceRetryPolicy() {
    return persistenceRetryPolicy;
  }

  @GenIgnore
  public PostgresReplicationOptions setPersistenceRetryPolicy(RetryPolicy persistenceRetryPolicy) {
    this.persistenceRetryPolicy = Objects.requireNonNull(persistenceRetryPolicy, "persistenceRetryPolicy");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresReplicationOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresReplicationOptions(json);
  }

  String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + database;
  }

  String resolvePassword() {
    String resolved = password;
    if ((resolved == null || resolved.isBlank()) && passwordEnv != null && !passwordEnv.isBlank()) {
      resolved = System.getenv(passwordEnv);
    }
    return resolved;
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort("port", port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.require("slotName", slotName);
    OptionValidation.require("publicationName", publicationName);
    OptionValidation.require("applicationName", applicationName);
    Objects.requireNonNull(subscriptionRetryPolicy, "subscriptionRetryPolicy").validate();
    Objects.requireNonNull(persistenceRetryPolicy, "persistenceRetryPolicy").validate();
    if (persistenceRetryPolicy.isUnbounded()) {
      throw new IllegalArgumentException("persistenceRetryPolicy must bound maxAttempts");
    }
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    slotName = DEFAULT_SLOT_NAME;
    publicationName = DEFAULT_PUBLICATION_NAME;
    applicationName = DEFAULT_APPLICATION_NAME;
    preflightEnabled = true;
    subscriptionRetryPolicy = RetryPolicy.fixedDelay(DEFAULT_SUBSCRIPTION_RETRY_DELAY);
    persistenceRetryPolicy = RetryPolicy.bounded(3, Duration.ofMillis(100), 2.0d, Duration.ofSeconds(2));
  }
}
