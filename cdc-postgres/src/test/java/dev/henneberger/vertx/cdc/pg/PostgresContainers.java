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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assumptions;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;

final class PostgresContainers {

  static final String DB_NAME = "testdb";
  static final String DB_USER = "test";
  static final String DB_PASSWORD = "test";

  private PostgresContainers() {
  }

  static void assumeDocker() {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");
  }

  static GenericContainer<?> createPostgresContainer() {
    return new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .withStartupTimeout(Duration.ofMinutes(10))
      .withCommand("postgres",
        "-c", "wal_level=logical",
        "-c", "max_replication_slots=10",
        "-c", "max_wal_senders=10");
  }

  static PostgresReplicationOptions options(GenericContainer<?> postgres) {
    return new PostgresReplicationOptions()
      .setHost(postgres.getHost())
      .setPort(postgres.getFirstMappedPort())
      .setDatabase(DB_NAME)
      .setUser(DB_USER)
      .setPassword(DB_PASSWORD);
  }

  static Connection connect(GenericContainer<?> postgres) throws SQLException {
    return DriverManager.getConnection(
      "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME,
      DB_USER, DB_PASSWORD);
  }

  /**
   * Creates the worker's own tables plus a tracked {@code pages} table published as {@code cdc_pub}.
   */
  static void provision(GenericContainer<?> postgres) throws Exception {
    try (Connection conn = connect(postgres);
         Statement statement = conn.createStatement()) {
      statement.execute(schemaSql());
      statement.execute("CREATE TABLE IF NOT EXISTS pages ("
        + "id TEXT PRIMARY KEY,"
        + "organization_id TEXT,"
        + "created_by TEXT,"
        + "name TEXT,"
        + "modified_at TIMESTAMPTZ)");
      statement.execute("ALTER TABLE pages REPLICA IDENTITY FULL");
      statement.execute("DROP PUBLICATION IF EXISTS cdc_pub");
      statement.execute("CREATE PUBLICATION cdc_pub FOR TABLE pages");
    }
  }

  static void execute(GenericContainer<?> postgres, String sql) throws SQLException {
    try (Connection conn = connect(postgres);
         Statement statement = conn.createStatement()) {
      statement.execute(sql);
    }
  }

  static long queryLong(GenericContainer<?> postgres, String sql) throws SQLException {
    try (Connection conn = connect(postgres);
         Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      return rs.next() ? rs.getLong(1) : -1L;
    }
  }

  static void waitFor(String label, Check check) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
    while (System.nanoTime() < deadline) {
      if (check.passes()) {
        return;
      }
      Thread.sleep(100);
    }
    throw new IllegalStateException("Timed out waiting for " + label);
  }

  private static String schemaSql() throws IOException {
    try (InputStream in = PostgresContainers.class.getResourceAsStream("/db/cdc-schema.sql")) {
      if (in == null) {
        throw new IllegalStateException("db/cdc-schema.sql is not on the classpath");
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @FunctionalInterface
  interface Check {
    boolean passes() throws Exception;
  }
}
