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

import dev.henneberger.vertx.cdc.core.ActivityPipeline;
import dev.henneberger.vertx.cdc.core.DeliveryChannel;
import dev.henneberger.vertx.cdc.core.PreflightFailedException;
import dev.henneberger.vertx.cdc.core.PreflightIssue;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.ProcessingResult;
import dev.henneberger.vertx.cdc.core.ReplicationMessage;
import dev.henneberger.vertx.cdc.core.ReplicationStateMachine;
import dev.henneberger.vertx.cdc.core.RetryHelper;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams pgoutput changes from the configured slot through the activity pipeline.
 *
 * <p>One daemon thread reads the slot and processes messages strictly in order. A message position
 * is acknowledged to the server only when the pipeline allows it, so the slot keeps WAL while the
 * downstream consumer is away. Session failures are retried by the subscription retry policy and
 * resume from the slot's confirmed position.
 */
public class PostgresActivitySubscription implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresActivitySubscription.class);
  private static final long SLOT_LAG_WARNING_BYTES = 128L * 1024L * 1024L;
  private static final long IDLE_POLL_MILLIS = 50L;

  private final Vertx vertx;
  private final PostgresReplicationOptions options;
  private final PostgresConnectionFactory connections;
  private final PgOutputChangeDecoder decoder;
  private final ActivityPipeline pipeline;
  private final ReplicationStateMachine stateMachine;
  private final DeliveryChannel channel;
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Connection replConnection;
  private volatile PGReplicationStream replicationStream;
  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile boolean closed;

  public PostgresActivitySubscription(Vertx vertx,
                                      PostgresReplicationOptions options,
                                      PgOutputChangeDecoder decoder,
                                      ActivityPipeline pipeline,
                                      ReplicationStateMachine stateMachine,
                                      DeliveryChannel channel) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresReplicationOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.connections = new PostgresConnectionFactory(this.options);
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  /**
   * Completes once the first replication session is streaming.
   */
  public Future<Void> start() {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if (closed) {
        return Future.failedFuture("subscription is closed");
      }
      if (startPromise != null) {
        return startPromise.future();
      }
      shouldRun.set(true);
      startPromise = Promise.promise();
      promiseToReturn = startPromise;
    }

    Future<Void> preflightFuture;
    if (options.isPreflightEnabled()) {
      preflightFuture = preflight().compose(report -> {
        if (report.ok()) {
          report.warnings().forEach(issue -> LOG.warn("slot={} preflight warning code={} {}",
            options.getSlotName(), issue.code(), issue.message()));
          return Future.succeededFuture();
        }
        return Future.failedFuture(new PreflightFailedException(report));
      });
    } else {
      preflightFuture = Future.succeededFuture();
    }

    preflightFuture.onSuccess(v -> startWorker())
      .onFailure(err -> {
        shouldRun.set(false);
        stateMachine.markStopped(err, 0);
        failStart(err);
      });

    return promiseToReturn.future();
  }

  public Future<PreflightReport> preflight() {
    return vertx.executeBlocking(this::runPreflightChecks);
  }

  public boolean isRunning() {
    Thread thread = worker;
    return thread != null && thread.isAlive();
  }

  @Override
  public synchronized void close() {
    closed = true;
    shouldRun.set(false);

    closeStream();

    Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
    }
    stateMachine.markStopped(null, 0);

    Promise<Void> currentStartPromise = startPromise;
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("subscription closed before streaming");
    }
  }

  private synchronized void startWorker() {
    if (!shouldRun.get()) {
      return;
    }
    if (worker != null && worker.isAlive()) {
      return;
    }

    worker = new Thread(this::runLoop, "cdc-repl-" + options.getSlotName());
    worker.setDaemon(true);
    worker.start();
  }

  private void runLoop() {
    RetryPolicy retryPolicy = options.getSubscriptionRetryPolicy();
    long attempt = 0;

    try {
      while (shouldRun.get()) {
        attempt++;
        try {
          runSession(attempt);
          if (!shouldRun.get()) {
            return;
          }
          throw new IllegalStateException("replication session ended unexpectedly");
        } catch (Exception e) {
          if (!shouldRun.get() || isExpectedShutdown(e)) {
            return;
          }

          stateMachine.markStopped(e, attempt);
          LOG.error("slot={} attempt={} replication session failed", options.getSlotName(), attempt, e);

          sleepInterruptibly(retryPolicy.computeDelayMillis(attempt));
        }
      }
    } finally {
      closeStream();
      synchronized (this) {
        if (worker == Thread.currentThread()) {
          worker = null;
        }
      }
    }
  }

  private void runSession(long attempt) throws Exception {
    String slotName = options.getSlotName();

    try (Connection replConn = connections.openReplicationConnection()) {
      this.replConnection = replConn;

      ensureReplicationSlot();
      PGReplicationStream stream = openReplicationStream(replConn.unwrap(PGConnection.class), slotName);
      this.replicationStream = stream;

      stateMachine.beginSubscription(channel.isOpen(), attempt);
      LOG.info("slot={} publication={} attempt={} streaming", slotName, options.getPublicationName(), attempt);
      completeStart();

      LogSequenceNumber lastAcknowledged = LogSequenceNumber.INVALID_LSN;
      while (shouldRun.get()) {
        ByteBuffer buffer = stream.readPending();
        if (buffer == null) {
          lastAcknowledged = acknowledgeHeartbeat(stream, lastAcknowledged);
          sleepInterruptibly(IDLE_POLL_MILLIS);
          continue;
        }

        LogSequenceNumber receiveLsn = stream.getLastReceiveLSN();
        ReplicationMessage message = decoder.decode(toBytes(buffer), receiveLsn.asString());
        ProcessingResult result = pipeline.process(message);
        if (requiresRestart(result)) {
          throw new IllegalStateException("message at lsn " + result.lsn()
            + " failed, resuming from the last acknowledged position", result.error());
        }
        if (result.outcome() == ProcessingResult.Outcome.FAILED) {
          LOG.warn("slot={} lsn={} message could not be processed, continuing without acknowledging it",
            slotName, result.lsn());
          continue;
        }
        if (result.acknowledge()) {
          acknowledge(stream, receiveLsn);
          lastAcknowledged = receiveLsn;
        }
      }
    }
  }

  /**
   * Only a transient failure restarts the session so the message is redelivered; anything else is
   * left unacknowledged and the stream moves on.
   */
  static boolean requiresRestart(ProcessingResult result) {
    return result.outcome() == ProcessingResult.Outcome.FAILED && RetryHelper.isTransient(result.error());
  }

  private PGReplicationStream openReplicationStream(PGConnection pgConnection, String slotName) throws SQLException {
    // No start position: the server resumes from the slot's confirmed flush position.
    return pgConnection.getReplicationAPI()
      .replicationStream()
      .logical()
      .withSlotName(slotName)
      .withSlotOption("proto_version", "1")
      .withSlotOption("publication_names", options.getPublicationName())
      .start();
  }

  private LogSequenceNumber acknowledgeHeartbeat(PGReplicationStream stream,
                                                 LogSequenceNumber lastAcknowledged) throws SQLException {
    LogSequenceNumber lsn = stream.getLastReceiveLSN();
    if (lsn == null || lsn.equals(LogSequenceNumber.INVALID_LSN) || lsn.equals(lastAcknowledged)) {
      return lastAcknowledged;
    }
    if (!pipeline.acknowledgeHeartbeat(lsn.asString())) {
      return lastAcknowledged;
    }
    acknowledge(stream, lsn);
    return lsn;
  }

  private static void acknowledge(PGReplicationStream stream, LogSequenceNumber lsn) throws SQLException {
    stream.setAppliedLSN(lsn);
    stream.setFlushedLSN(lsn);
    stream.forceUpdateStatus();
  }

  private void closeStream() {
    PGReplicationStream stream = this.replicationStream;
    this.replicationStream = null;
    if (stream != null) {
      try {
        stream.close();
      } catch (SQLException e) {
        LOG.debug("slot={} replication stream close failed: {}", options.getSlotName(), e.getMessage());
      }
    }

    Connection replConn = this.replConnection;
    this.replConnection = null;
    if (replConn != null) {
      try {
        replConn.close();
      } catch (SQLException e) {
        LOG.debug("slot={} replication connection close failed: {}", options.getSlotName(), e.getMessage());
      }
    }
  }

  void ensureReplicationSlot() throws SQLException {
    try (Connection conn = connections.openConnection();
         PreparedStatement statement = conn.prepareStatement(
           "SELECT pg_create_logical_replication_slot(?, ?)")
    ) {
      statement.setString(1, options.getSlotName());
      statement.setString(2, PgOutputChangeDecoder.PLUGIN);
      try {
        statement.execute();
        LOG.info("slot={} plugin={} created", options.getSlotName(), PgOutputChangeDecoder.PLUGIN);
      } catch (SQLException createError) {
        if (isSlotAlreadyExists(createError)) {
          return;
        }
        throw createError;
      }
    }
  }

  private boolean isExpectedShutdown(Exception error) {
    if (shouldRun.get()) {
      return false;
    }
    String message = error.getMessage();
    return message != null && message.contains("replication stream has been closed");
  }

  static boolean isSlotAlreadyExists(SQLException error) {
    String state = error.getSQLState();
    if ("42710".equals(state)) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }

  private static byte[] toBytes(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void sleepInterruptibly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private PreflightReport runPreflightChecks() {
    List<PreflightIssue> issues = new ArrayList<>();

    try (Connection conn = connections.openConnection()) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", issues, "MAX_REPLICATION_SLOTS_INVALID");
      checkPositiveSetting(conn, "max_wal_senders", issues, "MAX_WAL_SENDERS_INVALID");
      checkExistingSlot(conn, issues);
      checkSlotLag(conn, issues);
      checkPublication(conn, issues);
    } catch (Exception e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }

    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      if (!rs.next()) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_UNKNOWN",
          "Could not read wal_level",
          "Set wal_level=logical and restart PostgreSQL."
        ));
        return;
      }

      String walLevel = rs.getString(1);
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."
        ));
      }
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.warning(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION privilege or use a superuser role."
        ));
      }
    }
  }

  private void checkPositiveSetting(Connection conn,
                                    String setting,
                                    List<PreflightIssue> issues,
                                    String code) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(PreflightIssue.error(
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."
          ));
        }
      }
    }
  }

  private void checkExistingSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          String slotPlugin = rs.getString(1);
          if (!PgOutputChangeDecoder.PLUGIN.equalsIgnoreCase(slotPlugin)) {
            issues.add(PreflightIssue.error(
              "SLOT_PLUGIN_MISMATCH",
              "Replication slot uses plugin '" + slotPlugin + "' but activities are decoded from '"
                + PgOutputChangeDecoder.PLUGIN + "'",
              "Drop the slot so it can be recreated with pgoutput, or configure another slot name."
            ));
          }
        }
      }
    }
  }

  private void checkSlotLag(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(PostgresResourceProbe.SLOT_RETAINED_WAL_SQL)) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          long lagBytes = rs.getLong(1);
          if (lagBytes > SLOT_LAG_WARNING_BYTES) {
            issues.add(PreflightIssue.warning(
              "SLOT_LAG_HIGH",
              "Replication slot lag is " + lagBytes + " bytes",
              "The worker will replay the backlog; check that the delivery target is reachable."
            ));
          }
        }
      }
    }
  }

  private void checkPublication(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, options.getPublicationName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          issues.add(PreflightIssue.error(
            "PUBLICATION_MISSING",
            "Publication '" + options.getPublicationName() + "' does not exist",
            "Run the provisioning migration that creates the publication over the tracked tables."
          ));
        }
      }
    }
  }
}
