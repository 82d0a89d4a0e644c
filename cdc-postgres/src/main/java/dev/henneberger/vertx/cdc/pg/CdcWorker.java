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

import dev.henneberger.vertx.cdc.core.ActivityPersistence;
import dev.henneberger.vertx.cdc.core.ActivityPipeline;
import dev.henneberger.vertx.cdc.core.CdcMetrics;
import dev.henneberger.vertx.cdc.core.CountUpdater;
import dev.henneberger.vertx.cdc.core.DeliveryChannel;
import dev.henneberger.vertx.cdc.core.HealthReporter;
import dev.henneberger.vertx.cdc.core.MessageRouter;
import dev.henneberger.vertx.cdc.core.PreflightIssue;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.ReplicationStateMachine;
import dev.henneberger.vertx.cdc.core.ReplicationSubscription;
import dev.henneberger.vertx.cdc.core.ResourceGuard;
import dev.henneberger.vertx.cdc.core.ResourceProbe;
import dev.henneberger.vertx.cdc.core.SequenceAssigner;
import dev.henneberger.vertx.cdc.core.TableRegistry;
import dev.henneberger.vertx.cdc.core.TrackedSchema;
import dev.henneberger.vertx.cdc.core.WalLimits;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the activity worker: delivery channel, replication subscription, resource guard and
 * health endpoint around one {@link ActivityPipeline}.
 */
public final class CdcWorker implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(CdcWorker.class);
  static final int EMERGENCY_EXIT_CODE = 1;

  private final Vertx vertx;
  private final CdcWorkerConfig config;
  private final TableRegistry registry;
  private final DeliveryChannel channel;
  private final ReplicationStateMachine stateMachine;
  private final CdcMetrics metrics;
  private final ResourceProbe probe;
  private final WalLimitConfigurer walLimitConfigurer;
  private final PostgresActivitySubscription subscription;
  private final ResourceGuard guard;
  private final HealthServer healthServer;
  private final IntConsumer exit;
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private ReplicationSubscription stateLogging;
  private volatile int boundHealthPort = -1;

  public CdcWorker(Vertx vertx, CdcWorkerConfig config, TrackedSchema schema, IntConsumer exit) {
    this(vertx, config, config.toReplicationOptions(), schema,
      new VertxWebSocketDeliveryChannel(vertx, config.toDeliveryOptions()), exit);
  }

  CdcWorker(Vertx vertx,
            CdcWorkerConfig config,
            PostgresReplicationOptions replicationOptions,
            TrackedSchema schema,
            DeliveryChannel channel,
            IntConsumer exit) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.config = Objects.requireNonNull(config, "config");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.exit = Objects.requireNonNull(exit, "exit");
    Objects.requireNonNull(schema, "schema");

    PostgresConnectionFactory connections = new PostgresConnectionFactory(replicationOptions);
    this.registry = TableRegistry.fromSchema(schema);
    this.stateMachine = new ReplicationStateMachine();
    this.metrics = new CdcMetrics();
    this.channel.setListener(stateMachine);

    ActivityPipeline pipeline = new ActivityPipeline(
      new MessageRouter(registry, schema),
      new SequenceAssigner(schema, new JdbcSequenceStore(connections)),
      new ActivityPersistence(new JdbcActivityStore(connections), replicationOptions.getPersistenceRetryPolicy()),
      new CountUpdater(schema, new JdbcCountStore(connections)),
      channel,
      stateMachine,
      metrics);

    this.subscription = new PostgresActivitySubscription(
      vertx, replicationOptions, new PgOutputChangeDecoder(), pipeline, stateMachine, channel);
    this.probe = new PostgresResourceProbe(connections, replicationOptions.getSlotName(), config.diskPath());
    this.walLimitConfigurer = new WalLimitConfigurer(connections, config.walLimits());
    this.guard = new ResourceGuard(vertx, config.thresholds(), probe, stateMachine, this::emergencyShutdown);
    this.healthServer = new HealthServer(vertx, new HealthReporter(channel, stateMachine, metrics, guard::lastStatus));
  }

  /**
   * Runs the worker preflight and caps WAL retention, then brings up the health endpoint before
   * connecting the channel and streaming, so a failing first session is still visible on
   * {@code /health}. The channel connecting is not awaited: the subscription starts paused and
   * resumes once it opens.
   */
  public Future<Void> start() {
    stateLogging = ReplicationLogging.attachDefaultLogging(stateMachine, LOG, config.slotName());

    return vertx.executeBlocking(this::prepare)
      .compose(v -> healthServer.listen(config.healthPort()))
      .compose(port -> {
        boundHealthPort = port;
        guard.attach();
        channel.connect()
          .onFailure(err -> LOG.warn("url={} initial delivery connect failed: {}", config.wsUrl(), err.getMessage()));
        return subscription.start();
      })
      .onSuccess(v -> LOG.info("slot={} healthPort={} activity worker started", config.slotName(), boundHealthPort));
  }

  /**
   * Port the health endpoint is bound to, or {@code -1} before it listens.
   */
  int healthPort() {
    return boundHealthPort;
  }

  private Void prepare() throws Exception {
    List<PreflightIssue> issues = new ArrayList<>();
    registry.emptinessIssue().ifPresent(issues::add);
    if (!config.hasSecret()) {
      issues.add(PreflightIssue.error(
        "DELIVERY_SECRET_MISSING",
        "No shared secret is configured for the delivery channel",
        "Set CDC_INTERNAL_SECRET to the secret the API expects in the x-cdc-secret header."
      ));
    }

    long freeDisk = probe.freeDiskBytes();
    WalLimits walLimits = config.walLimits();
    walLimits.diskFloorIssue(freeDisk).ifPresent(issues::add);

    new PreflightReport(issues).throwIfFailed();
    walLimitConfigurer.apply(freeDisk);
    return null;
  }

  public ReplicationStateMachine stateMachine() {
    return stateMachine;
  }

  public CdcMetrics metrics() {
    return metrics;
  }

  /**
   * Graceful shutdown. In-flight messages are not drained; their positions stay unacknowledged and
   * are replayed idempotently after a restart.
   */
  @Override
  public void close() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    LOG.info("slot={} activity worker stopping", config.slotName());
    guard.close();
    channel.close();
    subscription.close();
    healthServer.close();
    ReplicationSubscription logging = stateLogging;
    if (logging != null) {
      logging.cancel();
    }
  }

  void emergencyShutdown() {
    LOG.error("slot={} emergency shutdown, exiting with code {}", config.slotName(), EMERGENCY_EXIT_CODE);
    close();
    exit.accept(EMERGENCY_EXIT_CODE);
  }
}
