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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.ActivityPersistence;
import dev.henneberger.vertx.cdc.core.ActivityPipeline;
import dev.henneberger.vertx.cdc.core.CdcMetrics;
import dev.henneberger.vertx.cdc.core.CountUpdater;
import dev.henneberger.vertx.cdc.core.MessageRouter;
import dev.henneberger.vertx.cdc.core.ReplicationState;
import dev.henneberger.vertx.cdc.core.ReplicationStateMachine;
import dev.henneberger.vertx.cdc.core.SequenceAssigner;
import dev.henneberger.vertx.cdc.core.TableRegistry;
import dev.henneberger.vertx.cdc.core.TrackedSchema;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;

class PostgresActivitySubscriptionContainerTest {

  private static final String PUBLICATION_NAME = "cdc_pub";

  @Test
  void insertBecomesPersistedAndDeliveredActivity() throws Exception {
    PostgresContainers.assumeDocker();

    GenericContainer<?> postgres = PostgresContainers.createPostgresContainer();
    try {
      postgres.start();
      PostgresContainers.provision(postgres);

      Vertx vertx = Vertx.vertx();
      RecordingDeliveryChannel channel = new RecordingDeliveryChannel();
      Harness harness = new Harness(vertx, postgres, "cdc_insert_slot", channel);
      try {
        channel.connect();
        harness.subscription.start().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        assertEquals(ReplicationState.ACTIVE, harness.stateMachine.state());

        PostgresContainers.execute(postgres,
          "INSERT INTO pages(id, organization_id, created_by, name, modified_at) "
            + "VALUES ('p1', 'o1', 'u1', 'Roadmap', now())");

        PostgresContainers.waitFor("delivered activity", () -> channel.sent.size() == 1);
        JsonObject payload = channel.sent.get(0);
        JsonObject activity = payload.getJsonObject("activity");
        assertEquals("page.created", activity.getString("type"));
        assertEquals("p1", activity.getString("entityId"));
        assertEquals("u1", activity.getString("userId"));
        assertEquals("o1", activity.getString("organizationId"));
        assertEquals(1L, activity.getLong("seq").longValue());
        assertEquals("Roadmap", payload.getJsonObject("entity").getString("name"));

        assertEquals(1L, PostgresContainers.queryLong(postgres,
          "SELECT count(*) FROM activities WHERE type = 'page.created' AND entity_id = 'p1'"));
        assertEquals(1L, PostgresContainers.queryLong(postgres,
          "SELECT seq FROM context_counters WHERE context_key = 'o1'"));
      } finally {
        harness.subscription.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void slotPositionHoldsWhileTheChannelIsDown() throws Exception {
    PostgresContainers.assumeDocker();

    GenericContainer<?> postgres = PostgresContainers.createPostgresContainer();
    try {
      postgres.start();
      PostgresContainers.provision(postgres);

      Vertx vertx = Vertx.vertx();
      String slotName = "cdc_paused_slot";
      RecordingDeliveryChannel channel = new RecordingDeliveryChannel().stayDisconnected();
      Harness harness = new Harness(vertx, postgres, slotName, channel);
      try {
        harness.subscription.start().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        assertEquals(ReplicationState.PAUSED, harness.stateMachine.state());
        String confirmedBefore = confirmedFlushLsn(postgres, slotName);

        PostgresContainers.execute(postgres,
          "INSERT INTO pages(id, organization_id, created_by, name) VALUES ('p1', 'o1', 'u1', 'Paused')");
        PostgresContainers.waitFor("persisted activity", () -> PostgresContainers.queryLong(postgres,
          "SELECT count(*) FROM activities WHERE entity_id = 'p1'") == 1L);
        Thread.sleep(1_000);

        assertTrue(channel.sent.isEmpty());
        assertEquals(confirmedBefore, confirmedFlushLsn(postgres, slotName));

        channel.open();
        assertEquals(ReplicationState.ACTIVE, harness.stateMachine.state());
        PostgresContainers.execute(postgres,
          "INSERT INTO pages(id, organization_id, created_by, name) VALUES ('p2', 'o1', 'u1', 'Resumed')");

        PostgresContainers.waitFor("delivered activity", () -> channel.sent.size() == 1);
        assertEquals("p2", channel.sent.get(0).getJsonObject("activity").getString("entityId"));
        assertEquals(2L, channel.sent.get(0).getJsonObject("activity").getLong("seq").longValue());
        PostgresContainers.waitFor("acknowledged position",
          () -> !confirmedBefore.equals(confirmedFlushLsn(postgres, slotName)));
      } finally {
        harness.subscription.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  @Test
  void unwritableRowDoesNotStallTheStream() throws Exception {
    PostgresContainers.assumeDocker();

    GenericContainer<?> postgres = PostgresContainers.createPostgresContainer();
    try {
      postgres.start();
      PostgresContainers.provision(postgres);
      PostgresContainers.execute(postgres,
        "ALTER TABLE activities ADD CONSTRAINT activities_entity_check CHECK (entity_id <> 'bad')");

      Vertx vertx = Vertx.vertx();
      RecordingDeliveryChannel channel = new RecordingDeliveryChannel();
      Harness harness = new Harness(vertx, postgres, "cdc_poison_slot", channel);
      try {
        channel.connect();
        harness.subscription.start().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);

        PostgresContainers.execute(postgres,
          "INSERT INTO pages(id, organization_id, created_by, name) VALUES ('bad', 'o1', 'u1', 'Broken')");
        PostgresContainers.execute(postgres,
          "INSERT INTO pages(id, organization_id, created_by, name) VALUES ('p2', 'o1', 'u1', 'Fine')");

        PostgresContainers.waitFor("activity after the failing row", () -> channel.sent.size() == 1);
        assertEquals("p2", channel.sent.get(0).getJsonObject("activity").getString("entityId"));
        assertEquals(ReplicationState.ACTIVE, harness.stateMachine.state());
        assertEquals(0L, PostgresContainers.queryLong(postgres,
          "SELECT count(*) FROM activities WHERE entity_id = 'bad'"));
      } finally {
        harness.subscription.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      }
    } finally {
      postgres.stop();
    }
  }

  private static String confirmedFlushLsn(GenericContainer<?> postgres, String slotName) throws Exception {
    try (Connection conn = PostgresContainers.connect(postgres);
         Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(
           "SELECT confirmed_flush_lsn::text FROM pg_replication_slots WHERE slot_name='" + slotName + "'")) {
      return rs.next() ? rs.getString(1) : null;
    }
  }

  private static final class Harness {
    final ReplicationStateMachine stateMachine = new ReplicationStateMachine();
    final PostgresActivitySubscription subscription;

    Harness(Vertx vertx, GenericContainer<?> postgres, String slotName, RecordingDeliveryChannel channel) {
      PostgresReplicationOptions options = PostgresContainers.options(postgres)
        .setSlotName(slotName)
        .setPublicationName(PUBLICATION_NAME)
        .setPreflightEnabled(false);
      PostgresConnectionFactory connections = new PostgresConnectionFactory(options);
      TrackedSchema schema = TrackedSchema.defaults();
      channel.setListener(stateMachine);

      ActivityPipeline pipeline = new ActivityPipeline(
        new MessageRouter(TableRegistry.fromSchema(schema), schema),
        new SequenceAssigner(schema, new JdbcSequenceStore(connections)),
        new ActivityPersistence(new JdbcActivityStore(connections), options.getPersistenceRetryPolicy()),
        new CountUpdater(schema, new JdbcCountStore(connections)),
        channel,
        stateMachine,
        new CdcMetrics());
      this.subscription = new PostgresActivitySubscription(
        vertx, options, new PgOutputChangeDecoder(), pipeline, stateMachine, channel);
    }
  }
}
