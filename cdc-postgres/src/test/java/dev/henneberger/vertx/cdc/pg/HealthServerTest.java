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

import dev.henneberger.vertx.cdc.core.CdcMetrics;
import dev.henneberger.vertx.cdc.core.HealthReporter;
import dev.henneberger.vertx.cdc.core.ReplicationStateMachine;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HealthServerTest {

  private Vertx vertx;
  private HttpClient client;
  private RecordingDeliveryChannel channel;
  private ReplicationStateMachine stateMachine;
  private CdcMetrics metrics;
  private HealthServer server;
  private int port;

  @BeforeEach
  void setUp() throws Exception {
    vertx = Vertx.vertx();
    client = vertx.createHttpClient();
    channel = new RecordingDeliveryChannel();
    stateMachine = new ReplicationStateMachine();
    channel.setListener(stateMachine);
    metrics = new CdcMetrics();
    server = new HealthServer(vertx, new HealthReporter(channel, stateMachine, metrics, () -> null));
    port = await(server.listen(0));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.close();
    await(vertx.close());
  }

  @Test
  void healthyWhenChannelOpenAndReplicationActive() throws Exception {
    channel.open();
    stateMachine.beginSubscription(true, 1);
    stateMachine.recordMessage("0/16B3748");
    metrics.messageProcessed();

    Response response = get("/health");

    assertEquals(200, response.status);
    assertEquals("healthy", response.body.getString("status"));
    assertEquals("open", response.body.getString("wsState"));
    assertEquals("active", response.body.getString("replicationState"));
    assertEquals("0/16B3748", response.body.getString("lastLsn"));
    assertEquals(1L, response.body.getJsonObject("metrics").getLong("messagesProcessed"));
  }

  @Test
  void degradedWhileReconnectingStillAnswersOk() throws Exception {
    channel.open();
    stateMachine.beginSubscription(true, 1);
    channel.drop();

    Response response = get("/health");

    assertEquals(200, response.status);
    assertEquals("degraded", response.body.getString("status"));
    assertEquals("reconnecting", response.body.getString("wsState"));
    assertEquals("paused", response.body.getString("replicationState"));
  }

  @Test
  void unhealthyWhenChannelClosed() throws Exception {
    channel.close();

    Response response = get("/health");

    assertEquals(503, response.status);
    assertEquals("unhealthy", response.body.getString("status"));
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    assertEquals(404, get("/metrics").status);
  }

  private Response get(String path) throws Exception {
    return await(client.request(HttpMethod.GET, port, "localhost", path)
      .compose(request -> request.send())
      .compose(response -> response.body().map(body -> new Response(response.statusCode(),
        body.length() == 0 ? new JsonObject() : body.toJsonObject()))));
  }

  private static <T> T await(Future<T> future) throws Exception {
    return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  private static final class Response {
    private final int status;
    private final JsonObject body;

    private Response(int status, JsonObject body) {
      this.status = status;
      this.body = body;
    }
  }
}
