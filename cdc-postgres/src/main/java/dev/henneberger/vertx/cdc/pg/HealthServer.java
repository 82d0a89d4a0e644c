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

import dev.henneberger.vertx.cdc.core.HealthReporter;
import dev.henneberger.vertx.cdc.core.HealthStatus;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /health}: 200 while healthy or degraded, 503 when unhealthy.
 */
public final class HealthServer implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

  private final Vertx vertx;
  private final HealthReporter reporter;
  private volatile HttpServer server;

  public HealthServer(Vertx vertx, HealthReporter reporter) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
  }

  /**
   * @return the bound port, which differs from {@code port} only when {@code port} is 0
   */
  public Future<Integer> listen(int port) {
    HttpServer created = vertx.createHttpServer().requestHandler(this::handle);
    return created.listen(port).map(bound -> {
      server = bound;
      LOG.info("port={} health endpoint listening", bound.actualPort());
      return bound.actualPort();
    });
  }

  private void handle(HttpServerRequest request) {
    if (!"/health".equals(request.path())) {
      request.response().setStatusCode(404).end();
      return;
    }
    if (request.method() != HttpMethod.GET) {
      request.response().setStatusCode(405).putHeader("allow", "GET").end();
      return;
    }

    JsonObject snapshot;
    try {
      snapshot = reporter.snapshot();
    } catch (RuntimeException e) {
      LOG.error("health snapshot failed", e);
      request.response().setStatusCode(500).end();
      return;
    }
    boolean unhealthy = HealthStatus.UNHEALTHY.wireName().equals(snapshot.getString("status"));
    request.response()
      .setStatusCode(unhealthy ? 503 : 200)
      .putHeader("content-type", "application/json")
      .end(snapshot.encode());
  }

  @Override
  public void close() {
    HttpServer current = server;
    server = null;
    if (current != null) {
      current.close();
    }
  }
}
