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

import dev.henneberger.vertx.cdc.core.TrackedSchema;
import io.vertx.core.Vertx;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Only {@code CDC_WORKER_MODE=full} runs the worker.
 */
public final class CdcWorkerMain {

  private static final Logger LOG = LoggerFactory.getLogger(CdcWorkerMain.class);

  private CdcWorkerMain() {
  }

  public static void main(String[] args) {
    CdcWorkerConfig config = CdcWorkerConfig.fromEnv();
    if (!config.isFullMode()) {
      LOG.info("mode={} activity worker disabled, exiting", config.workerMode());
      return;
    }

    LOG.info("config={} starting activity worker", config);
    Vertx vertx = Vertx.vertx();
    CdcWorker worker = new CdcWorker(vertx, config, TrackedSchema.defaults(), System::exit);

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      worker.close();
      try {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
      } catch (Exception e) {
        LOG.warn("vertx close did not finish: {}", e.toString());
      }
    }, "cdc-shutdown"));

    worker.start().onFailure(err -> {
      LOG.error("activity worker failed to start", err);
      System.exit(1);
    });
  }
}
