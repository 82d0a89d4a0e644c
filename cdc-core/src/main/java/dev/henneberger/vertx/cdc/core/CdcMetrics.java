package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local counters reported on the health endpoint.
 */
public final class CdcMetrics {

  private final AtomicLong messagesProcessed = new AtomicLong();
  private final AtomicLong activitiesCreated = new AtomicLong();
  private final AtomicLong messagesSent = new AtomicLong();
  private final AtomicLong sendFailures = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private volatile Instant lastProcessedAt;

  public void messageProcessed() {
    messagesProcessed.incrementAndGet();
    lastProcessedAt = Instant.now();
  }

  public void activityCreated() {
    activitiesCreated.incrementAndGet();
  }

  public void messageSent() {
    messagesSent.incrementAndGet();
  }

  public void sendFailed() {
    sendFailures.incrementAndGet();
  }

  public void error() {
    errors.incrementAndGet();
  }

  public long messagesProcessed() {
    return messagesProcessed.get();
  }

  public long activitiesCreated() {
    return activitiesCreated.get();
  }

  public long messagesSent() {
    return messagesSent.get();
  }

  public long sendFailures() {
    return sendFailures.get();
  }

  public long errors() {
    return errors.get();
  }

  public Instant lastProcessedAt() {
    return lastProcessedAt;
  }

  public JsonObject toJson() {
    Instant last = lastProcessedAt;
    return new JsonObject()
      .put("messagesProcessed", messagesProcessed.get())
      .put("activitiesCreated", activitiesCreated.get())
      .put("messagesSent", messagesSent.get())
      .put("sendFailures", sendFailures.get())
      .put("errors", errors.get())
      .put("lastProcessedAt", last == null ? null : last.toString());
  }
}
