package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One guard reading and its classification against {@link ResourceThresholds}.
 */
public final class ResourceStatus {

  private final long walRetainedBytes;
  private final long freeDiskBytes;
  private final Duration pausedFor;
  private final ResourceSeverity severity;
  private final List<String> reasons;

  public ResourceStatus(long walRetainedBytes,
                        long freeDiskBytes,
                        Duration pausedFor,
                        ResourceSeverity severity,
                        List<String> reasons) {
    this.walRetainedBytes = walRetainedBytes;
    this.freeDiskBytes = freeDiskBytes;
    this.pausedFor = pausedFor == null ? Duration.ZERO : pausedFor;
    this.severity = Objects.requireNonNull(severity, "severity");
    this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
  }

  /**
   * WAL at or above its shutdown limit, or free disk at or below its shutdown floor, is an emergency.
   * Crossing a warning limit, or staying paused longer than the pause warning, is a warning.
   */
  public static ResourceStatus classify(long walRetainedBytes,
                                        long freeDiskBytes,
                                        Duration pausedFor,
                                        ResourceThresholds thresholds) {
    List<String> emergencies = new ArrayList<>();
    if (walRetainedBytes >= thresholds.getWalShutdownBytes()) {
      emergencies.add("wal_retained_bytes=" + walRetainedBytes + " >= " + thresholds.getWalShutdownBytes());
    }
    if (freeDiskBytes <= thresholds.getDiskShutdownBytes()) {
      emergencies.add("free_disk_bytes=" + freeDiskBytes + " <= " + thresholds.getDiskShutdownBytes());
    }
    if (!emergencies.isEmpty()) {
      return new ResourceStatus(walRetainedBytes, freeDiskBytes, pausedFor, ResourceSeverity.EMERGENCY, emergencies);
    }

    List<String> warnings = new ArrayList<>();
    if (walRetainedBytes > thresholds.getWalWarningBytes()) {
      warnings.add("wal_retained_bytes=" + walRetainedBytes + " > " + thresholds.getWalWarningBytes());
    }
    if (freeDiskBytes < thresholds.getDiskWarningBytes()) {
      warnings.add("free_disk_bytes=" + freeDiskBytes + " < " + thresholds.getDiskWarningBytes());
    }
    if (pausedFor != null && pausedFor.compareTo(thresholds.getPauseWarning()) > 0) {
      warnings.add("paused_ms=" + pausedFor.toMillis() + " > " + thresholds.getPauseWarning().toMillis());
    }
    ResourceSeverity severity = warnings.isEmpty() ? ResourceSeverity.OK : ResourceSeverity.WARNING;
    return new ResourceStatus(walRetainedBytes, freeDiskBytes, pausedFor, severity, warnings);
  }

  public long walRetainedBytes() {
    return walRetainedBytes;
  }

  public long freeDiskBytes() {
    return freeDiskBytes;
  }

  public Duration pausedFor() {
    return pausedFor;
  }

  public ResourceSeverity severity() {
    return severity;
  }

  public List<String> reasons() {
    return reasons;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("severity", severity.wireName())
      .put("walRetainedBytes", walRetainedBytes)
      .put("freeDiskBytes", freeDiskBytes)
      .put("pausedMs", pausedFor.toMillis())
      .put("reasons", new JsonArray(new ArrayList<>(reasons)));
  }

  @Override
  public String toString() {
    return "ResourceStatus{" + severity + ' ' + reasons + '}';
  }
}
