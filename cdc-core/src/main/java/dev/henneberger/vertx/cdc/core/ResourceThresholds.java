package dev.henneberger.vertx.cdc.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits checked by the {@link ResourceGuard} while replication is paused. WAL limits are upper bounds
 * on retained bytes; disk limits are lower bounds on free bytes.
 */
public final class ResourceThresholds {

  public static final long GIB = 1024L * 1024L * 1024L;

  public static final long DEFAULT_WAL_WARNING_BYTES = GIB;
  public static final long DEFAULT_WAL_SHUTDOWN_BYTES = 5 * GIB;
  public static final long DEFAULT_DISK_WARNING_BYTES = 5 * GIB;
  public static final long DEFAULT_DISK_SHUTDOWN_BYTES = GIB;
  public static final Duration DEFAULT_PAUSE_WARNING = Duration.ofMinutes(5);
  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);

  private long walWarningBytes = DEFAULT_WAL_WARNING_BYTES;
  private long walShutdownBytes = DEFAULT_WAL_SHUTDOWN_BYTES;
  private long diskWarningBytes = DEFAULT_DISK_WARNING_BYTES;
  private long diskShutdownBytes = DEFAULT_DISK_SHUTDOWN_BYTES;
  private Duration pauseWarning = DEFAULT_PAUSE_WARNING;
  private Duration checkInterval = DEFAULT_CHECK_INTERVAL;

  public ResourceThresholds() {
  }

  public ResourceThresholds(ResourceThresholds other) {
    this.walWarningBytes = other.walWarningBytes;
    this.walShutdownBytes = other.walShutdownBytes;
    this.diskWarningBytes = other.diskWarningBytes;
    this.diskShutdownBytes = other.diskShutdownBytes;
    this.pauseWarning = other.pauseWarning;
    this.checkInterval = other.checkInterval;
  }

  public long getWalWarningBytes() {
    return walWarningBytes;
  }

  public ResourceThresholds setWalWarningBytes(long walWarningBytes) {
    this.walWarningBytes = walWarningBytes;
    return this;
  }

  public long getWalShutdownBytes() {
    return walShutdownBytes;
  }

  public ResourceThresholds setWalShutdownBytes(long walShutdownBytes) {
    this.walShutdownBytes = walShutdownBytes;
    return this;
  }

  public long getDiskWarningBytes() {
    return diskWarningBytes;
  }

  public ResourceThresholds setDiskWarningBytes(long diskWarningBytes) {
    this.diskWarningBytes = diskWarningBytes;
    return this;
  }

  public long getDiskShutdownBytes() {
    return diskShutdownBytes;
  }

  public ResourceThresholds setDiskShutdownBytes(long diskShutdownBytes) {
    this.diskShutdownBytes = diskShutdownBytes;
    return this;
  }

  public Duration getPauseWarning() {
    return pauseWarning;
  }

  public ResourceThresholds setPauseWarning(Duration pauseWarning) {
    this.pauseWarning = Objects.requireNonNull(pauseWarning, "pauseWarning");
    return this;
  }

  public Duration getCheckInterval() {
    return checkInterval;
  }

  public ResourceThresholds setCheckInterval(Duration checkInterval) {
    this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
    return this;
  }

  public void validate() {
    OptionValidation.requireMin("walWarningBytes", walWarningBytes, 1);
    OptionValidation.requireMin("diskShutdownBytes", diskShutdownBytes, 0);
    OptionValidation.requireOrdered("walWarningBytes", walWarningBytes, "walShutdownBytes", walShutdownBytes);
    OptionValidation.requireOrdered("diskShutdownBytes", diskShutdownBytes, "diskWarningBytes", diskWarningBytes);
    OptionValidation.requireMin("pauseWarningMs", pauseWarning.toMillis(), 0);
    OptionValidation.requireMin("checkIntervalMs", checkInterval.toMillis(), 1);
  }
}
