package dev.henneberger.vertx.cdc.core;

import java.util.Optional;

/**
 * Startup sizing for the server-side cap on WAL a replication slot may retain
 * ({@code max_slot_wal_keep_size}).
 */
public final class WalLimits {

  public static final int DEFAULT_PERCENT = 50;
  public static final long DEFAULT_MIN_BYTES = ResourceThresholds.GIB;
  public static final long DEFAULT_MAX_BYTES = 50 * ResourceThresholds.GIB;
  public static final long DEFAULT_MIN_FREE_DISK_BYTES = 2 * ResourceThresholds.GIB;

  private final int percent;
  private final long minBytes;
  private final long maxBytes;
  private final long minFreeDiskBytes;

  public WalLimits(int percent, long minBytes, long maxBytes, long minFreeDiskBytes) {
    if (percent < 1 || percent > 100) {
      throw new IllegalArgumentException("percent must be between 1 and 100");
    }
    OptionValidation.requireMin("minBytes", minBytes, 1);
    OptionValidation.requireOrdered("minBytes", minBytes, "maxBytes", maxBytes);
    OptionValidation.requireMin("minFreeDiskBytes", minFreeDiskBytes, 0);
    this.percent = percent;
    this.minBytes = minBytes;
    this.maxBytes = maxBytes;
    this.minFreeDiskBytes = minFreeDiskBytes;
  }

  public static WalLimits defaults() {
    return new WalLimits(DEFAULT_PERCENT, DEFAULT_MIN_BYTES, DEFAULT_MAX_BYTES, DEFAULT_MIN_FREE_DISK_BYTES);
  }

  /**
   * {@code percent} of the free disk, clamped to {@code [minBytes, maxBytes]}.
   */
  public long maxSlotWalKeepBytes(long freeDiskBytes) {
    long share = Math.max(0, freeDiskBytes) * percent / 100;
    return Math.max(minBytes, Math.min(maxBytes, share));
  }

  /**
   * Size in megabytes, the unit {@code max_slot_wal_keep_size} takes.
   */
  public long maxSlotWalKeepMegabytes(long freeDiskBytes) {
    return maxSlotWalKeepBytes(freeDiskBytes) / (1024L * 1024L);
  }

  public Optional<PreflightIssue> diskFloorIssue(long freeDiskBytes) {
    if (freeDiskBytes > minFreeDiskBytes) {
      return Optional.empty();
    }
    return Optional.of(PreflightIssue.error(
      "DISK_BELOW_MINIMUM",
      "Free disk " + freeDiskBytes + " bytes does not exceed the minimum of " + minFreeDiskBytes + " bytes",
      "Free up disk space or lower CDC_MIN_FREE_DISK_BYTES before starting the worker"));
  }

  public int percent() {
    return percent;
  }

  public long minBytes() {
    return minBytes;
  }

  public long maxBytes() {
    return maxBytes;
  }

  public long minFreeDiskBytes() {
    return minFreeDiskBytes;
  }
}
