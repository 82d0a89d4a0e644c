package dev.henneberger.vertx.cdc.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay schedule shared by the bounded per-message retries, the delivery channel reconnects and the
 * unbounded subscription loop. {@code maxAttempts == 0} means unbounded.
 */
public final class RetryPolicy {
  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts = 0;

  private RetryPolicy() {
  }

  public static RetryPolicy exponentialBackoff() {
    return new RetryPolicy();
  }

  public static RetryPolicy bounded(long maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
    return new RetryPolicy()
      .setMaxAttempts(maxAttempts)
      .setInitialDelay(initialDelay)
      .setMultiplier(multiplier)
      .setMaxDelay(maxDelay)
      .setJitter(0.0d);
  }

  public static RetryPolicy fixedDelay(Duration delay) {
    return new RetryPolicy()
      .setInitialDelay(delay)
      .setMaxDelay(delay)
      .setMultiplier(1.0d)
      .setJitter(0.0d)
      .setMaxAttempts(0);
  }

  public RetryPolicy copy() {
    RetryPolicy copy = new RetryPolicy();
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    copy.maxAttempts = maxAttempts;
    return copy;
  }

  public RetryPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public RetryPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public RetryPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public RetryPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public RetryPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  public boolean isUnbounded() {
    return maxAttempts == 0;
  }

  /**
   * Whether another attempt may follow the given (1-based) failed attempt.
   */
  public boolean hasAttemptsLeft(long attempt) {
    return maxAttempts == 0 || attempt < maxAttempts;
  }

  /**
   * Delay before the attempt that follows failed attempt {@code attempt} (1-based):
   * {@code min(maxDelay, initialDelay * multiplier^(attempt - 1))}, spread by the jitter ratio.
   */
  public long computeDelayMillis(long attempt) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = (long) Math.min(base, (double) maxDelay.toMillis());
    if (jitter == 0.0d) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    long min = Math.max(0L, capped - delta);
    long max = capped + delta;
    return ThreadLocalRandom.current().nextLong(min, max + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }
}
