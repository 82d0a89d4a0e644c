package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * Outcome of {@link RetryHelper#withRetry}: a value, an exhausted transient failure, or a permanent
 * failure that was not retried.
 */
public final class RetryResult<T> {

  public enum Outcome {
    SUCCESS,
    EXHAUSTED,
    PERMANENT
  }

  private final Outcome outcome;
  private final T value;
  private final Throwable error;
  private final long attempts;

  private RetryResult(Outcome outcome, T value, Throwable error, long attempts) {
    this.outcome = outcome;
    this.value = value;
    this.error = error;
    this.attempts = attempts;
  }

  static <T> RetryResult<T> success(T value, long attempts) {
    return new RetryResult<>(Outcome.SUCCESS, value, null, attempts);
  }

  static <T> RetryResult<T> exhausted(Throwable error, long attempts) {
    return new RetryResult<>(Outcome.EXHAUSTED, null, Objects.requireNonNull(error, "error"), attempts);
  }

  static <T> RetryResult<T> permanent(Throwable error, long attempts) {
    return new RetryResult<>(Outcome.PERMANENT, null, Objects.requireNonNull(error, "error"), attempts);
  }

  public Outcome outcome() {
    return outcome;
  }

  public boolean succeeded() {
    return outcome == Outcome.SUCCESS;
  }

  public boolean isTransient() {
    return outcome == Outcome.EXHAUSTED;
  }

  public T value() {
    return value;
  }

  public Throwable error() {
    return error;
  }

  public long attempts() {
    return attempts;
  }
}
