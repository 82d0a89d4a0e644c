package dev.henneberger.vertx.cdc.core;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retries for single database round trips. Only transient failures are retried.
 */
public final class RetryHelper {

  private static final Logger LOG = LoggerFactory.getLogger(RetryHelper.class);

  public enum ErrorClass {
    TRANSIENT,
    PERMANENT
  }

  private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
    "40001", // serialization_failure
    "40P01", // deadlock_detected
    "53000", // insufficient_resources
    "53100", // disk_full
    "53200", // out_of_memory
    "53300", // too_many_connections
    "08000", // connection_exception
    "08001", // sqlclient_unable_to_establish_sqlconnection
    "08003", // connection_does_not_exist
    "08004", // sqlserver_rejected_establishment_of_sqlconnection
    "08006", // connection_failure
    "57P01", // admin_shutdown
    "57P02", // crash_shutdown
    "57P03"  // cannot_connect_now
  );

  private static final List<String> TRANSIENT_MESSAGES = List.of(
    "connection refused",
    "connection reset",
    "econnrefused",
    "econnreset",
    "timeout",
    "timed out",
    "deadlock",
    "too many clients"
  );

  private RetryHelper() {
  }

  public static ErrorClass classify(Throwable error) {
    return isTransient(error) ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
  }

  public static boolean isTransient(Throwable error) {
    if (error == null) {
      return false;
    }
    String code = errorCode(error);
    if (code != null && TRANSIENT_SQL_STATES.contains(code)) {
      return true;
    }
    for (Throwable current = error; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (message == null) {
        continue;
      }
      String lower = message.toLowerCase(Locale.ROOT);
      for (String fragment : TRANSIENT_MESSAGES) {
        if (lower.contains(fragment)) {
          return true;
        }
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  /**
   * First SQL state found along the cause chain, or {@code null}.
   */
  public static String errorCode(Throwable error) {
    for (Throwable current = error; current != null; current = current.getCause()) {
      if (current instanceof SQLException) {
        String state = ((SQLException) current).getSQLState();
        if (state != null && !state.isBlank()) {
          return state;
        }
      }
      if (current instanceof ActivityPersistenceException) {
        String state = ((ActivityPersistenceException) current).sqlState();
        if (state != null) {
          return state;
        }
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return null;
  }

  public static <T> RetryResult<T> withRetry(Callable<T> fn, RetryPolicy policy, String operation) {
    Objects.requireNonNull(fn, "fn");
    Objects.requireNonNull(policy, "policy");
    if (policy.isUnbounded()) {
      throw new IllegalArgumentException("per-call retries need a bounded policy");
    }

    long attempt = 0;
    while (true) {
      attempt++;
      try {
        return RetryResult.success(fn.call(), attempt);
      } catch (Exception e) {
        if (!isTransient(e)) {
          LOG.warn("operation={} attempt={} code={} permanent failure: {}",
            operation, attempt, errorCode(e), e.getMessage());
          return RetryResult.permanent(e, policy.getMaxAttempts());
        }
        if (!policy.hasAttemptsLeft(attempt)) {
          LOG.warn("operation={} attempts={} code={} retries exhausted: {}",
            operation, attempt, errorCode(e), e.getMessage());
          return RetryResult.exhausted(e, attempt);
        }
        long delay = policy.computeDelayMillis(attempt);
        LOG.warn("operation={} attempt={} delayMs={} code={} transient failure, retrying: {}",
          operation, attempt, delay, errorCode(e), e.getMessage());
        try {
          Thread.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return RetryResult.exhausted(e, attempt);
        }
      }
    }
  }
}
