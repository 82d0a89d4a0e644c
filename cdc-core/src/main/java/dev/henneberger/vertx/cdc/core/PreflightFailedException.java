package dev.henneberger.vertx.cdc.core;

import java.util.Objects;

/**
 * Startup refusal: the worker does not start when a preflight check reports an error.
 */
public final class PreflightFailedException extends IllegalStateException {

  private final PreflightReport report;

  public PreflightFailedException(PreflightReport report) {
    super(PreflightReports.describeFailure(Objects.requireNonNull(report, "report")));
    this.report = report;
  }

  public PreflightReport report() {
    return report;
  }

  public boolean hasIssue(String code) {
    for (PreflightIssue issue : report.issues()) {
      if (issue.code().equals(code)) {
        return true;
      }
    }
    return false;
  }
}
