package dev.henneberger.vertx.cdc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    for (PreflightIssue issue : issues) {
      if (issue.isError()) {
        return false;
      }
    }
    return true;
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public List<PreflightIssue> warnings() {
    List<PreflightIssue> warnings = new ArrayList<>();
    for (PreflightIssue issue : issues) {
      if (!issue.isError()) {
        warnings.add(issue);
      }
    }
    return warnings;
  }

  /**
   * Fails with {@link PreflightFailedException} if any issue is an error.
   */
  public void throwIfFailed() {
    if (!ok()) {
      throw new PreflightFailedException(this);
    }
  }
}
