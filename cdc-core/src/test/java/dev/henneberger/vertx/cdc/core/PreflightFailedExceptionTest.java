package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightFailedExceptionTest {

  @Test
  void carriesReportAndIssueCodes() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error(
        "DISK_BELOW_MINIMUM",
        "Free disk is below the startup floor",
        "Free up disk space.")));

    PreflightFailedException error = assertThrows(PreflightFailedException.class, report::throwIfFailed);

    assertSame(report, error.report());
    assertTrue(error.hasIssue("DISK_BELOW_MINIMUM"));
    assertFalse(error.hasIssue("NO_TABLES_REGISTERED"));
    assertTrue(error.getMessage().contains("DISK_BELOW_MINIMUM"));
  }
}
