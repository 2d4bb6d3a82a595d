package com.example.accounttransfer.model;

import java.util.List;

public record ImportReport(
    boolean dryRun, ReconciliationSummary summary, List<Decision> decisions, List<LogEntry> log) {

  public ImportReport {
    decisions = decisions == null ? List.of() : List.copyOf(decisions);
    log = log == null ? List.of() : List.copyOf(log);
  }
}
