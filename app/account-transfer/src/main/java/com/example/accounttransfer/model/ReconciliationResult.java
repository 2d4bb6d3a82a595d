package com.example.accounttransfer.model;

import java.util.List;

public record ReconciliationResult(ReconciliationSummary summary, List<Decision> decisions) {

  public ReconciliationResult {
    decisions = decisions == null ? List.of() : List.copyOf(decisions);
  }
}
