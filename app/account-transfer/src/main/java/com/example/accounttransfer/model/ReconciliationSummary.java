package com.example.accounttransfer.model;

import java.util.List;

public record ReconciliationSummary(int created, int updated, int skipped) {

  public static ReconciliationSummary of(List<Decision> decisions) {
    int created = 0;
    int updated = 0;
    int skipped = 0;
    for (Decision decision : decisions) {
      switch (decision.type()) {
        case CREATED -> created++;
        case UPDATED -> updated++;
        case SKIPPED -> skipped++;
        default -> throw new IllegalStateException("unknown decision: " + decision.type());
      }
    }
    return new ReconciliationSummary(created, updated, skipped);
  }

  public int total() {
    return created + updated + skipped;
  }
}
