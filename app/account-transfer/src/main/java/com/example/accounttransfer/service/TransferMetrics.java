package com.example.accounttransfer.service;

import com.example.accounttransfer.model.DecisionType;
import com.example.accounttransfer.model.ReconciliationSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class TransferMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<DecisionType, Counter> decisionCounters = new ConcurrentHashMap<>();

  public TransferMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRun(String type, String outcome) {
    runCounters
        .computeIfAbsent(type + "|" + outcome, ignored -> registerRunCounter(type, outcome))
        .increment();
  }

  public void recordDecisions(ReconciliationSummary summary) {
    increment(DecisionType.CREATED, summary.created());
    increment(DecisionType.UPDATED, summary.updated());
    increment(DecisionType.SKIPPED, summary.skipped());
  }

  private void increment(DecisionType type, int amount) {
    if (amount <= 0) {
      return;
    }
    decisionCounters.computeIfAbsent(type, this::registerDecisionCounter).increment(amount);
  }

  private Counter registerRunCounter(String type, String outcome) {
    return Counter.builder("transfer.run.total")
        .tags(Tags.of("type", type, "outcome", outcome))
        .register(meterRegistry);
  }

  private Counter registerDecisionCounter(DecisionType type) {
    return Counter.builder("transfer.decision.total")
        .tags(Tags.of("decision", type.name().toLowerCase(Locale.ROOT)))
        .register(meterRegistry);
  }
}
