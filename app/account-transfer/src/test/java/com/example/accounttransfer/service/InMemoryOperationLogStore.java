package com.example.accounttransfer.service;

import com.example.accounttransfer.model.LogEntry;
import com.example.accounttransfer.repository.OperationLogStore;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

final class InMemoryOperationLogStore implements OperationLogStore {

  List<LogEntry> saved;
  Duration lastTtl;
  int saveCount;

  @Override
  public void save(List<LogEntry> entries, Duration ttl) {
    saved = List.copyOf(entries);
    lastTtl = ttl;
    saveCount++;
  }

  @Override
  public Optional<List<LogEntry>> load() {
    return Optional.ofNullable(saved);
  }
}
