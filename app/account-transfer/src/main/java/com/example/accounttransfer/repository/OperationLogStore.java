package com.example.accounttransfer.repository;

import com.example.accounttransfer.model.LogEntry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface OperationLogStore {

  /** Replaces the previously saved log with {@code entries}, expiring after {@code ttl}. */
  void save(List<LogEntry> entries, Duration ttl);

  /** Returns the saved log, or empty if none was saved or it has expired. */
  Optional<List<LogEntry>> load();
}
