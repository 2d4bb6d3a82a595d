package com.example.accounttransfer.service;

import com.example.accounttransfer.model.LogEntry;
import com.example.accounttransfer.model.LogSeverity;
import com.example.accounttransfer.repository.OperationLogStore;
import com.example.common.UtcTimestamps;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

/**
 * Append-only log of one export or import run.
 *
 * <p>Each run owns its instance: {@link #clear()} at the start, {@link #persistLast()} at the end.
 * Only the most recently persisted run can be read back. Not thread-safe.
 */
public class OperationLog {

  private static final Logger logger = LoggerFactory.getLogger(OperationLog.class);

  private final OperationLogStore store;
  private final Clock clock;
  private final Duration retention;
  private final List<LogEntry> entries = new ArrayList<>();

  public OperationLog(OperationLogStore store, Clock clock, Duration retention) {
    this.store = store;
    this.clock = clock;
    this.retention = retention;
  }

  public void clear() {
    entries.clear();
  }

  public void append(String message, LogSeverity severity) {
    final LogEntry entry = new LogEntry(clock.instant(), severity, message);
    entries.add(entry);
    switch (severity) {
      case ERROR -> logger.error("transfer log: {}", message);
      case WARNING -> logger.warn("transfer log: {}", message);
      case INFO_DETAIL -> logger.debug("transfer log: {}", message);
      default -> logger.info("transfer log [{}]: {}", severity, message);
    }
  }

  public List<LogEntry> entries() {
    return List.copyOf(entries);
  }

  /** Replaces the previously persisted run with this one. */
  public void persistLast() {
    store.save(entries(), retention);
  }

  /** Returns the last persisted run as HTML-escaped lines, or an empty list once it expired. */
  public List<String> formattedLast() {
    return store
        .load()
        .map(saved -> saved.stream().map(OperationLog::format).map(HtmlUtils::htmlEscape).toList())
        .orElse(List.of());
  }

  public static String format(LogEntry entry) {
    return "["
        + entry.severity()
        + "] "
        + UtcTimestamps.formatDateTime(entry.timestamp())
        + " - "
        + entry.message();
  }
}
