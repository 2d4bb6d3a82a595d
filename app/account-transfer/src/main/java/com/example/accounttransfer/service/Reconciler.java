/*
 * どこで: Account Transfer サービス層
 * 何を: アーカイブのレコードを 1 件ずつストアと突き合わせ、作成/更新/スキップを決める
 * なぜ: 1 件の失敗で取り込み全体を止めず、結果を件数と判定の一覧で返すため
 */
package com.example.accounttransfer.service;

import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.Decision;
import com.example.accounttransfer.model.LogSeverity;
import com.example.accounttransfer.model.ReconciliationResult;
import com.example.accounttransfer.model.ReconciliationSummary;
import com.example.accounttransfer.model.RecordId;
import com.example.accounttransfer.model.SkipReason;
import com.example.accounttransfer.model.StoredRecord;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.model.UserWriteRequest;
import com.example.accounttransfer.repository.RecordStore;
import com.example.accounttransfer.repository.StoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class Reconciler {

  private final UserWriteRequestFactory requestFactory;
  private final TransferProperties properties;

  /**
   * 役割: レコードを順番どおりに照合し、dryRun でなければストアへ反映する。
   *
   * <p>期待動作: レコード単位の失敗は SKIPPED の判定として返し、例外にはしない。dryRun ではストアの
   * 更新系メソッドを一切呼ばず、新規分には 1 から順に仮 ID を振る。
   */
  public ReconciliationResult apply(
      List<TransferRecord> records, RecordStore store, boolean dryRun, OperationLog log) {
    final Run run = new Run(store, dryRun, log);
    final List<Decision> decisions = new ArrayList<>(records.size());
    int position = 0;
    for (TransferRecord record : records) {
      position++;
      decisions.add(reconcile(run, position, record));
    }
    return new ReconciliationResult(ReconciliationSummary.of(decisions), decisions);
  }

  private Decision reconcile(Run run, int position, TransferRecord record) {
    final String key = RecordKeys.normalize(record.key());
    if (key.isEmpty()) {
      run.log.append(
          "Processing entry #" + position + ": Skipped - account key is missing or invalid.",
          LogSeverity.WARNING);
      return Decision.skipped(position, null, SkipReason.MISSING_KEY, "missing key");
    }
    final String prefix = "Processing entry #" + position + ": " + key + " - ";
    if (!run.dryRun && !record.hasCredential()) {
      run.log.append(prefix + "Skipped - credential hash is missing.", LogSeverity.WARNING);
      return Decision.skipped(position, key, SkipReason.MISSING_CREDENTIAL, "missing credential");
    }

    final Optional<StoredRecord> existing;
    try {
      existing = run.store.findByKey(key);
    } catch (RuntimeException ex) {
      return storeFailure(run, position, key, prefix + "Error looking up account: ", ex);
    }
    final UserWriteRequest request = requestFactory.build(key, record);
    final Decision decision =
        existing.isPresent()
            ? update(run, position, key, prefix, existing.get().id(), request)
            : create(run, position, key, prefix, request);
    if (decision.isSkipped() || record.metadata().isEmpty()) {
      return decision;
    }
    return decision.withMetadataKeys(
        applyMetadata(run, prefix, decision.recordId(), record.metadata()));
  }

  private Decision update(
      Run run, int position, String key, String prefix, long id, UserWriteRequest request) {
    if (run.dryRun) {
      run.log.append(
          prefix + "Dry run: would update existing account (ID: " + id + ").", LogSeverity.INFO);
      return Decision.updated(position, key, RecordId.real(id));
    }
    try {
      run.store.update(id, request);
    } catch (RuntimeException ex) {
      return storeFailure(run, position, key, prefix + "Error updating account: ", ex);
    }
    run.log.append(
        prefix + "Successfully updated existing account (ID: " + id + ").", LogSeverity.SUCCESS);
    return Decision.updated(position, key, RecordId.real(id));
  }

  private Decision create(
      Run run, int position, String key, String prefix, UserWriteRequest request) {
    if (run.dryRun) {
      final RecordId pending = RecordId.pending(++run.pendingSequence);
      run.log.append(
          prefix + "Dry run: would create new account (" + pending + ").", LogSeverity.INFO);
      return Decision.created(position, key, pending);
    }
    final long id;
    try {
      id = run.store.create(request);
    } catch (RuntimeException ex) {
      return storeFailure(run, position, key, prefix + "Error creating account: ", ex);
    }
    run.log.append(
        prefix + "Successfully created new account (ID: " + id + ").", LogSeverity.SUCCESS);
    return Decision.created(position, key, RecordId.real(id));
  }

  private List<String> applyMetadata(
      Run run, String prefix, RecordId recordId, Map<String, Object> metadata) {
    final String rolesKey = properties.rolesMetadataKey();
    run.log.append(
        prefix + "Processing metadata for account " + recordId + ".", LogSeverity.INFO_DETAIL);
    if (run.dryRun) {
      if (metadata.containsKey(rolesKey)) {
        run.log.append(
            prefix + "Dry run: would replace roles from \"" + rolesKey + "\".",
            LogSeverity.INFO_DETAIL);
      }
      run.log.append(
          prefix + "Dry run: would write metadata keys: " + String.join(", ", metadata.keySet()),
          LogSeverity.INFO_DETAIL);
      return List.copyOf(metadata.keySet());
    }

    boolean rolesCleared = false;
    if (metadata.containsKey(rolesKey)) {
      try {
        run.store.clearRoles(recordId.value());
        rolesCleared = true;
        run.log.append(prefix + "Cleared existing roles.", LogSeverity.INFO_DETAIL);
      } catch (RuntimeException ex) {
        run.log.append(
            prefix + "Could not clear existing roles, imported roles not applied: " + detail(ex),
            LogSeverity.WARNING);
      }
    }

    final List<String> written = new ArrayList<>(metadata.size());
    for (Map.Entry<String, Object> entry : metadata.entrySet()) {
      if (entry.getKey().equals(rolesKey) && !rolesCleared) {
        continue;
      }
      try {
        run.store.setMetadata(recordId.value(), entry.getKey(), entry.getValue());
        written.add(entry.getKey());
      } catch (RuntimeException ex) {
        run.log.append(
            prefix + "Could not write metadata \"" + entry.getKey() + "\": " + detail(ex),
            LogSeverity.WARNING);
      }
    }
    run.log.append(
        prefix + "Wrote " + written.size() + " of " + metadata.size() + " metadata keys.",
        LogSeverity.INFO_DETAIL);
    return written;
  }

  private Decision storeFailure(
      Run run, int position, String key, String message, RuntimeException ex) {
    final String detail = detail(ex);
    run.log.append(message + detail, LogSeverity.ERROR);
    return Decision.skipped(position, key, SkipReason.STORE_ERROR, detail);
  }

  private static String detail(RuntimeException ex) {
    if (ex instanceof StoreException storeException) {
      return storeException.detail();
    }
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }

  private static final class Run {
    private final RecordStore store;
    private final boolean dryRun;
    private final OperationLog log;
    private long pendingSequence;

    private Run(RecordStore store, boolean dryRun, OperationLog log) {
      this.store = store;
      this.dryRun = dryRun;
      this.log = log;
    }
  }
}
