/*
 * どこで: Account Transfer サービス層
 * 何を: ストアの全アカウントを読み出し、暗号化済み .k7 アーカイブを生成する
 * なぜ: エクスポート 1 回分の手順とログ・メトリクス記録を 1 か所へまとめるため
 */
package com.example.accounttransfer.service;

import com.example.accounttransfer.archive.ArchiveCodec;
import com.example.accounttransfer.archive.ArchiveException;
import com.example.accounttransfer.archive.CryptoErrorCode;
import com.example.accounttransfer.archive.CryptoException;
import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.ExportArchive;
import com.example.accounttransfer.model.LogSeverity;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.repository.RecordStore;
import com.example.accounttransfer.repository.StoreException;
import com.example.common.RunIds;
import com.example.common.UtcTimestamps;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TransferExportService {

  private static final Logger logger = LoggerFactory.getLogger(TransferExportService.class);
  static final String MDC_RUN_ID = "transfer_run_id";

  private final ArchiveCodec archiveCodec;
  private final RecordStore recordStore;
  private final TransferProperties properties;
  private final TransferMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 全アカウントを 1 つのアーカイブへ書き出す。
   *
   * <p>期待動作: 成否にかかわらず実行ログを保存する。失敗時は ERROR を記録したうえで例外をそのまま伝播する。
   */
  public ExportArchive exportArchive(String requestedPassword, OperationLog log) {
    MDC.put(MDC_RUN_ID, RunIds.newRunId());
    try {
      log.clear();
      log.append("Account export process initiated.", LogSeverity.INFO);
      final String password = PasswordResolver.resolve(requestedPassword, properties);
      if (password.isEmpty()) {
        throw abort(
            log,
            new CryptoException(
                CryptoErrorCode.MISSING_PASSWORD, "encryption password is not configured"),
            "Encryption password not set, cannot create archive.");
      }

      final List<TransferRecord> records;
      try {
        records = recordStore.findAll();
      } catch (StoreException ex) {
        throw abort(log, ex, "Could not read accounts for export: " + ex.detail());
      } catch (RuntimeException ex) {
        throw abort(log, ex, "Could not read accounts for export: " + ex.getMessage());
      }
      if (records.isEmpty()) {
        log.append("No accounts found; exporting an empty archive.", LogSeverity.WARNING);
      } else {
        log.append("Found " + records.size() + " accounts to export.", LogSeverity.INFO);
      }

      final byte[] content;
      try {
        content = archiveCodec.seal(records, password);
      } catch (ArchiveException ex) {
        throw abort(log, ex, "Failed to create encrypted archive: " + ex.getMessage());
      }
      final String filename = exportFilename();
      log.append(
          "Export file \"" + filename + "\" generated with " + records.size() + " accounts.",
          LogSeverity.SUCCESS);
      log.persistLast();
      metrics.recordRun("export", "success");
      logger.info(
          "account export finished filename={} records={} bytes={}",
          filename,
          records.size(),
          content.length);
      return new ExportArchive(filename, content, records.size());
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private String exportFilename() {
    return "Usersk7_"
        + UtcTimestamps.formatFileStamp(clock.instant())
        + "."
        + ArchiveCodec.FILE_EXTENSION;
  }

  private RuntimeException abort(OperationLog log, RuntimeException failure, String message) {
    log.append(message, LogSeverity.ERROR);
    try {
      log.persistLast();
    } catch (RuntimeException persistFailure) {
      failure.addSuppressed(persistFailure);
    }
    metrics.recordRun("export", "failed");
    logger.warn("account export aborted reason={}", failure.getMessage());
    return failure;
  }
}
