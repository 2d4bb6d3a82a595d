/*
 * どこで: Account Transfer サービス層
 * 何を: アップロードされた .k7 アーカイブを検証・復号し、照合結果をストアへ反映する
 * なぜ: インポート 1 回分の手順とログ・メトリクス記録を 1 か所へまとめるため
 */
package com.example.accounttransfer.service;

import com.example.accounttransfer.archive.ArchiveCodec;
import com.example.accounttransfer.archive.ArchiveException;
import com.example.accounttransfer.archive.CodecException;
import com.example.accounttransfer.archive.CryptoErrorCode;
import com.example.accounttransfer.archive.CryptoException;
import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.model.ArchiveUpload;
import com.example.accounttransfer.model.ImportReport;
import com.example.accounttransfer.model.LogSeverity;
import com.example.accounttransfer.model.ReconciliationResult;
import com.example.accounttransfer.model.ReconciliationSummary;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.repository.RecordStore;
import com.example.common.RunIds;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TransferImportService {

  private static final Logger logger = LoggerFactory.getLogger(TransferImportService.class);

  private final ArchiveCodec archiveCodec;
  private final Reconciler reconciler;
  private final RecordStore recordStore;
  private final TransferProperties properties;
  private final TransferMetrics metrics;

  /**
   * 役割: アーカイブを検証・復号し、全レコードを照合する。
   *
   * <p>期待動作: アップロード検証と復号の失敗は ERROR を記録・保存したうえで例外として返す。レコード単位の
   * 失敗は結果の SKIPPED 件数に含める。
   */
  public ImportReport importArchive(
      ArchiveUpload upload, String requestedPassword, boolean dryRun, OperationLog log) {
    MDC.put(TransferExportService.MDC_RUN_ID, RunIds.newRunId());
    try {
      log.clear();
      log.append(
          dryRun
              ? "Account import process initiated (dry run, no changes will be written)."
              : "Account import process initiated.",
          LogSeverity.INFO);
      final String password = PasswordResolver.resolve(requestedPassword, properties);
      if (password.isEmpty()) {
        throw abort(
            log,
            new CryptoException(
                CryptoErrorCode.MISSING_PASSWORD, "encryption password is not configured"),
            "Encryption password not set, cannot decrypt archive.");
      }
      validate(upload, log);
      log.append("Archive \"" + upload.filename() + "\" received.", LogSeverity.INFO);

      final List<TransferRecord> records;
      try {
        records = archiveCodec.open(upload.content(), password);
      } catch (ArchiveException ex) {
        throw abort(log, ex, describeOpenFailure(ex));
      }
      if (records.isEmpty()) {
        log.append("Archive contains no records; nothing to import.", LogSeverity.WARNING);
      } else {
        log.append(
            "Archive decrypted and parsed, found " + records.size() + " entries.",
            LogSeverity.INFO);
      }

      final ReconciliationResult result = reconciler.apply(records, recordStore, dryRun, log);
      final ReconciliationSummary summary = result.summary();
      log.append(
          String.format(
              "%s Created: %d, Updated: %d, Skipped/Errored: %d.",
              dryRun ? "Dry run complete." : "Import complete.",
              summary.created(),
              summary.updated(),
              summary.skipped()),
          LogSeverity.SUCCESS);
      log.persistLast();
      metrics.recordRun("import", dryRun ? "dry_run" : "success");
      metrics.recordDecisions(summary);
      logger.info(
          "account import finished dryRun={} created={} updated={} skipped={}",
          dryRun,
          summary.created(),
          summary.updated(),
          summary.skipped());
      return new ImportReport(dryRun, summary, result.decisions(), log.entries());
    } finally {
      MDC.remove(TransferExportService.MDC_RUN_ID);
    }
  }

  private void validate(ArchiveUpload upload, OperationLog log) {
    if (upload == null || !upload.hasFilename()) {
      throw abort(
          log,
          new ArchiveUploadException(UploadErrorCode.NO_FILE, "no archive file was uploaded"),
          "No import file was uploaded.");
    }
    if (!ArchiveCodec.FILE_EXTENSION.equals(upload.extension())) {
      throw abort(
          log,
          new ArchiveUploadException(
              UploadErrorCode.INVALID_FILE_TYPE,
              "unsupported archive extension: ." + upload.extension()),
          "Invalid file type uploaded: ."
              + upload.extension()
              + ". Expected ."
              + ArchiveCodec.FILE_EXTENSION
              + ".");
    }
    final long size = Math.max(upload.size(), upload.content().length);
    final long maxBytes = properties.maxArchiveSize().toBytes();
    if (size > maxBytes) {
      throw abort(
          log,
          new ArchiveUploadException(
              UploadErrorCode.FILE_TOO_LARGE, "archive exceeds " + maxBytes + " bytes"),
          "Uploaded file is too large: " + size + " bytes. Max: " + maxBytes + " bytes.");
    }
    if (upload.content().length == 0) {
      throw abort(
          log,
          new ArchiveUploadException(UploadErrorCode.EMPTY_FILE, "uploaded archive is empty"),
          "Could not read uploaded archive or file is empty.");
    }
  }

  static String describeOpenFailure(ArchiveException failure) {
    if (failure instanceof CryptoException crypto) {
      return switch (crypto.code()) {
        case MALFORMED_ENCODING -> "Archive is not valid base64 text, file may be corrupted.";
        case TRUNCATED -> "Archive is too short to contain encrypted data.";
        case DECRYPT_FAILED -> "Failed to decrypt archive. Incorrect password or corrupted file?";
        case MISSING_PASSWORD -> "Encryption password not set, cannot decrypt archive.";
        default -> "Failed to decrypt archive: " + crypto.getMessage();
      };
    }
    if (failure instanceof CodecException codec) {
      return switch (codec.code()) {
        case DECOMPRESS_FAILED -> "Failed to decompress archive data after decryption.";
        case PARSE_FAILED -> "Failed to parse archive contents: " + codec.getMessage();
        default -> "Failed to read archive: " + codec.getMessage();
      };
    }
    return "Failed to read archive: " + failure.getMessage();
  }

  private RuntimeException abort(OperationLog log, RuntimeException failure, String message) {
    log.append(message, LogSeverity.ERROR);
    try {
      log.persistLast();
    } catch (RuntimeException persistFailure) {
      failure.addSuppressed(persistFailure);
    }
    metrics.recordRun("import", "failed");
    logger.warn("account import aborted reason={}", failure.getMessage());
    return failure;
  }
}
