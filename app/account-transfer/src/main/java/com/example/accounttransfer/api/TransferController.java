/*
 * どこで: Account Transfer API
 * 何を: アーカイブのエクスポート/インポートと直近ログ参照のエンドポイントを提供する
 * なぜ: 管理者向けの移行操作を明示的な経路に分離するため
 */
package com.example.accounttransfer.api;

import com.example.accounttransfer.api.response.ImportReportResponse;
import com.example.accounttransfer.api.response.TransferLogResponse;
import com.example.accounttransfer.model.ArchiveUpload;
import com.example.accounttransfer.model.ExportArchive;
import com.example.accounttransfer.service.OperationLogFactory;
import com.example.accounttransfer.service.TransferExportService;
import com.example.accounttransfer.service.TransferImportService;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/admin/transfer")
@RequiredArgsConstructor
public class TransferController {

  private static final Logger logger = LoggerFactory.getLogger(TransferController.class);
  static final String HEADER_RECORD_COUNT = "X-Transfer-Record-Count";

  private final TransferExportService exportService;
  private final TransferImportService importService;
  private final OperationLogFactory operationLogFactory;

  @PostMapping("/export")
  public ResponseEntity<byte[]> exportArchive(
      @RequestParam(value = "password", required = false) String password) {
    final ExportArchive archive =
        exportService.exportArchive(password, operationLogFactory.create());
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(archive.filename()).build().toString())
        .header(HEADER_RECORD_COUNT, String.valueOf(archive.recordCount()))
        .body(archive.content());
  }

  /**
   * 役割: アップロードされた .k7 を取り込み、件数・判定・ログを返す。
   *
   * <p>期待動作: ファイル未指定もサービス側の検証へ渡し、検証失敗として記録させる。
   */
  @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ImportReportResponse importArchive(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun,
      @RequestParam(value = "password", required = false) String password) {
    final ArchiveUpload upload = toUpload(file);
    return ImportReportResponse.from(
        importService.importArchive(upload, password, dryRun, operationLogFactory.create()));
  }

  @GetMapping("/log")
  public TransferLogResponse lastLog() {
    return new TransferLogResponse(operationLogFactory.formattedLast());
  }

  private ArchiveUpload toUpload(MultipartFile file) {
    if (file == null) {
      return new ArchiveUpload(null, 0, null);
    }
    try {
      return new ArchiveUpload(file.getOriginalFilename(), file.getSize(), file.getBytes());
    } catch (IOException ex) {
      // 読めない場合は空のアップロードとして検証に任せる。
      logger.warn("failed to read uploaded archive name={}", file.getOriginalFilename(), ex);
      return new ArchiveUpload(file.getOriginalFilename(), file.getSize(), null);
    }
  }
}
