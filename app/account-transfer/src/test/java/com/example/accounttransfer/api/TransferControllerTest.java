package com.example.accounttransfer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.accounttransfer.archive.CodecErrorCode;
import com.example.accounttransfer.archive.CodecException;
import com.example.accounttransfer.archive.CryptoErrorCode;
import com.example.accounttransfer.archive.CryptoException;
import com.example.accounttransfer.model.ArchiveUpload;
import com.example.accounttransfer.model.Decision;
import com.example.accounttransfer.model.ExportArchive;
import com.example.accounttransfer.model.ImportReport;
import com.example.accounttransfer.model.LogEntry;
import com.example.accounttransfer.model.LogSeverity;
import com.example.accounttransfer.model.ReconciliationSummary;
import com.example.accounttransfer.model.RecordId;
import com.example.accounttransfer.model.SkipReason;
import com.example.accounttransfer.repository.StoreException;
import com.example.accounttransfer.service.ArchiveUploadException;
import com.example.accounttransfer.service.OperationLogFactory;
import com.example.accounttransfer.service.TransferExportService;
import com.example.accounttransfer.service.TransferImportService;
import com.example.accounttransfer.service.UploadErrorCode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TransferController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(TransferApiExceptionHandler.class)
class TransferControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TransferExportService exportService;
  @MockitoBean private TransferImportService importService;
  @MockitoBean private OperationLogFactory operationLogFactory;

  private final MockMultipartFile archive =
      new MockMultipartFile("file", "users.k7", "application/octet-stream", new byte[] {65, 66});

  @Test
  void exportReturnsArchiveAsAttachment() throws Exception {
    when(exportService.exportArchive(isNull(), any()))
        .thenReturn(new ExportArchive("Usersk7_20240301_100000.k7", new byte[] {1, 2, 3}, 3));

    mockMvc
        .perform(post("/admin/transfer/export"))
        .andExpect(status().isOk())
        .andExpect(
            header()
                .string(
                    "Content-Disposition",
                    "attachment; filename=\"Usersk7_20240301_100000.k7\""))
        .andExpect(header().string("X-Transfer-Record-Count", "3"))
        .andExpect(content().contentType("application/octet-stream"))
        .andExpect(content().bytes(new byte[] {1, 2, 3}));
  }

  @Test
  void importReturnsSummaryDecisionsAndLog() throws Exception {
    final ImportReport report =
        new ImportReport(
            true,
            new ReconciliationSummary(1, 0, 1),
            List.of(
                Decision.created(1, "alice", RecordId.pending(1))
                    .withMetadataKeys(List.of("nickname")),
                Decision.skipped(2, "bob", SkipReason.MISSING_KEY, "missing key")),
            List.of(
                new LogEntry(
                    Instant.parse("2024-03-01T10:00:00Z"),
                    LogSeverity.SUCCESS,
                    "Dry run complete.")));
    when(importService.importArchive(any(ArchiveUpload.class), eq("pw"), eq(true), any()))
        .thenReturn(report);

    mockMvc
        .perform(
            multipart("/admin/transfer/import")
                .file(archive)
                .param("dryRun", "true")
                .param("password", "pw"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dryRun").value(true))
        .andExpect(jsonPath("$.created").value(1))
        .andExpect(jsonPath("$.skipped").value(1))
        .andExpect(jsonPath("$.decisions[0].recordId").value("pending-1"))
        .andExpect(jsonPath("$.decisions[0].metadataKeys[0]").value("nickname"))
        .andExpect(jsonPath("$.decisions[1].skipReason").value("MISSING_KEY"))
        .andExpect(jsonPath("$.log[0]").value("[SUCCESS] 2024-03-01 10:00:00 - Dry run complete."));
  }

  @Test
  void uploadValidationFailureIsBadRequest() throws Exception {
    when(importService.importArchive(any(ArchiveUpload.class), isNull(), eq(false), any()))
        .thenThrow(
            new ArchiveUploadException(UploadErrorCode.INVALID_FILE_TYPE, "unsupported extension"));

    mockMvc
        .perform(multipart("/admin/transfer/import").file(archive))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ARCHIVE_UPLOAD_INVALID"))
        .andExpect(jsonPath("$.message").value("unsupported extension"));
  }

  @Test
  void missingPasswordIsBadRequest() throws Exception {
    when(importService.importArchive(any(ArchiveUpload.class), isNull(), eq(false), any()))
        .thenThrow(new CryptoException(CryptoErrorCode.MISSING_PASSWORD, "password not set"));

    mockMvc
        .perform(multipart("/admin/transfer/import").file(archive))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ENCRYPTION_PASSWORD_MISSING"));
  }

  @Test
  void undecryptableArchiveIsUnprocessable() throws Exception {
    when(importService.importArchive(any(ArchiveUpload.class), isNull(), eq(false), any()))
        .thenThrow(new CryptoException(CryptoErrorCode.DECRYPT_FAILED, "bad padding"));

    mockMvc
        .perform(multipart("/admin/transfer/import").file(archive))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("ARCHIVE_UNREADABLE"));
  }

  @Test
  void unparsableArchiveIsUnprocessable() throws Exception {
    when(importService.importArchive(any(ArchiveUpload.class), isNull(), eq(false), any()))
        .thenThrow(new CodecException(CodecErrorCode.PARSE_FAILED, "not a list"));

    mockMvc
        .perform(multipart("/admin/transfer/import").file(archive))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("ARCHIVE_UNREADABLE"));
  }

  @Test
  void archiveWriteFailureIsServerError() throws Exception {
    when(exportService.exportArchive(isNull(), any()))
        .thenThrow(new CodecException(CodecErrorCode.COMPRESS_FAILED, "deflate failed"));

    mockMvc
        .perform(post("/admin/transfer/export"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("ARCHIVE_WRITE_FAILED"));
  }

  @Test
  void storeFailureIsServiceUnavailable() throws Exception {
    when(exportService.exportArchive(isNull(), any()))
        .thenThrow(new StoreException("connection refused"));

    mockMvc
        .perform(post("/admin/transfer/export"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("connection refused"));
  }

  @Test
  void logReturnsLastPersistedLines() throws Exception {
    when(operationLogFactory.formattedLast())
        .thenReturn(List.of("[INFO] 2024-03-01 10:00:00 - &lt;started&gt;"));

    mockMvc
        .perform(get("/admin/transfer/log"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lines[0]").value("[INFO] 2024-03-01 10:00:00 - &lt;started&gt;"));
  }
}
