/*
 * どこで: Account Transfer API
 * 何を: POST /admin/transfer/import の出力 DTO
 * なぜ: 件数・レコード単位の判定・実行ログを 1 つの契約として返すため
 */
package com.example.accounttransfer.api.response;

import com.example.accounttransfer.model.ImportReport;
import com.example.accounttransfer.service.OperationLog;
import java.util.List;

public record ImportReportResponse(
    boolean dryRun,
    int created,
    int updated,
    int skipped,
    List<DecisionResponse> decisions,
    List<String> log) {

  public static ImportReportResponse from(ImportReport report) {
    return new ImportReportResponse(
        report.dryRun(),
        report.summary().created(),
        report.summary().updated(),
        report.summary().skipped(),
        report.decisions().stream().map(DecisionResponse::from).toList(),
        report.log().stream().map(OperationLog::format).toList());
  }
}
