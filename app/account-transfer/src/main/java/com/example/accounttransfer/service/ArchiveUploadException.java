/*
 * どこで: Account Transfer サービス層
 * 何を: アップロードされたアーカイブが受付条件を満たさないことを表す
 * なぜ: 復号前の検証失敗を 400 へ正規化するため
 */
package com.example.accounttransfer.service;

public class ArchiveUploadException extends RuntimeException {

  private final UploadErrorCode code;

  public ArchiveUploadException(UploadErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public UploadErrorCode code() {
    return code;
  }
}
