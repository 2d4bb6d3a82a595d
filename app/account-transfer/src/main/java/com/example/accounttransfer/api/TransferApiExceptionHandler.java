/*
 * どこで: Account Transfer API
 * 何を: 移行処理の例外を HTTP レスポンスへ変換する
 * なぜ: 失敗段階ごとにステータスとコードを固定し、呼び出し側の分岐を簡潔にするため
 */
package com.example.accounttransfer.api;

import com.example.accounttransfer.archive.CodecException;
import com.example.accounttransfer.archive.CryptoErrorCode;
import com.example.accounttransfer.archive.CryptoException;
import com.example.accounttransfer.repository.StoreException;
import com.example.accounttransfer.service.ArchiveUploadException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@RestControllerAdvice
public class TransferApiExceptionHandler {

  @ExceptionHandler(ArchiveUploadException.class)
  public ResponseEntity<ApiErrorResponse> handleArchiveUpload(ArchiveUploadException ex) {
    return respond(HttpStatus.BAD_REQUEST, ApiErrorCode.ARCHIVE_UPLOAD_INVALID, ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
    return respond(
        HttpStatus.BAD_REQUEST, ApiErrorCode.ARCHIVE_UPLOAD_INVALID, "uploaded file is too large");
  }

  /**
   * 役割: 暗号化段階の失敗を分類する。
   *
   * <p>期待動作: パスワード未設定は 400、封緘時の失敗は 500、それ以外(壊れた/復号できないアーカイブ)は 422 を返す。
   */
  @ExceptionHandler(CryptoException.class)
  public ResponseEntity<ApiErrorResponse> handleCrypto(CryptoException ex) {
    if (ex.code() == CryptoErrorCode.MISSING_PASSWORD) {
      return respond(
          HttpStatus.BAD_REQUEST, ApiErrorCode.ENCRYPTION_PASSWORD_MISSING, ex.getMessage());
    }
    if (ex.code() == CryptoErrorCode.ENCRYPT_FAILED) {
      return respond(
          HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.ARCHIVE_WRITE_FAILED, ex.getMessage());
    }
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorCode.ARCHIVE_UNREADABLE, ex.getMessage());
  }

  @ExceptionHandler(CodecException.class)
  public ResponseEntity<ApiErrorResponse> handleCodec(CodecException ex) {
    if (ex.code().isReadFailure()) {
      return respond(
          HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorCode.ARCHIVE_UNREADABLE, ex.getMessage());
    }
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.ARCHIVE_WRITE_FAILED, ex.getMessage());
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStore(StoreException ex) {
    return respond(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.STORE_UNAVAILABLE, ex.detail());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return respond(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
