/*
 * どこで: Account Transfer API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.accounttransfer.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  ENCRYPTION_PASSWORD_MISSING,
  ARCHIVE_UPLOAD_INVALID,
  ARCHIVE_UNREADABLE,
  ARCHIVE_WRITE_FAILED,
  STORE_UNAVAILABLE
}
