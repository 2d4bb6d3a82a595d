/*
 * どこで: アーカイブ処理の例外基底
 * 何を: 暗号化/コーデック段階の致命的な失敗をまとめて扱う
 * なぜ: 実行単位で中断すべき失敗を 1 か所で捕捉し、ログへ残してから伝播させるため
 */
package com.example.accounttransfer.archive;

public abstract class ArchiveException extends RuntimeException {

  protected ArchiveException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract String errorCode();
}
