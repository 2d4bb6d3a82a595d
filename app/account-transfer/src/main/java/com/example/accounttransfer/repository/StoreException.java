/*
 * どこで: Account Transfer Repository 層
 * 何を: レコードストアの操作失敗を表す
 * なぜ: 1 件ごとの失敗として照合処理側で回復(skip)させるため
 */
package com.example.accounttransfer.repository;

public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public String detail() {
    return getMessage();
  }
}
