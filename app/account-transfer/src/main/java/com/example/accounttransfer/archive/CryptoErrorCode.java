package com.example.accounttransfer.archive;

public enum CryptoErrorCode {
  MISSING_PASSWORD,
  MALFORMED_ENCODING,
  TRUNCATED,
  DECRYPT_FAILED,
  ENCRYPT_FAILED
}
