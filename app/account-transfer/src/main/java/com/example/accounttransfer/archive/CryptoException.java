package com.example.accounttransfer.archive;

public class CryptoException extends ArchiveException {

  private final CryptoErrorCode code;

  public CryptoException(CryptoErrorCode code, String message) {
    this(code, message, null);
  }

  public CryptoException(CryptoErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public CryptoErrorCode code() {
    return code;
  }

  @Override
  public String errorCode() {
    return code.name();
  }
}
