package com.example.accounttransfer.archive;

public class CodecException extends ArchiveException {

  private final CodecErrorCode code;

  public CodecException(CodecErrorCode code, String message) {
    this(code, message, null);
  }

  public CodecException(CodecErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public CodecErrorCode code() {
    return code;
  }

  @Override
  public String errorCode() {
    return code.name();
  }
}
