package com.example.accounttransfer.archive;

public enum CodecErrorCode {
  SERIALIZE_FAILED(false),
  COMPRESS_FAILED(false),
  ENCRYPT_FAILED(false),
  DECOMPRESS_FAILED(true),
  PARSE_FAILED(true);

  private final boolean readFailure;

  CodecErrorCode(boolean readFailure) {
    this.readFailure = readFailure;
  }

  /** True for failures raised while opening an archive, false for failures while sealing one. */
  public boolean isReadFailure() {
    return readFailure;
  }
}
