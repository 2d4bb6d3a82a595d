package com.example.accounttransfer.model;

public record ExportArchive(String filename, byte[] content, int recordCount) {

  public ExportArchive {
    content = content == null ? new byte[0] : content.clone();
  }

  @Override
  public byte[] content() {
    return content.clone();
  }
}
