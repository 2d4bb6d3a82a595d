package com.example.accounttransfer.model;

import java.util.Locale;

/** Uploaded archive bytes as received at the HTTP boundary. */
public record ArchiveUpload(String filename, long size, byte[] content) {

  public ArchiveUpload {
    content = content == null ? new byte[0] : content.clone();
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  public boolean hasFilename() {
    return filename != null && !filename.isBlank();
  }

  public String extension() {
    if (!hasFilename()) {
      return "";
    }
    final int dot = filename.lastIndexOf('.');
    return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
