package com.example.accounttransfer.service;

import com.example.accounttransfer.config.TransferProperties;

final class PasswordResolver {

  private PasswordResolver() {}

  /** A non-blank request password wins over the configured one; never null. */
  static String resolve(String requested, TransferProperties properties) {
    if (requested != null && !requested.isEmpty()) {
      return requested;
    }
    return properties.encryptionPassword();
  }
}
