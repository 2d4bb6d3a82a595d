/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/archive/ArchiveEncryptionService.java
 * 何を: パスワードを鍵として AES-256-CBC で任意バイト列を暗号化/復号する
 * なぜ: 既存の .k7 アーカイブと同じ鍵の扱い(パスワードをそのまま鍵素材に使う)を保つため
 */
package com.example.accounttransfer.archive;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class ArchiveEncryptionService {

  private static final String ALGORITHM = "AES";
  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
  private static final int KEY_LENGTH = 32;

  private final SecureRandom secureRandom;

  public ArchiveEncryptionService() {
    this(new SecureRandom());
  }

  ArchiveEncryptionService(SecureRandom secureRandom) {
    this.secureRandom = secureRandom;
  }

  public SealedBlob seal(byte[] plaintext, String password) {
    final SecretKeySpec key = deriveKey(password);
    final byte[] iv = new byte[SealedBlob.IV_LENGTH];
    secureRandom.nextBytes(iv);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
      return new SealedBlob(iv, cipher.doFinal(plaintext));
    } catch (GeneralSecurityException ex) {
      throw new CryptoException(CryptoErrorCode.ENCRYPT_FAILED, "failed to encrypt archive", ex);
    }
  }

  public byte[] open(String encoded, String password) {
    // パスワード未設定はデコードより先に判定する
    requirePassword(password);
    return open(SealedBlob.decode(encoded), password);
  }

  public byte[] open(SealedBlob blob, String password) {
    final SecretKeySpec key = deriveKey(password);
    try {
      final Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(blob.iv()));
      return cipher.doFinal(blob.ciphertext());
    } catch (GeneralSecurityException ex) {
      // 整合性タグが無いため、パスワード誤りと破損は区別できない
      throw new CryptoException(
          CryptoErrorCode.DECRYPT_FAILED,
          "failed to decrypt archive: incorrect password or corrupted file",
          ex);
    }
  }

  // パスワードの UTF-8 バイト列を 32 バイトに 0x00 埋め/切り詰めして鍵にする (KDF なし)
  static SecretKeySpec deriveKey(String password) {
    requirePassword(password);
    final byte[] material = Arrays.copyOf(password.getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
    return new SecretKeySpec(material, ALGORITHM);
  }

  private static void requirePassword(String password) {
    if (password == null || password.isEmpty()) {
      throw new CryptoException(CryptoErrorCode.MISSING_PASSWORD, "encryption password is not set");
    }
  }
}
