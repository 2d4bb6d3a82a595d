/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/archive/SealedBlob.java
 * 何を: IV と暗号文の組、およびその外部表現(base64)を扱う
 * なぜ: フレーミングの分解/組み立てを暗号処理本体から切り離すため
 */
package com.example.accounttransfer.archive;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

public record SealedBlob(byte[] iv, byte[] ciphertext) {

  public static final int IV_LENGTH = 16;
  public static final int BLOCK_SIZE = 16;

  public SealedBlob {
    if (iv == null || iv.length != IV_LENGTH) {
      throw new IllegalArgumentException("iv must be " + IV_LENGTH + " bytes");
    }
    if (ciphertext == null) {
      throw new IllegalArgumentException("ciphertext is required");
    }
    iv = iv.clone();
    ciphertext = ciphertext.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  /** Returns {@code base64(iv || ciphertext)}. */
  public String encode() {
    final byte[] framed = new byte[iv.length + ciphertext.length];
    System.arraycopy(iv, 0, framed, 0, iv.length);
    System.arraycopy(ciphertext, 0, framed, iv.length, ciphertext.length);
    return Base64.getEncoder().encodeToString(framed);
  }

  public byte[] encodeToBytes() {
    return encode().getBytes(StandardCharsets.US_ASCII);
  }

  /**
   * 役割: 外部表現を IV と暗号文へ分解する。
   *
   * <p>期待動作: base64 として不正なら MALFORMED_ENCODING、IV の後に 1 ブロック分も残らなければ TRUNCATED。
   */
  public static SealedBlob decode(String encoded) {
    if (encoded == null) {
      throw new CryptoException(CryptoErrorCode.MALFORMED_ENCODING, "archive text is missing");
    }
    final byte[] framed;
    try {
      framed = Base64.getDecoder().decode(encoded.strip());
    } catch (IllegalArgumentException ex) {
      throw new CryptoException(
          CryptoErrorCode.MALFORMED_ENCODING, "archive is not valid base64", ex);
    }
    if (framed.length < IV_LENGTH + BLOCK_SIZE) {
      throw new CryptoException(
          CryptoErrorCode.TRUNCATED,
          "archive holds " + framed.length + " bytes, at least " + (IV_LENGTH + BLOCK_SIZE)
              + " expected");
    }
    return new SealedBlob(
        Arrays.copyOfRange(framed, 0, IV_LENGTH),
        Arrays.copyOfRange(framed, IV_LENGTH, framed.length));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SealedBlob blob)) {
      return false;
    }
    return Arrays.equals(iv, blob.iv) && Arrays.equals(ciphertext, blob.ciphertext);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(iv) + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "SealedBlob[ciphertextLength=" + ciphertext.length + "]";
  }
}
