/*
 * どこで: Account Transfer 設定
 * 何を: 暗号化パスワード・ロール用メタデータキー・アップロード上限・ログ保持期間を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.accounttransfer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "transfer")
public record TransferProperties(
    String encryptionPassword,
    String rolesMetadataKey,
    DataSize maxArchiveSize,
    Duration logRetention,
    String logKey) {

  public static final String DEFAULT_ROLES_METADATA_KEY = "capabilities";
  public static final DataSize DEFAULT_MAX_ARCHIVE_SIZE = DataSize.ofMegabytes(5);
  public static final Duration DEFAULT_LOG_RETENTION = Duration.ofHours(1);
  public static final String DEFAULT_LOG_KEY = "transfer:last-log";

  public TransferProperties {
    encryptionPassword = encryptionPassword == null ? "" : encryptionPassword;
    rolesMetadataKey =
        rolesMetadataKey == null || rolesMetadataKey.isBlank()
            ? DEFAULT_ROLES_METADATA_KEY
            : rolesMetadataKey;
    maxArchiveSize = maxArchiveSize == null ? DEFAULT_MAX_ARCHIVE_SIZE : maxArchiveSize;
    logRetention =
        logRetention == null || logRetention.isZero() || logRetention.isNegative()
            ? DEFAULT_LOG_RETENTION
            : logRetention;
    logKey = logKey == null || logKey.isBlank() ? DEFAULT_LOG_KEY : logKey;
  }

  public static TransferProperties defaults() {
    return new TransferProperties(null, null, null, null, null);
  }
}
