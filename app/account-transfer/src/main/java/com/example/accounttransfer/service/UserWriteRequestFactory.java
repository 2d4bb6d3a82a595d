/*
 * どこで: Account Transfer サービス補助
 * 何を: アーカイブのレコードからストア書き込み用の入力を組み立てる
 * なぜ: 欠けている項目の既定値を作成/更新で共通化するため
 */
package com.example.accounttransfer.service;

import com.example.accounttransfer.model.RecordAttributes;
import com.example.accounttransfer.model.TransferRecord;
import com.example.accounttransfer.model.UserWriteRequest;
import com.example.common.UtcTimestamps;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserWriteRequestFactory {

  private final Clock clock;

  public UserWriteRequest build(String normalizedKey, TransferRecord record) {
    final RecordAttributes attributes = record.attributes();
    return new UserWriteRequest(
        normalizedKey,
        record.credentialHash(),
        trimOrEmpty(attributes.email()),
        trimOrEmpty(attributes.url()),
        resolveNiceKey(normalizedKey, attributes.niceKey()),
        isBlank(attributes.displayName()) ? normalizedKey : attributes.displayName().strip(),
        trimOrEmpty(attributes.firstName()),
        trimOrEmpty(attributes.lastName()),
        trimOrEmpty(attributes.description()),
        isBlank(attributes.registeredAt())
            ? UtcTimestamps.formatDateTime(clock.instant())
            : attributes.registeredAt().strip());
  }

  private String resolveNiceKey(String normalizedKey, String niceKey) {
    final String candidate = isBlank(niceKey) ? "" : RecordKeys.slug(niceKey);
    return candidate.isEmpty() ? RecordKeys.slug(normalizedKey) : candidate;
  }

  private String trimOrEmpty(String value) {
    return value == null ? "" : value.strip();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
