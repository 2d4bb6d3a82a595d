/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/TransferRecord.java
 * 何を: アーカイブに含まれる 1 アカウント分のレコード
 * なぜ: export/import の両方向で同じ形を受け渡し、照合結果は Decision として別に返すため
 */
package com.example.accounttransfer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TransferRecord(
        String key,
        String credentialHash,
        RecordAttributes attributes,
        Map<String, Object> metadata) {

    public TransferRecord {
        attributes = attributes == null ? RecordAttributes.empty() : attributes;
        // JSON の null 値を保持するため Map.copyOf は使わない
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasCredential() {
        return credentialHash != null && !credentialHash.isBlank();
    }
}
