/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/UserWriteRequest.java
 * 何を: ストアへ作成/更新を依頼する際の正規化済み入力
 * なぜ: アーカイブ上の任意項目に既定値を補った形でストアへ渡すため
 */
package com.example.accounttransfer.model;

public record UserWriteRequest(
        String key,
        String credentialHash,
        String email,
        String url,
        String niceKey,
        String displayName,
        String firstName,
        String lastName,
        String description,
        String registeredAt) {
}
