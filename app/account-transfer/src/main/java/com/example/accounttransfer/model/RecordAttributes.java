/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/RecordAttributes.java
 * 何を: アカウントのプロフィール項目(スカラー値)をまとめたレコード
 * なぜ: 既知の項目を型で表現し、未知の項目は metadata 側へ寄せるため
 */
package com.example.accounttransfer.model;

public record RecordAttributes(
        String email,
        String url,
        String niceKey,
        String displayName,
        String firstName,
        String lastName,
        String description,
        String registeredAt) {

    private static final RecordAttributes EMPTY =
            new RecordAttributes(null, null, null, null, null, null, null, null);

    public static RecordAttributes empty() {
        return EMPTY;
    }
}
