/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/StoredRecord.java
 * 何を: ストア上に既に存在するアカウントの識別情報
 * なぜ: 更新時にストア側の id を保持したまま書き込みを組み立てるため
 */
package com.example.accounttransfer.model;

public record StoredRecord(
        long id,
        String key) {
}
