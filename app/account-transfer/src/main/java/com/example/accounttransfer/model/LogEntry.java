/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/LogEntry.java
 * 何を: 操作ログ 1 行分のレコード
 * なぜ: 実行中の判断と結果を時刻・重要度付きで残し、直近の実行分を後から表示するため
 */
package com.example.accounttransfer.model;

import java.time.Instant;

public record LogEntry(
        Instant timestamp,
        LogSeverity severity,
        String message) {
}
