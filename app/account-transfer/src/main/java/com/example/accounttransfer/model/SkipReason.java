/*
 * どこで: app/account-transfer/src/main/java/com/example/accounttransfer/model/SkipReason.java
 * 何を: レコードを取り込まなかった理由
 * なぜ: skipped 件数は 1 つに集約しつつ、個々の理由は Decision に残すため
 */
package com.example.accounttransfer.model;

public enum SkipReason {
    MISSING_KEY,
    MISSING_CREDENTIAL,
    STORE_ERROR
}
