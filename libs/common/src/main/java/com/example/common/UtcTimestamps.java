/*
 * どこで: 共通ユーティリティ
 * 何を: Instant を UTC 固定の文字列表現と JDBC Timestamp へ変換する
 * なぜ: ログ行・登録日時・ファイル名で同じ書式を使い、DB への束縛も明示型で揃えるため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class UtcTimestamps {

  /** {@code 2024-03-01 10:00:00} */
  public static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  /** {@code 20240301_100000}, safe inside file names. */
  public static final DateTimeFormatter FILE_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private UtcTimestamps() {}

  public static String formatDateTime(Instant instant) {
    return DATE_TIME.format(instant);
  }

  public static String formatFileStamp(Instant instant) {
    return FILE_STAMP.format(instant);
  }

  // PostgreSQL JDBC は Instant の型推論に失敗することがあるため Timestamp で渡す
  public static Timestamp toJdbc(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }
}
