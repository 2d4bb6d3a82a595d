/*
 * どこで: account-transfer のログ設定テスト
 * 何を: JSON ログ設定と移行処理用 MDC フィールドの存在を検証する
 * なぜ: 設定変更で構造化ログや実行 ID の出力が欠落する回帰を防ぐため
 */
package com.example.accounttransfer;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndTransferFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"");
    assertThat(configText).contains("\"transfer_run_id\":\"%X{transfer_run_id:-}\"");
  }
}
