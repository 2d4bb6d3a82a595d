package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class UtcTimestampsTest {

  private final Instant instant = Instant.parse("2024-03-01T09:08:07.654Z");

  @Test
  void formatsInUtcRegardlessOfDefaultZone() {
    assertThat(UtcTimestamps.formatDateTime(instant)).isEqualTo("2024-03-01 09:08:07");
    assertThat(UtcTimestamps.formatFileStamp(instant)).isEqualTo("20240301_090807");
  }

  @Test
  void convertsToJdbcTimestampKeepingTheInstant() {
    assertThat(UtcTimestamps.toJdbc(instant).toInstant()).isEqualTo(instant);
    assertThat(UtcTimestamps.toJdbc(null)).isNull();
  }
}
