package com.example.accounttransfer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.util.unit.DataSize;

class TransferPropertiesTest {

  @Test
  void defaultsApplyWhenUnset() {
    final TransferProperties properties = TransferProperties.defaults();

    assertThat(properties.encryptionPassword()).isEmpty();
    assertThat(properties.rolesMetadataKey()).isEqualTo("capabilities");
    assertThat(properties.maxArchiveSize()).isEqualTo(DataSize.ofMegabytes(5));
    assertThat(properties.logRetention()).isEqualTo(Duration.ofHours(1));
    assertThat(properties.logKey()).isEqualTo("transfer:last-log");
  }

  @Test
  void bindsFromConfigurationKeys() {
    final MapConfigurationPropertySource source = new MapConfigurationPropertySource();
    source.put("transfer.encryption-password", "s3cret");
    source.put("transfer.roles-metadata-key", "wp_capabilities");
    source.put("transfer.max-archive-size", "2MB");
    source.put("transfer.log-retention", "15m");

    final TransferProperties properties =
        new Binder(source).bind("transfer", Bindable.of(TransferProperties.class)).get();

    assertThat(properties.encryptionPassword()).isEqualTo("s3cret");
    assertThat(properties.rolesMetadataKey()).isEqualTo("wp_capabilities");
    assertThat(properties.maxArchiveSize()).isEqualTo(DataSize.ofMegabytes(2));
    assertThat(properties.logRetention()).isEqualTo(Duration.ofMinutes(15));
    assertThat(properties.logKey()).isEqualTo("transfer:last-log");
  }

  @Test
  void nonPositiveRetentionFallsBackToDefault() {
    final TransferProperties properties =
        new TransferProperties("pw", " ", null, Duration.ZERO, "");

    assertThat(properties.rolesMetadataKey()).isEqualTo("capabilities");
    assertThat(properties.logRetention()).isEqualTo(Duration.ofHours(1));
    assertThat(properties.logKey()).isEqualTo("transfer:last-log");
  }
}
