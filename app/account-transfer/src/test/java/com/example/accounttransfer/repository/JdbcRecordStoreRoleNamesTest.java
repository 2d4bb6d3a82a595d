package com.example.accounttransfer.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JdbcRecordStoreRoleNamesTest {

  @Test
  void readsGrantedFlagsFromMap() {
    final Map<String, Object> capabilities = new LinkedHashMap<>();
    capabilities.put("administrator", true);
    capabilities.put("editor", 1);
    capabilities.put("author", false);
    capabilities.put("contributor", "0");
    capabilities.put("subscriber", "1");

    assertThat(JdbcRecordStore.roleNames(capabilities))
        .containsExactly("administrator", "editor", "subscriber");
  }

  @Test
  void acceptsListAndSingleString() {
    assertThat(JdbcRecordStore.roleNames(List.of("editor", " ", "author")))
        .containsExactly("editor", "author");
    assertThat(JdbcRecordStore.roleNames("subscriber")).containsExactly("subscriber");
    assertThat(JdbcRecordStore.roleNames(42)).isEmpty();
  }
}
