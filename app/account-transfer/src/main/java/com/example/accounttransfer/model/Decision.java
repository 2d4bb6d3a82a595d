package com.example.accounttransfer.model;

import java.util.List;

public record Decision(
    int position,
    String key,
    DecisionType type,
    RecordId recordId,
    SkipReason skipReason,
    String detail,
    List<String> metadataKeys) {

  public Decision {
    metadataKeys = metadataKeys == null ? List.of() : List.copyOf(metadataKeys);
  }

  public static Decision created(int position, String key, RecordId recordId) {
    return new Decision(position, key, DecisionType.CREATED, recordId, null, null, List.of());
  }

  public static Decision updated(int position, String key, RecordId recordId) {
    return new Decision(position, key, DecisionType.UPDATED, recordId, null, null, List.of());
  }

  public static Decision skipped(int position, String key, SkipReason reason, String detail) {
    return new Decision(position, key, DecisionType.SKIPPED, null, reason, detail, List.of());
  }

  public Decision withMetadataKeys(List<String> keys) {
    return new Decision(position, key, type, recordId, skipReason, detail, keys);
  }

  public boolean isSkipped() {
    return type == DecisionType.SKIPPED;
  }
}
