package com.example.accounttransfer.api.response;

import com.example.accounttransfer.model.Decision;
import java.util.List;

public record DecisionResponse(
    int position,
    String key,
    String decision,
    String recordId,
    String skipReason,
    String detail,
    List<String> metadataKeys) {

  public static DecisionResponse from(Decision decision) {
    return new DecisionResponse(
        decision.position(),
        decision.key(),
        decision.type().name(),
        decision.recordId() == null ? null : decision.recordId().toString(),
        decision.skipReason() == null ? null : decision.skipReason().name(),
        decision.detail(),
        decision.metadataKeys());
  }
}
