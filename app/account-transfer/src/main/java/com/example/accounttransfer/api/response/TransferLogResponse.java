package com.example.accounttransfer.api.response;

import java.util.List;

public record TransferLogResponse(List<String> lines) {

  public TransferLogResponse {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }
}
