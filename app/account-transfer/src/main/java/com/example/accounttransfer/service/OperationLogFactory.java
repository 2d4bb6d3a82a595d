package com.example.accounttransfer.service;

import com.example.accounttransfer.config.TransferProperties;
import com.example.accounttransfer.repository.OperationLogStore;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OperationLogFactory {

  private final OperationLogStore store;
  private final Clock clock;
  private final TransferProperties properties;

  public OperationLog create() {
    return new OperationLog(store, clock, properties.logRetention());
  }

  public List<String> formattedLast() {
    return create().formattedLast();
  }
}
