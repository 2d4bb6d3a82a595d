package com.example.accounttransfer.model;

public enum DecisionType {
  CREATED,
  UPDATED,
  SKIPPED
}
