package com.example.accounttransfer.model;

public enum LogSeverity {
  INFO,
  WARNING,
  ERROR,
  SUCCESS,
  INFO_IMPORTANT,
  INFO_DETAIL
}
