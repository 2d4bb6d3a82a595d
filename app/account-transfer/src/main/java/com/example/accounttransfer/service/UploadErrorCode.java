package com.example.accounttransfer.service;

public enum UploadErrorCode {
  NO_FILE,
  INVALID_FILE_TYPE,
  FILE_TOO_LARGE,
  EMPTY_FILE
}
