package com.example.common;

import java.util.UUID;

/** Identifiers that tie together the log lines of one export or import run. */
public final class RunIds {

  private RunIds() {}

  public static String newRunId() {
    return UUID.randomUUID().toString();
  }
}
