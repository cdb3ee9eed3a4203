package com.mk.fx.qa.load.bench.model;

import java.util.Arrays;

/** Lifecycle of a submitted run. */
public enum RunStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == CANCELLED;
  }

  public static RunStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> value != null && status.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported run status: " + value));
  }
}
