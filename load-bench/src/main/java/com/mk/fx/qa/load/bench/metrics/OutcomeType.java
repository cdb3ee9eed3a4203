package com.mk.fx.qa.load.bench.metrics;

/** Classification of one completed request attempt. */
public enum OutcomeType {
  /** The server responded with the expected status code. */
  SUCCESS,
  /** The server responded, but not with the expected status code. */
  STATUS_MISMATCH,
  /** The request failed to complete: connection error, timeout, DNS failure and similar. */
  TRANSPORT_ERROR;

  public boolean isError() {
    return this != SUCCESS;
  }
}
