package com.mk.fx.qa.load.bench.model;

/**
 * Raised when a run definition cannot be executed: non-positive rate, duration, concurrency or
 * timeout, a missing or malformed URL, an unsupported method or an invalid header. Always thrown
 * before any worker starts.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

  public InvalidConfigurationException(String message) {
    super(message);
  }

  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
