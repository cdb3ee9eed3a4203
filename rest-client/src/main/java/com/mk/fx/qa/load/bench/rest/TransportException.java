package com.mk.fx.qa.load.bench.rest;

/**
 * Raised when a request fails to complete at the transport level: connection refused, timeout,
 * DNS failure, TLS failure or an I/O error while draining the response.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
