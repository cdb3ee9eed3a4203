package com.mk.fx.qa.load.bench.model;

import com.mk.fx.qa.load.bench.rest.HttpMethod;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated-by-construction description of one run.
 *
 * <p>Construction rejects non-positive rate, duration, concurrency and timeout values and a
 * missing method or URL with {@link InvalidConfigurationException}. URL syntax and header values
 * are checked by {@code LoadRunValidator} against the HTTP client before a run starts.
 *
 * @param url absolute http(s) URL of the target
 * @param method HTTP method issued by every request
 * @param qps target admissions per second across all workers
 * @param durationSeconds wall-clock run duration
 * @param concurrency number of workers
 * @param timeoutSeconds per-request connect and response timeout
 * @param headers request headers, may be empty
 * @param body request body for POST and PUT, may be {@code null}
 * @param expectedStatus status code counted as success
 * @param authToken bearer token, may be {@code null}
 */
public record LoadRunDefinition(
    String url,
    HttpMethod method,
    double qps,
    int durationSeconds,
    int concurrency,
    int timeoutSeconds,
    Map<String, String> headers,
    String body,
    int expectedStatus,
    String authToken) {

  public static final int DEFAULT_DURATION_SECONDS = 60;
  public static final int DEFAULT_CONCURRENCY = 1;
  public static final int DEFAULT_TIMEOUT_SECONDS = 5;
  public static final int DEFAULT_EXPECTED_STATUS = 200;

  /** Body sent by POST and PUT requests when none is configured. */
  public static final String DEFAULT_PAYLOAD = "{\"example_key\":\"example_value\"}";

  public LoadRunDefinition {
    if (url == null || url.isBlank()) {
      throw new InvalidConfigurationException("url is required");
    }
    if (method == null) {
      throw new InvalidConfigurationException("method is required");
    }
    if (!(qps > 0.0) || Double.isInfinite(qps)) {
      throw new InvalidConfigurationException("qps must be a finite number > 0, was " + qps);
    }
    if (durationSeconds <= 0) {
      throw new InvalidConfigurationException(
          "durationSeconds must be > 0, was " + durationSeconds);
    }
    if (concurrency <= 0) {
      throw new InvalidConfigurationException("concurrency must be > 0, was " + concurrency);
    }
    if (timeoutSeconds <= 0) {
      throw new InvalidConfigurationException("timeoutSeconds must be > 0, was " + timeoutSeconds);
    }
    if (expectedStatus < 100 || expectedStatus > 599) {
      throw new InvalidConfigurationException(
          "expectedStatus must be a valid HTTP status, was " + expectedStatus);
    }
    url = url.trim();
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /** Informational request count at the target rate: {@code qps * durationSeconds}. */
  public long targetRequestCount() {
    return Math.round(qps * durationSeconds);
  }

  /**
   * Headers sent with every request. Without configured headers a JSON content type is sent; an
   * auth token adds a bearer {@code Authorization} header.
   */
  public Map<String, String> effectiveHeaders() {
    Map<String, String> effective = new LinkedHashMap<>();
    if (headers.isEmpty()) {
      effective.put("Content-Type", "application/json");
    } else {
      effective.putAll(headers);
    }
    if (authToken != null && !authToken.isBlank()) {
      effective.put("Authorization", "Bearer " + authToken.trim());
    }
    return Map.copyOf(effective);
  }

  /** Body for methods that carry one, falling back to {@link #DEFAULT_PAYLOAD}; else {@code null}. */
  public String effectiveBody() {
    if (!method.carriesBody()) {
      return null;
    }
    return body != null ? body : DEFAULT_PAYLOAD;
  }
}
