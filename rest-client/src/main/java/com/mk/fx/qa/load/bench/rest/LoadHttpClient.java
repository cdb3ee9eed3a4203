package com.mk.fx.qa.load.bench.rest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client issuing load requests against a single target URL. Each call sends exactly one
 * request and fully drains the response body; there is no retry logic.
 */
@Slf4j
public class LoadHttpClient {

  /** Content type applied to bodies when the caller does not set one. */
  public static final String JSON_CONTENT_TYPE = "application/json";

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Headers included in every request. */
  private final Map<String, String> headers;

  /** Absolute URL every request is sent to. */
  private final URI target;

  /** Per-request timeout. */
  private final Duration requestTimeout;

  /**
   * Constructs a client for the given target.
   *
   * @param targetUrl absolute http(s) URL all requests are sent to
   * @param connTimeOutSeconds connection timeout in seconds
   * @param requestTimeoutSeconds request timeout in seconds
   * @param headers headers to include in all requests
   * @throws IllegalArgumentException if the URL is blank, malformed or not http(s), or a timeout is
   *     not positive
   */
  public LoadHttpClient(
      String targetUrl,
      int connTimeOutSeconds,
      int requestTimeoutSeconds,
      Map<String, String> headers) {
    if (connTimeOutSeconds <= 0 || requestTimeoutSeconds <= 0) {
      throw new IllegalArgumentException("Timeouts must be > 0 seconds");
    }
    this.target = validateTarget(targetUrl);
    this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
    this.httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(connTimeOutSeconds))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Target: {}, Connection timeout: {}s, Request timeout: {}s",
        target,
        connTimeOutSeconds,
        requestTimeoutSeconds);
  }

  /**
   * Sends one request and waits for the complete response.
   *
   * @param request method, header overrides and optional body
   * @return status code and drained body length
   * @throws TransportException if the request fails to complete
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public RestResponseData execute(Request request) throws InterruptedException {
    Objects.requireNonNull(request, "Request cannot be null");
    var httpRequest = buildHttpRequest(request);

    var startTime = System.nanoTime();
    try {
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
      var durationMs = (System.nanoTime() - startTime) / 1_000_000;

      var result = new RestResponseData();
      result.setStatusCode(response.statusCode());
      result.setBodyLength(response.body() != null ? response.body().length : 0);
      result.setResponseTimeMs(durationMs);

      log.debug("Request completed in {} ms with status {}", durationMs, response.statusCode());
      return result;
    } catch (HttpTimeoutException e) {
      log.debug("Request timed out after {} seconds: {}", requestTimeout.getSeconds(), e.getMessage());
      throw new TransportException(
          "Request timed out after " + requestTimeout.getSeconds() + "s: " + e.getMessage(), e);
    } catch (IOException e) {
      log.debug("Error executing request: {}", e.getMessage());
      throw new TransportException("Error executing request: " + e.getMessage(), e);
    }
  }

  /**
   * Builds the request without sending it, so header or method problems surface before a run.
   *
   * @throws IllegalArgumentException if the request cannot be built
   */
  public void validate(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    buildHttpRequest(request);
  }

  public URI target() {
    return target;
  }

  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new IllegalArgumentException("Request method is required");
    }
    var requestBuilder = HttpRequest.newBuilder().uri(target).timeout(requestTimeout);

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    var method = request.getMethod();
    if (method.carriesBody() && request.getBody() != null) {
      if (!hasHeader("Content-Type", request.getHeaders())) {
        requestBuilder.setHeader("Content-Type", JSON_CONTENT_TYPE);
      }
      requestBuilder.method(method.name(), HttpRequest.BodyPublishers.ofString(request.getBody()));
    } else {
      requestBuilder.method(method.name(), HttpRequest.BodyPublishers.noBody());
    }
    return requestBuilder.build();
  }

  private boolean hasHeader(String name, Map<String, String> requestHeaders) {
    return headers.keySet().stream().anyMatch(name::equalsIgnoreCase)
        || (requestHeaders != null
            && requestHeaders.keySet().stream().anyMatch(name::equalsIgnoreCase));
  }

  /**
   * Validates the target URL.
   *
   * @throws IllegalArgumentException if the URL is null, empty, malformed or not http(s)
   */
  private URI validateTarget(String targetUrl) {
    if (targetUrl == null || targetUrl.isBlank()) {
      throw new IllegalArgumentException("Target URL cannot be empty");
    }
    URI uri;
    try {
      uri = URI.create(targetUrl.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed target URL: " + targetUrl, e);
    }
    var scheme = uri.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("Target URL must be an absolute http(s) URL: " + targetUrl);
    }
    return uri;
  }
}
