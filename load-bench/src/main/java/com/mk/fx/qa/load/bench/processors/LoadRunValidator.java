package com.mk.fx.qa.load.bench.processors;

import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import com.mk.fx.qa.load.bench.model.LoadRunDefinition;
import com.mk.fx.qa.load.bench.rest.LoadHttpClient;
import com.mk.fx.qa.load.bench.rest.Request;
import java.util.Objects;

/**
 * Turns a {@link LoadRunDefinition} into the HTTP client and request a run issues, failing with
 * {@link InvalidConfigurationException} before any worker starts if either cannot be built.
 */
public final class LoadRunValidator {

  private LoadRunValidator() {}

  /** Checks that the URL, method and headers of the definition can be sent. */
  public static void validate(LoadRunDefinition definition) {
    var client = buildClient(definition);
    validateRequest(client, buildRequest(definition));
  }

  public static LoadHttpClient buildClient(LoadRunDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    try {
      return new LoadHttpClient(
          definition.url(), definition.timeoutSeconds(), definition.timeoutSeconds(), null);
    } catch (IllegalArgumentException ex) {
      throw new InvalidConfigurationException(ex.getMessage(), ex);
    }
  }

  public static Request buildRequest(LoadRunDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    var request = new Request();
    request.setMethod(definition.method());
    request.setHeaders(definition.effectiveHeaders());
    request.setBody(definition.effectiveBody());
    return request;
  }

  public static void validateRequest(LoadHttpClient client, Request request) {
    try {
      client.validate(request);
    } catch (IllegalArgumentException ex) {
      throw new InvalidConfigurationException("Invalid request: " + ex.getMessage(), ex);
    }
  }
}
