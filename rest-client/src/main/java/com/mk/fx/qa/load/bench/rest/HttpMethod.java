package com.mk.fx.qa.load.bench.rest;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/** HTTP methods a load run may issue. Only POST and PUT carry a request body. */
public enum HttpMethod {
  GET(false),
  POST(true),
  PUT(true),
  DELETE(false);

  private final boolean carriesBody;

  HttpMethod(boolean carriesBody) {
    this.carriesBody = carriesBody;
  }

  public boolean carriesBody() {
    return carriesBody;
  }

  public static HttpMethod fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("HTTP method is required");
    }
    return Arrays.stream(values())
        .filter(method -> method.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported HTTP method: " + value + ". Allowed: " + asStrings()));
  }

  public static Set<String> asStrings() {
    return Arrays.stream(values()).map(Enum::name).collect(Collectors.toUnmodifiableSet());
  }
}
