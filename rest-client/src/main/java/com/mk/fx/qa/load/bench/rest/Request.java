package com.mk.fx.qa.load.bench.rest;

import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private Map<String, String> headers;
  private String body;
}
