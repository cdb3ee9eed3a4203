package com.mk.fx.qa.load.bench.rest;

import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private long bodyLength;
  private long responseTimeMs;
}
