package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Data;

/**
 * API request describing a run. Omitted optional fields take the command-line defaults. The body
 * may be a JSON value or a string; non-string values are sent as their JSON text.
 */
@Data
public class LoadRunRequest {

  @NotBlank
  @JsonProperty("url")
  private String url;

  @JsonProperty("method")
  private String method = "GET";

  @NotNull
  @DecimalMin(value = "0.0", inclusive = false)
  @JsonProperty("qps")
  private Double qps;

  @Min(1)
  @JsonProperty("durationSeconds")
  private Integer durationSeconds = 60;

  @Min(1)
  @JsonProperty("concurrency")
  private Integer concurrency = 1;

  @Min(1)
  @JsonProperty("timeoutSeconds")
  private Integer timeoutSeconds = 5;

  @JsonProperty("headers")
  private Map<String, String> headers;

  @JsonProperty("body")
  private Object body;

  @Min(100)
  @Max(599)
  @JsonProperty("expectedStatus")
  private Integer expectedStatus = 200;

  @JsonProperty("auth")
  private String auth;
}
