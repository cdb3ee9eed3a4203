package com.mk.fx.qa.load.bench.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.load.bench.cfg.LoadRunProperties;
import com.mk.fx.qa.load.bench.dto.controllerresponse.LoadRunRequest;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunLiveMetricsResponse;
import com.mk.fx.qa.load.bench.metrics.LoadSnapshot;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.model.LoadRunDefinition;
import com.mk.fx.qa.load.bench.rest.HttpMethod;
import com.mk.fx.qa.load.bench.rest.JsonUtil;
import java.time.Instant;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class})
public interface RunMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  @Mapping(target = "definition", source = "request")
  LoadRun toDomain(LoadRunRequest request);

  @Mapping(target = "method", source = "method", qualifiedByName = "mapMethod")
  @Mapping(target = "qps", source = "qps", qualifiedByName = "mapRate")
  @Mapping(target = "body", source = "body", qualifiedByName = "mapBody")
  @Mapping(target = "authToken", source = "auth")
  LoadRunDefinition toDefinition(LoadRunRequest request);

  @Mapping(target = "method", source = "method", qualifiedByName = "mapMethod")
  @Mapping(target = "qps", source = "qps", qualifiedByName = "mapRate")
  @Mapping(target = "authToken", source = "auth")
  LoadRunDefinition toDefinition(LoadRunProperties properties);

  @Mapping(target = "runId", source = "config.runId")
  @Mapping(target = "url", source = "config.url")
  @Mapping(target = "method", source = "config.method")
  @Mapping(target = "qps", source = "config.qps")
  @Mapping(target = "concurrency", source = "config.concurrency")
  @Mapping(target = "durationSeconds", source = "config.durationSeconds")
  @Mapping(target = "targetRequestCount", source = "config.targetRequestCount")
  RunLiveMetricsResponse toLiveMetrics(LoadSnapshot snapshot);

  @Named("mapMethod")
  default HttpMethod mapMethod(String method) {
    if (method == null || method.isBlank()) {
      return HttpMethod.GET;
    }
    try {
      return HttpMethod.fromValue(method);
    } catch (IllegalArgumentException ex) {
      throw new InvalidConfigurationException(ex.getMessage(), ex);
    }
  }

  @Named("mapRate")
  default double mapRate(Double qps) {
    if (qps == null) {
      throw new InvalidConfigurationException("qps is required");
    }
    return qps;
  }

  /** Strings are sent verbatim; any other JSON value is sent as its JSON text. */
  @Named("mapBody")
  default String mapBody(Object body) {
    if (body == null) {
      return null;
    }
    if (body instanceof String text) {
      return text;
    }
    try {
      return JsonUtil.toCompactJson(body);
    } catch (JsonProcessingException ex) {
      throw new InvalidConfigurationException("Body cannot be serialised: " + ex.getMessage(), ex);
    }
  }
}
