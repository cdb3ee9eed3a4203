package com.mk.fx.qa.load.bench.dto.controllerresponse;

public record HealthResponse(String status) {}
