package com.mk.fx.qa.load.bench.cfg;

/**
 * Body returned for failed API calls.
 *
 * @param error short error category
 * @param details human-readable cause
 */
public record ErrorResponse(String error, String details) {}
