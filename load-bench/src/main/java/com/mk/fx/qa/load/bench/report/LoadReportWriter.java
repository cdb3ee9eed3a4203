package com.mk.fx.qa.load.bench.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.load.bench.metrics.LoadSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the summary snapshot of a run as indented JSON, and optionally logs it. */
@Slf4j
@Component
public class LoadReportWriter {

  private final ObjectMapper objectMapper;

  public LoadReportWriter(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public String toJson(LoadSummary summary) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialise summary", e);
    }
  }

  /**
   * Logs the summary when {@code verbose} and writes it to {@code output} unless the output is
   * blank.
   *
   * @return the written file, empty when no output was requested
   * @throws UncheckedIOException if the file cannot be written
   */
  public Optional<Path> write(LoadSummary summary, String output, boolean verbose) {
    Objects.requireNonNull(summary, "summary");
    var json = toJson(summary);
    if (verbose) {
      log.info("Load summary:\n{}", json);
    }
    if (output == null || output.isBlank()) {
      return Optional.empty();
    }
    var path = Path.of(output.trim());
    try {
      var parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write report to " + path, e);
    }
    log.info("Load summary written to {}", path.toAbsolutePath());
    return Optional.of(path);
  }
}
