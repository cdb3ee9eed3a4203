package com.mk.fx.qa.load.bench.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A run submitted for execution: its identity, creation time and definition. */
public class LoadRun {

  private final UUID id;
  private final Instant createdAt;
  private final LoadRunDefinition definition;

  public LoadRun(UUID id, Instant createdAt, LoadRunDefinition definition) {
    this.id = Objects.requireNonNull(id, "id");
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.definition = Objects.requireNonNull(definition, "definition");
  }

  public static LoadRun of(LoadRunDefinition definition) {
    return new LoadRun(UUID.randomUUID(), Instant.now(), definition);
  }

  public UUID getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public LoadRunDefinition getDefinition() {
    return definition;
  }
}
