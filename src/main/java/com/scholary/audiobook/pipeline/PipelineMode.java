package com.scholary.audiobook.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Scheduling strategy for a run. */
public enum PipelineMode {
  /** One chunk at a time; required whenever checkpointing is on. */
  SEQUENTIAL("sequential"),
  /** Inference and conversion on separate threads, streaming into the encoder. */
  OVERLAP3("overlap3");

  private final String wireName;

  PipelineMode(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static PipelineMode fromName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "sequential" -> SEQUENTIAL;
      case "overlap3" -> OVERLAP3;
      default -> throw new IllegalArgumentException("Unknown pipeline mode: " + name);
    };
  }
}
