package com.scholary.audiobook.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

/**
 * The closed set of synthesis backends.
 *
 * <p>{@link #AUTO} is only valid as a request; it is resolved to a concrete backend by {@link
 * BackendResolver} before anything is synthesized or checkpointed.
 */
public enum BackendType {
  AUTO("auto", 0),
  MLX("mlx", 900),
  PYTORCH("pytorch", 600),
  MOCK("mock", 600);

  private final String wireName;
  private final int defaultChunkChars;

  BackendType(String wireName, int defaultChunkChars) {
    this.wireName = wireName;
    this.defaultChunkChars = defaultChunkChars;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Chunk size that benchmarked best for this backend. */
  public int defaultChunkChars() {
    if (this == AUTO) {
      throw new IllegalStateException("Resolve the backend before picking a chunk size");
    }
    return defaultChunkChars;
  }

  @JsonCreator
  public static BackendType fromName(String name) {
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown backend: " + name + ". Available: auto, mlx, pytorch, mock"));
  }
}
