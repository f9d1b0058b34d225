package com.scholary.audiobook.checkpoint;

import java.util.Set;

/**
 * Outcome of validating a persisted checkpoint against the current run.
 *
 * <p>Only {@link Status#VALID} permits chunk reuse. Every other status means the run starts fresh.
 */
public record LoadResult(Status status, CheckpointState state, Set<Integer> completedChunks) {

  public enum Status {
    ABSENT(null),
    VALID(null),
    INVALID_HASH_MISMATCH("hash_mismatch"),
    INVALID_CONFIG_MISMATCH("config_mismatch"),
    INVALID_CHUNK_COUNT_MISMATCH("chunk_mismatch");

    private final String detail;

    Status(String detail) {
      this.detail = detail;
    }

    /** Detail used in {@code CHECKPOINT:INVALID:<detail>} events; null for non-invalid states. */
    public String detail() {
      return detail;
    }

    public boolean isInvalid() {
      return detail != null;
    }
  }

  public LoadResult {
    completedChunks = completedChunks == null ? Set.of() : Set.copyOf(completedChunks);
  }

  public static LoadResult absent() {
    return new LoadResult(Status.ABSENT, null, Set.of());
  }

  public static LoadResult invalid(Status status, CheckpointState state) {
    return new LoadResult(status, state, Set.of());
  }

  public static LoadResult valid(CheckpointState state, Set<Integer> completed) {
    return new LoadResult(Status.VALID, state, completed);
  }

  public boolean isValid() {
    return status == Status.VALID;
  }
}
