package com.scholary.audiobook.checkpoint;

/**
 * Result of the pre-run checkpoint probe.
 *
 * <p>A probe only checks that state exists and that the source hash matches. It never compares the
 * run configuration, so {@code configVerified} is always false: a FOUND probe can still be
 * rejected by the full {@link CheckpointStore#load} when settings have drifted.
 */
public record ProbeResult(
    Status status, int totalChunks, int completedChunks, String detail, boolean configVerified) {

  public enum Status {
    NONE,
    FOUND,
    INVALID
  }

  public static ProbeResult none() {
    return new ProbeResult(Status.NONE, 0, 0, null, false);
  }

  public static ProbeResult hashMismatch() {
    return new ProbeResult(Status.INVALID, 0, 0, "hash_mismatch", false);
  }

  public static ProbeResult found(int totalChunks, int completedChunks) {
    return new ProbeResult(
        Status.FOUND, totalChunks, completedChunks, totalChunks + ":" + completedChunks, false);
  }
}
