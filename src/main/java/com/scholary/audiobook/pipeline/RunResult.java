package com.scholary.audiobook.pipeline;

import java.nio.file.Path;

/**
 * Outcome of a coordinator run.
 *
 * @param failureKind null on success
 * @param message null on success
 */
public record RunResult(
    boolean success,
    Path output,
    PipelineMode mode,
    int totalChunks,
    int reusedChunks,
    int synthesizedChunks,
    long totalSamples,
    FailureKind failureKind,
    String message) {

  public static RunResult succeeded(
      Path output,
      PipelineMode mode,
      int totalChunks,
      int reusedChunks,
      int synthesizedChunks,
      long totalSamples) {
    return new RunResult(
        true, output, mode, totalChunks, reusedChunks, synthesizedChunks, totalSamples, null, null);
  }

  public static RunResult failed(FailureKind kind, String message) {
    return new RunResult(false, null, null, 0, 0, 0, 0, kind, message);
  }
}
