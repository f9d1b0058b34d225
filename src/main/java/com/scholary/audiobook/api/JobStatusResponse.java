package com.scholary.audiobook.api;

import com.scholary.audiobook.checkpoint.ProbeResult;
import com.scholary.audiobook.pipeline.FailureKind;
import com.scholary.audiobook.pipeline.RunResult;

/**
 * Response for job status query.
 *
 * <p>{@code result} is set once a synthesis job completes, {@code probe} once a probe-only job
 * completes, and {@code failureKind} with {@code error} when a job fails.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    String phase,
    RunResult result,
    ProbeResult probe,
    FailureKind failureKind,
    String error,
    String eventsUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
