package com.scholary.audiobook.job;

import com.scholary.audiobook.api.JobStatusResponse.Status;
import com.scholary.audiobook.api.SynthesisRequest;
import com.scholary.audiobook.checkpoint.ProbeResult;
import com.scholary.audiobook.events.BufferedEventSink;
import com.scholary.audiobook.pipeline.FailureKind;
import com.scholary.audiobook.pipeline.RunResult;
import java.time.Instant;

/**
 * Represents an async synthesis job.
 *
 * <p>Tracks the job's state, progress and result, plus the buffered event stream clients poll.
 * Fields are written by the job thread and read by request threads, hence volatile.
 */
public class SynthesisJob {

  private final String jobId;
  private final SynthesisRequest request;
  private final Instant createdAt;
  private final BufferedEventSink events;

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String phase;
  private volatile RunResult result;
  private volatile ProbeResult probe;
  private volatile FailureKind failureKind;
  private volatile String error;

  public SynthesisJob(String jobId, SynthesisRequest request, int eventBufferSize) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.events = new BufferedEventSink(eventBufferSize);
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public SynthesisRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public BufferedEventSink getEvents() {
    return events;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public RunResult getResult() {
    return result;
  }

  public void setResult(RunResult result) {
    this.result = result;
  }

  public ProbeResult getProbe() {
    return probe;
  }

  public void setProbe(ProbeResult probe) {
    this.probe = probe;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  public void setFailureKind(FailureKind failureKind) {
    this.failureKind = failureKind;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED;
  }
}
