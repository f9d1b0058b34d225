package com.scholary.audiobook.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method tags one chunk lifecycle record with an {@code event_type} and its fields, so the
 * records can be filtered in a log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log the plan for a run. */
  public void logRunPlanned(int totalChunks, int chapters, int maxChars, String mode) {
    try {
      MDC.put("event_type", "run_planned");
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("chapters", String.valueOf(chapters));
      MDC.put("maxChars", String.valueOf(maxChars));
      MDC.put("mode", mode);

      logger.info(
          "Run planned: chunks={}, chapters={}, maxChars={}, mode={}",
          totalChunks,
          chapters,
          maxChars,
          mode);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, int chars) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("chars", String.valueOf(chars));

      logger.debug("Chunk started: index={}, chars={}", chunkIndex, chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, int samples, long synthesizeMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("samples", String.valueOf(samples));
      MDC.put("synthesizeMs", String.valueOf(synthesizeMs));

      logger.debug(
          "Chunk finished: index={}, samples={}, synthesize={}ms",
          chunkIndex,
          samples,
          synthesizeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a chunk served from the checkpoint. */
  public void logChunkReused(int chunkIndex, int samples) {
    try {
      MDC.put("event_type", "chunk_reused");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("samples", String.valueOf(samples));

      logger.debug("Chunk reused from checkpoint: index={}, samples={}", chunkIndex, samples);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed chunk whose audio record was gone. */
  public void logChunkAudioMissing(int chunkIndex) {
    try {
      MDC.put("event_type", "chunk_audio_missing");
      MDC.put("chunk_index", String.valueOf(chunkIndex));

      logger.warn("Checkpoint audio missing, regenerating chunk {}", chunkIndex);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int chunksProcessed, int totalChunks, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("chunksProcessed", String.valueOf(chunksProcessed));
      MDC.put("totalChunks", String.valueOf(totalChunks));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, chunks={}/{}, progress={}%",
          jobId,
          phase,
          chunksProcessed,
          totalChunks,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log run failure. */
  public void logRunFailed(String failureKind, String message) {
    try {
      MDC.put("event_type", "run_failed");
      MDC.put("failureKind", failureKind);

      logger.error("Run failed: kind={}, message={}", failureKind, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String outputPath) {
    MDC.put("jobId", jobId);
    MDC.put("outputPath", outputPath);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("outputPath");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("chars");
    MDC.remove("samples");
    MDC.remove("synthesizeMs");
    MDC.remove("totalChunks");
    MDC.remove("chapters");
    MDC.remove("maxChars");
    MDC.remove("mode");
    MDC.remove("chunksProcessed");
    MDC.remove("percentComplete");
    MDC.remove("phase");
    MDC.remove("failureKind");
  }
}
