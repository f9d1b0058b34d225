package com.scholary.audiobook.job;

import com.scholary.audiobook.events.EventLine;
import com.scholary.audiobook.events.EventSink;

/**
 * Mirrors phase and progress events onto a job's status.
 *
 * <p>Inference covers 5-90%; concatenation and export take the rest.
 */
public class JobProgressSink implements EventSink {

  private final SynthesisJob job;

  public JobProgressSink(SynthesisJob job) {
    this.job = job;
  }

  @Override
  public void accept(EventLine line) {
    switch (line.type()) {
      case "phase" -> onPhase(String.valueOf(line.fields().get("phase")));
      case "progress" -> onProgress(line);
      default -> {
        // other events do not move the status
      }
    }
  }

  private void onPhase(String phase) {
    job.setPhase(phase);
    switch (phase) {
      case "INFERENCE" -> job.setProgress(Math.max(job.getProgress(), 5));
      case "EXPORTING" -> job.setProgress(Math.max(job.getProgress(), 90));
      case "DONE" -> job.setProgress(100);
      default -> {
        // PARSING and CONCATENATING keep the current value
      }
    }
  }

  private void onProgress(EventLine line) {
    Object current = line.fields().get("current_chunk");
    Object total = line.fields().get("total_chunks");
    if (current instanceof Number done && total instanceof Number all && all.intValue() > 0) {
      job.setProgress(5 + (int) (85L * done.intValue() / all.intValue()));
    }
  }
}
