package com.scholary.audiobook.pipeline;

import com.scholary.audiobook.backend.BackendType;
import com.scholary.audiobook.checkpoint.CheckpointConfig;
import com.scholary.audiobook.export.ExportJob;
import com.scholary.audiobook.export.OutputFormat;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for one coordinator run. Chunk size and backend are already resolved.
 *
 * @param sourceHash fingerprint of the source, or null to hash the chapters
 */
public record RunOptions(
    Path outputPath,
    int chunkChars,
    String splitPattern,
    String voice,
    double speed,
    String lang,
    OutputFormat format,
    String bitrate,
    boolean normalize,
    boolean checkpoint,
    boolean resume,
    PipelineMode pipelineMode,
    int prefetchChunks,
    int pcmQueueSize,
    String title,
    String author,
    Path coverPath,
    String sourceHash,
    Duration heartbeatInterval,
    Path tempDir) {

  /** Resuming always implies checkpointing. */
  public boolean checkpointEnabled() {
    return checkpoint || resume;
  }

  /** Settings that must match for a checkpoint to be reused. */
  public CheckpointConfig checkpointConfig(BackendType backend) {
    return new CheckpointConfig(
        voice,
        speed,
        lang,
        backend.wireName(),
        chunkChars,
        splitPattern,
        format.extension(),
        bitrate,
        normalize);
  }

  ExportJob exportJob() {
    return new ExportJob(format, bitrate, normalize, title, author, coverPath, List.of());
  }
}
