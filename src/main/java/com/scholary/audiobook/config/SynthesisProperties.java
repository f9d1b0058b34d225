package com.scholary.audiobook.config;

import com.scholary.audiobook.backend.BackendType;
import com.scholary.audiobook.export.OutputFormat;
import com.scholary.audiobook.pipeline.PipelineMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for synthesis jobs.
 *
 * <p>{@code defaults} fill in whatever a request leaves out. {@code eventLogDir} is optional; when
 * set, each job's events are also appended to {@code <eventLogDir>/<jobId>.log}.
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public record SynthesisProperties(
    @NotNull @Valid Defaults defaults,
    @NotBlank String tempDir,
    @Positive int heartbeatSeconds,
    @Positive int eventBufferSize,
    String eventLogDir,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record Defaults(
      @NotBlank String voice,
      @Positive double speed,
      @NotBlank String lang,
      @NotNull BackendType backend,
      @NotBlank String splitPattern,
      @NotNull OutputFormat format,
      @NotBlank String bitrate,
      boolean normalize,
      @NotNull PipelineMode pipelineMode,
      @Positive int prefetchChunks,
      @Positive int pcmQueueSize) {}
}
