package com.scholary.audiobook.api;

import com.scholary.audiobook.backend.BackendType;
import com.scholary.audiobook.chunking.Chapter;
import com.scholary.audiobook.events.EventFormat;
import com.scholary.audiobook.export.OutputFormat;
import com.scholary.audiobook.pipeline.PipelineMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request to synthesize an audiobook.
 *
 * <p>Only {@code chapters} and {@code outputPath} are required; everything else falls back to the
 * {@code synthesis.defaults} configuration. {@code resume} implies {@code checkpoint}. With {@code
 * probeOnly} the job only reports whether a checkpoint exists for the output.
 */
public record SynthesisRequest(
    @NotEmpty @Valid List<ChapterRequest> chapters,
    @NotBlank String outputPath,
    String voice,
    @Positive Double speed,
    String lang,
    BackendType backend,
    @Positive Integer chunkChars,
    String splitPattern,
    OutputFormat format,
    @Pattern(regexp = "128k|192k|320k", message = "bitrate must be 128k, 192k or 320k")
        String bitrate,
    Boolean normalize,
    boolean checkpoint,
    boolean resume,
    boolean probeOnly,
    PipelineMode pipelineMode,
    @Min(1) Integer prefetchChunks,
    @Min(1) Integer pcmQueueSize,
    String title,
    String author,
    String coverPath,
    EventFormat eventFormat,
    String sourceHash) {

  public List<Chapter> toChapters() {
    return chapters.stream().map(ChapterRequest::toChapter).toList();
  }
}
