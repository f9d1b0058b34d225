package com.scholary.audiobook.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.api.SynthesisRequest;
import com.scholary.audiobook.backend.BackendResolver;
import com.scholary.audiobook.backend.BackendType;
import com.scholary.audiobook.backend.SynthesisBackend;
import com.scholary.audiobook.backend.SynthesisBackendFactory;
import com.scholary.audiobook.backend.VoiceSettings;
import com.scholary.audiobook.checkpoint.CheckpointStore;
import com.scholary.audiobook.checkpoint.FileCheckpointStore;
import com.scholary.audiobook.checkpoint.ProbeResult;
import com.scholary.audiobook.checkpoint.SourceHasher;
import com.scholary.audiobook.chunking.Chapter;
import com.scholary.audiobook.chunking.ChunkPlanner;
import com.scholary.audiobook.config.SynthesisProperties;
import com.scholary.audiobook.events.CheckpointCode;
import com.scholary.audiobook.events.EventEmitter;
import com.scholary.audiobook.export.AudioExporter;
import com.scholary.audiobook.pipeline.RunOptions;
import com.scholary.audiobook.pipeline.RunResult;
import com.scholary.audiobook.pipeline.SynthesisCoordinator;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a request into a configured run.
 *
 * <p>Fills defaults, resolves the backend, picks the chunk size for it, and wires a fresh backend
 * handle, checkpoint store and coordinator for every run.
 */
@Service
public class SynthesisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisService.class);

  private final ChunkPlanner planner;
  private final BackendResolver backendResolver;
  private final SynthesisBackendFactory backendFactory;
  private final AudioExporter exporter;
  private final ObjectMapper objectMapper;
  private final SynthesisProperties properties;

  public SynthesisService(
      ChunkPlanner planner,
      BackendResolver backendResolver,
      SynthesisBackendFactory backendFactory,
      AudioExporter exporter,
      ObjectMapper objectMapper,
      SynthesisProperties properties) {
    this.planner = planner;
    this.backendResolver = backendResolver;
    this.backendFactory = backendFactory;
    this.exporter = exporter;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Synthesize the requested book.
   *
   * @param request the validated request
   * @param events emitter for this job
   * @return the run outcome
   */
  public RunResult synthesize(SynthesisRequest request, EventEmitter events) {
    SynthesisProperties.Defaults defaults = properties.defaults();
    BackendType requested = request.backend() != null ? request.backend() : defaults.backend();
    BackendType backendType = backendResolver.resolve(requested);

    RunOptions options = toRunOptions(request, backendType);
    LOGGER.info(
        "Starting synthesis: output={}, backend={}, chunkChars={}, format={}, checkpoint={}",
        options.outputPath(),
        backendType.wireName(),
        options.chunkChars(),
        options.format().extension(),
        options.checkpointEnabled());

    SynthesisBackend backend =
        backendFactory.create(
            backendType,
            new VoiceSettings(
                options.voice(), options.speed(), options.lang(), options.splitPattern()));
    CheckpointStore store = new FileCheckpointStore(options.outputPath(), objectMapper);

    SynthesisCoordinator coordinator =
        new SynthesisCoordinator(backend, store, exporter, events, planner, options);
    return coordinator.run(request.toChapters());
  }

  /**
   * Report whether a checkpoint exists for the requested output.
   *
   * <p>Only existence and the source hash are checked; the result says so through {@link
   * ProbeResult#configVerified()}.
   */
  public ProbeResult probe(SynthesisRequest request, EventEmitter events) {
    CheckpointStore store = new FileCheckpointStore(Paths.get(request.outputPath()), objectMapper);
    ProbeResult result = store.probe(sourceHash(request, request.toChapters()));
    switch (result.status()) {
      case NONE -> events.checkpoint(CheckpointCode.NONE);
      case INVALID -> events.checkpoint(CheckpointCode.INVALID, result.detail());
      case FOUND -> events.checkpoint(CheckpointCode.FOUND, result.detail());
    }
    LOGGER.info("Checkpoint probe for {}: {}", store.directory(), result.status());
    return result;
  }

  RunOptions toRunOptions(SynthesisRequest request, BackendType backendType) {
    SynthesisProperties.Defaults defaults = properties.defaults();
    return new RunOptions(
        Paths.get(request.outputPath()).toAbsolutePath(),
        request.chunkChars() != null ? request.chunkChars() : backendType.defaultChunkChars(),
        orDefault(request.splitPattern(), defaults.splitPattern()),
        orDefault(request.voice(), defaults.voice()),
        request.speed() != null ? request.speed() : defaults.speed(),
        orDefault(request.lang(), defaults.lang()),
        request.format() != null ? request.format() : defaults.format(),
        orDefault(request.bitrate(), defaults.bitrate()),
        request.normalize() != null ? request.normalize() : defaults.normalize(),
        request.checkpoint(),
        request.resume(),
        request.pipelineMode() != null ? request.pipelineMode() : defaults.pipelineMode(),
        request.prefetchChunks() != null ? request.prefetchChunks() : defaults.prefetchChunks(),
        request.pcmQueueSize() != null ? request.pcmQueueSize() : defaults.pcmQueueSize(),
        request.title(),
        request.author(),
        request.coverPath() != null ? Paths.get(request.coverPath()) : null,
        request.sourceHash(),
        Duration.ofSeconds(properties.heartbeatSeconds()),
        Path.of(properties.tempDir()));
  }

  private static String sourceHash(SynthesisRequest request, List<Chapter> chapters) {
    return request.sourceHash() != null ? request.sourceHash() : SourceHasher.hash(chapters);
  }

  private static String orDefault(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }
}
