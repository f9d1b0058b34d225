package com.scholary.audiobook.pipeline;

import com.scholary.audiobook.audio.AudioAssembler;
import com.scholary.audiobook.audio.ChapterMarker;
import com.scholary.audiobook.audio.PcmConverter;
import com.scholary.audiobook.audio.PcmSink;
import com.scholary.audiobook.audio.SpoolFileSink;
import com.scholary.audiobook.backend.SynthesisBackend;
import com.scholary.audiobook.backend.SynthesisBackendException;
import com.scholary.audiobook.backend.SynthesizedAudio;
import com.scholary.audiobook.checkpoint.CheckpointConfig;
import com.scholary.audiobook.checkpoint.CheckpointException;
import com.scholary.audiobook.checkpoint.CheckpointState;
import com.scholary.audiobook.checkpoint.CheckpointStore;
import com.scholary.audiobook.checkpoint.LoadResult;
import com.scholary.audiobook.checkpoint.SourceHasher;
import com.scholary.audiobook.chunking.Chapter;
import com.scholary.audiobook.chunking.Chunk;
import com.scholary.audiobook.chunking.ChunkPlan;
import com.scholary.audiobook.chunking.ChunkPlanner;
import com.scholary.audiobook.chunking.PlanningException;
import com.scholary.audiobook.events.CheckpointCode;
import com.scholary.audiobook.events.EventEmitter;
import com.scholary.audiobook.events.Heartbeat;
import com.scholary.audiobook.events.Phase;
import com.scholary.audiobook.events.WorkerState;
import com.scholary.audiobook.export.AudioExporter;
import com.scholary.audiobook.export.ExportException;
import com.scholary.audiobook.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one run: plan, reuse or synthesize each chunk, assemble and export.
 *
 * <p>The backend handle, checkpoint store, exporter and emitter all belong to this run. {@link
 * #run} reports planning, backend, checkpoint and export failures as a {@link RunResult} rather
 * than throwing, and every failure leaves the checkpoint directory untouched so the next run can
 * resume from it.
 *
 * <p>Overlapped mode only runs for streamable formats with checkpointing off. Any other request
 * for it is downgraded to sequential with a warning.
 */
public class SynthesisCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisCoordinator.class);

  private final SynthesisBackend backend;
  private final CheckpointStore checkpointStore;
  private final AudioExporter exporter;
  private final EventEmitter events;
  private final ChunkPlanner planner;
  private final RunOptions options;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private int reusedChunks;
  private int synthesizedChunks;

  public SynthesisCoordinator(
      SynthesisBackend backend,
      CheckpointStore checkpointStore,
      AudioExporter exporter,
      EventEmitter events,
      ChunkPlanner planner,
      RunOptions options) {
    this.backend = backend;
    this.checkpointStore = checkpointStore;
    this.exporter = exporter;
    this.events = events;
    this.planner = planner;
    this.options = options;
  }

  /**
   * Run the pipeline for the given chapters.
   *
   * @param chapters chapters in reading order
   * @return the outcome; never throws for planning, backend, checkpoint or export failures
   */
  public RunResult run(List<Chapter> chapters) {
    try {
      return execute(chapters);
    } catch (PlanningException e) {
      return fail(FailureKind.PLANNING, e.getMessage());
    } catch (SynthesisBackendException e) {
      return fail(FailureKind.BACKEND, e.getMessage());
    } catch (CheckpointException e) {
      return fail(FailureKind.CHECKPOINT, e.getMessage());
    } catch (ExportException e) {
      return fail(FailureKind.EXPORT, e.getMessage());
    } catch (IOException e) {
      return fail(FailureKind.EXPORT, "Failed to write audio: " + e.getMessage());
    } finally {
      backend.cleanup();
    }
  }

  /** Pick the scheduling mode; overlapped mode needs a streaming export without checkpoints. */
  PipelineMode decideMode() {
    PipelineMode requested = options.pipelineMode();
    if (requested == PipelineMode.OVERLAP3
        && (!options.format().streamable() || options.checkpointEnabled())) {
      String message =
          "Overlapped pipeline is supported only for MP3 without checkpointing; "
              + "falling back to sequential.";
      LOGGER.warn(message);
      events.warn(message);
      return PipelineMode.SEQUENTIAL;
    }
    return requested;
  }

  private RunResult execute(List<Chapter> chapters) throws IOException {
    Path cover = options.coverPath();
    if (options.format().chaptered() && cover != null && !Files.isRegularFile(cover)) {
      throw new ExportException("Cover art file not found: " + cover);
    }
    PipelineMode mode = decideMode();
    events.metadata("backend_resolved", backend.type().wireName());
    events.metadata("pipeline_mode", mode.wireName());
    if (options.title() != null) {
      events.metadata("title", options.title());
    }
    if (options.author() != null) {
      events.metadata("author", options.author());
    }

    events.phase(Phase.PARSING);
    ChunkPlan plan = planner.plan(chapters, options.chunkChars(), options.splitPattern());
    int total = plan.totalChunks();
    events.metadata("total_chars", plan.totalChars());
    events.metadata("chapter_count", plan.boundaries().size());
    structuredLogger.logRunPlanned(
        total, plan.boundaries().size(), options.chunkChars(), mode.wireName());

    Path outputDir = options.outputPath().toAbsolutePath().getParent();
    if (outputDir != null) {
      Files.createDirectories(outputDir);
    }
    Set<Integer> completed = prepareCheckpoint(chapters, plan);

    backend.initialize();
    int sampleRate = backend.sampleRate();
    boolean streaming = options.format().streamable() && !options.checkpointEnabled();

    PcmSink sink =
        streaming
            ? exporter.openStream(options.exportJob(), options.outputPath(), sampleRate)
            : new SpoolFileSink(options.tempDir());
    AudioAssembler assembler = new AudioAssembler(sink, plan.boundaries());

    try {
      events.phase(Phase.INFERENCE);
      try (Heartbeat heartbeat = Heartbeat.start(events, options.heartbeatInterval())) {
        if (mode == PipelineMode.OVERLAP3) {
          runOverlapped(plan, assembler);
        } else {
          runSequential(plan, assembler, completed);
        }
      }

      events.phase(Phase.CONCATENATING);
      List<ChapterMarker> markers = assembler.chapterMarkers();

      events.phase(Phase.EXPORTING);
      if (streaming) {
        sink.close();
      } else {
        SpoolFileSink spool = (SpoolFileSink) sink;
        try {
          spool.close();
          exporter.exportSpooled(
              spool.path(),
              options.exportJob().withChapters(markers),
              options.outputPath(),
              sampleRate);
        } finally {
          spool.delete();
        }
      }
    } catch (RuntimeException | IOException e) {
      abort(sink);
      throw e;
    }

    if (options.checkpointEnabled()) {
      checkpointStore.cleanup();
      events.checkpoint(CheckpointCode.CLEANED);
    }

    events.phase(Phase.DONE);
    events.done(options.outputPath().toString(), total);
    LOGGER.info(
        "Run finished: output={}, chunks={}, reused={}, synthesized={}",
        options.outputPath(),
        total,
        reusedChunks,
        synthesizedChunks);
    return RunResult.succeeded(
        options.outputPath(),
        mode,
        total,
        reusedChunks,
        synthesizedChunks,
        assembler.totalSamples());
  }

  /**
   * Validate or create checkpoint state.
   *
   * @return indices that can be reused, empty for a fresh run
   */
  private Set<Integer> prepareCheckpoint(List<Chapter> chapters, ChunkPlan plan) {
    if (!options.checkpointEnabled()) {
      return Set.of();
    }
    String sourceHash =
        options.sourceHash() != null ? options.sourceHash() : SourceHasher.hash(chapters);
    CheckpointConfig config = options.checkpointConfig(backend.type());

    if (options.resume()) {
      LoadResult result = checkpointStore.load(sourceHash, config, plan.totalChunks());
      if (result.isValid()) {
        events.checkpoint(CheckpointCode.RESUMING, result.completedChunks().size());
        return new TreeSet<>(result.completedChunks());
      }
      if (result.status().isInvalid()) {
        events.checkpoint(CheckpointCode.INVALID, result.status().detail());
      }
    }

    if (checkpointStore.exists()) {
      checkpointStore.discard();
    }
    checkpointStore.create(
        CheckpointState.fresh(sourceHash, config, plan.totalChunks(), plan.boundaries()));
    return Set.of();
  }

  private void runSequential(ChunkPlan plan, AudioAssembler assembler, Set<Integer> completed)
      throws IOException {
    int total = plan.totalChunks();
    int processed = 0;
    for (Chunk chunk : plan.chunks()) {
      int index = chunk.index();
      short[] samples = null;

      if (completed.contains(index)) {
        Optional<short[]> saved = checkpointStore.chunkAudio(index);
        if (saved.isPresent()) {
          samples = saved.get();
          reusedChunks++;
          events.worker(
              0,
              WorkerState.ENCODE,
              String.format("Reused checkpoint chunk %d/%d", index + 1, total));
          events.checkpoint(CheckpointCode.REUSED, index);
          structuredLogger.logChunkReused(index, samples.length);
        } else {
          checkpointStore.markIncomplete(index);
          events.checkpoint(CheckpointCode.MISSING_AUDIO, index);
          structuredLogger.logChunkAudioMissing(index);
        }
      }

      if (samples == null) {
        events.worker(0, WorkerState.INFER, String.format("Chunk %d/%d", index + 1, total));
        structuredLogger.logChunkStarted(index, chunk.text().length());
        long start = System.nanoTime();
        SynthesizedAudio audio = backend.generate(chunk.text());
        samples = PcmConverter.toPcm16(audio.samples());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        synthesizedChunks++;

        if (options.checkpointEnabled()) {
          checkpointStore.recordChunk(index, samples);
          events.checkpoint(CheckpointCode.SAVED, index);
        }
        events.timing(index, elapsedMillis);
        structuredLogger.logChunkFinished(index, samples.length, elapsedMillis);
      }

      assembler.append(index, samples);
      processed++;
      events.progress(processed, total);
    }
  }

  private void runOverlapped(ChunkPlan plan, AudioAssembler assembler) throws IOException {
    int total = plan.totalChunks();
    int[] processed = {0};
    OverlappedPipeline pipeline =
        new OverlappedPipeline(
            backend, plan.chunks(), options.prefetchChunks(), options.pcmQueueSize(), events);
    pipeline.run(
        (index, samples, inferMillis) -> {
          assembler.append(index, samples);
          synthesizedChunks++;
          processed[0]++;
          events.worker(0, WorkerState.ENCODE, String.format("Chunk %d/%d", index + 1, total));
          events.timing(index, inferMillis);
          structuredLogger.logChunkFinished(index, samples.length, inferMillis);
          events.progress(processed[0], total);
        });
  }

  private void abort(PcmSink sink) {
    sink.abort();
    if (sink instanceof SpoolFileSink spool) {
      spool.delete();
    }
  }

  private RunResult fail(FailureKind kind, String message) {
    structuredLogger.logRunFailed(kind.name(), message);
    events.error(message);
    return RunResult.failed(kind, message);
  }
}
