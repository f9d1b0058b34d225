package com.scholary.audiobook.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.audio.PcmConverter;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checkpoint store backed by a directory next to the output file.
 *
 * <p>Layout:
 *
 * <pre>
 * book.mp3.checkpoint/
 *   state.json            run metadata and completed indices
 *   chunk_000000.pcm      raw s16le samples, one file per completed chunk
 * </pre>
 *
 * <p>Every file is written to a temporary sibling first and then moved into place, so a crash never
 * leaves a half-written record under its final name.
 */
public class FileCheckpointStore implements CheckpointStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileCheckpointStore.class);

  static final String STATE_FILE = "state.json";

  private final Path directory;
  private final ObjectMapper objectMapper;

  private CheckpointState state;
  private final TreeSet<Integer> completed = new TreeSet<>();

  public FileCheckpointStore(Path outputPath, ObjectMapper objectMapper) {
    this.directory = CheckpointStore.directoryFor(outputPath.toAbsolutePath());
    this.objectMapper = objectMapper;
  }

  @Override
  public Path directory() {
    return directory;
  }

  @Override
  public void create(CheckpointState initial) {
    if (Files.exists(directory)) {
      throw new CheckpointException(
          "Checkpoint directory already exists: " + directory + " (resume it or delete it)");
    }
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new CheckpointException("Failed to create checkpoint directory: " + directory, e);
    }
    this.state = initial;
    completed.clear();
    completed.addAll(initial.completedChunks());
    persistState();
    LOGGER.info("Created checkpoint: dir={}, totalChunks={}", directory, initial.totalChunks());
  }

  @Override
  public LoadResult load(String sourceHash, CheckpointConfig config, int totalChunks) {
    Optional<CheckpointState> persisted = readState();
    if (persisted.isEmpty()) {
      return LoadResult.absent();
    }
    CheckpointState loaded = persisted.get();

    if (!sourceHash.equals(loaded.sourceHash())) {
      LOGGER.info("Checkpoint source hash differs, cannot resume");
      return LoadResult.invalid(LoadResult.Status.INVALID_HASH_MISMATCH, loaded);
    }
    if (!config.equals(loaded.config())) {
      LOGGER.info("Checkpoint config differs: saved={}, current={}", loaded.config(), config);
      return LoadResult.invalid(LoadResult.Status.INVALID_CONFIG_MISMATCH, loaded);
    }
    if (loaded.totalChunks() != totalChunks) {
      LOGGER.info(
          "Checkpoint chunk count differs: saved={}, current={}",
          loaded.totalChunks(),
          totalChunks);
      return LoadResult.invalid(LoadResult.Status.INVALID_CHUNK_COUNT_MISMATCH, loaded);
    }

    completed.clear();
    for (int index : loaded.completedChunks()) {
      if (index >= 0 && index < totalChunks) {
        completed.add(index);
      }
    }
    this.state = loaded.withCompletedChunks(completed);
    LOGGER.info(
        "Loaded checkpoint: dir={}, completed={}/{}", directory, completed.size(), totalChunks);
    return LoadResult.valid(state, completed);
  }

  @Override
  public ProbeResult probe(String sourceHash) {
    Optional<CheckpointState> persisted = readState();
    if (persisted.isEmpty()) {
      return ProbeResult.none();
    }
    CheckpointState loaded = persisted.get();
    if (!sourceHash.equals(loaded.sourceHash())) {
      return ProbeResult.hashMismatch();
    }
    return ProbeResult.found(loaded.totalChunks(), loaded.completedChunks().size());
  }

  @Override
  public void recordChunk(int index, short[] samples) {
    requireState();
    if (index < 0 || index >= state.totalChunks()) {
      throw new IllegalArgumentException(
          String.format("Chunk index %d outside [0, %d)", index, state.totalChunks()));
    }
    Path record = directory.resolve(CheckpointStore.chunkFileName(index));
    writeAtomically(record, PcmConverter.toBytes(samples));
    completed.add(index);
    persistState();
    LOGGER.debug("Checkpointed chunk {} ({} samples)", index, samples.length);
  }

  @Override
  public Optional<short[]> chunkAudio(int index) {
    Path file = directory.resolve(CheckpointStore.chunkFileName(index));
    try {
      return Optional.of(PcmConverter.fromBytes(Files.readAllBytes(file)));
    } catch (NoSuchFileException e) {
      LOGGER.warn("Checkpoint audio missing for chunk {}: {}", index, file);
      return Optional.empty();
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.warn("Checkpoint audio unreadable for chunk {}: {}", index, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void markIncomplete(int index) {
    requireState();
    if (completed.remove(index)) {
      persistState();
    }
  }

  @Override
  public Set<Integer> completedChunks() {
    return Set.copyOf(completed);
  }

  @Override
  public boolean exists() {
    return Files.exists(directory);
  }

  @Override
  public void cleanup() {
    if (!Files.exists(directory)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(directory)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      throw new CheckpointException("Failed to delete checkpoint directory: " + directory, e);
    }
    state = null;
    completed.clear();
    LOGGER.info("Removed checkpoint directory {}", directory);
  }

  private Optional<CheckpointState> readState() {
    Path stateFile = directory.resolve(STATE_FILE);
    if (!Files.exists(stateFile)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(stateFile.toFile(), CheckpointState.class));
    } catch (IOException e) {
      // a corrupt state file is the same as no checkpoint
      LOGGER.warn("Ignoring unreadable checkpoint state {}: {}", stateFile, e.getMessage());
      return Optional.empty();
    }
  }

  private void persistState() {
    state = state.withCompletedChunks(completed);
    try {
      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
      writeAtomically(directory.resolve(STATE_FILE), json);
    } catch (IOException e) {
      throw new CheckpointException("Failed to serialize checkpoint state", e);
    }
  }

  private void writeAtomically(Path target, byte[] bytes) {
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new CheckpointException("Failed to write checkpoint file: " + target, e);
    }
  }

  private void requireState() {
    if (state == null) {
      throw new IllegalStateException("Checkpoint not created or loaded: " + directory);
    }
  }
}
