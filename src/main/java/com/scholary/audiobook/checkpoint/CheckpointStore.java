package com.scholary.audiobook.checkpoint;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Persists per-chunk synthesized audio and run metadata so an interrupted run can resume.
 *
 * <p>One store instance serves one output target. The lifecycle of its directory is:
 *
 * <pre>
 * Absent -> Created -> Accumulating (crash, resume, repeat) -> Completed (deleted)
 * </pre>
 *
 * <p>At most one coordinator writes a given directory at a time. Callers are expected to prevent
 * concurrent runs against the same output; the store does not lock.
 */
public interface CheckpointStore {

  /** The checkpoint directory for this output target. */
  Path directory();

  /**
   * Initialize fresh on-disk state.
   *
   * @param state the initial state, usually with no completed chunks
   * @throws CheckpointException if the directory already exists or cannot be written
   */
  void create(CheckpointState state);

  /**
   * Read and fully validate persisted state against the current run.
   *
   * <p>Checks existence, then source hash, then every config field, then chunk count. A valid
   * result also makes this store the owner of the loaded state for subsequent writes.
   *
   * @param sourceHash fingerprint of the current source text
   * @param config the current run's checkpoint-relevant settings
   * @param totalChunks the number of chunks the current run planned
   * @return the validation outcome
   */
  LoadResult load(String sourceHash, CheckpointConfig config, int totalChunks);

  /**
   * Cheap pre-run check: existence and source hash only.
   *
   * @param sourceHash fingerprint of the current source text
   * @return the probe outcome; never verifies configuration
   */
  ProbeResult probe(String sourceHash);

  /**
   * Persist one chunk's audio, then mark it complete.
   *
   * <p>The binary record is written before the state, so a crash between the two leaves the state
   * behind the audio and never ahead of it.
   *
   * @param index the chunk index
   * @param samples PCM16 samples for the chunk
   * @throws CheckpointException if either write fails
   */
  void recordChunk(int index, short[] samples);

  /**
   * Read a completed chunk's audio.
   *
   * @param index the chunk index
   * @return the samples, or empty if the record is missing or unreadable
   */
  Optional<short[]> chunkAudio(int index);

  /**
   * Drop an index from the completed set, used when its audio record turned out to be missing.
   *
   * @param index the chunk index
   */
  void markIncomplete(int index);

  /** Indices currently marked complete. */
  Set<Integer> completedChunks();

  /** Whether any state exists on disk. */
  boolean exists();

  /** Delete all on-disk state after a fully successful run. */
  void cleanup();

  /** Delete stale state that failed validation so a fresh run can be created. */
  default void discard() {
    cleanup();
  }

  /**
   * Directory that holds checkpoint state for an output file.
   *
   * @param outputPath the final audio file
   * @return {@code <outputPath>.checkpoint}
   */
  static Path directoryFor(Path outputPath) {
    return outputPath.resolveSibling(outputPath.getFileName() + ".checkpoint");
  }

  /** File name of a chunk's binary record, zero-padded so directory listings sort. */
  static String chunkFileName(int index) {
    return String.format("chunk_%06d.pcm", index);
  }
}
