package com.scholary.audiobook.checkpoint;

import com.scholary.audiobook.chunking.ChapterBoundary;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Persisted run metadata for one output target.
 *
 * <p>Serialized as {@code state.json} inside the checkpoint directory. Completed chunk indices are
 * kept sorted so the file is stable across writes.
 */
public record CheckpointState(
    String sourceHash,
    CheckpointConfig config,
    int totalChunks,
    List<Integer> completedChunks,
    List<ChapterBoundary> chapterStartIndices) {

  public CheckpointState {
    completedChunks =
        completedChunks == null ? List.of() : List.copyOf(new TreeSet<>(completedChunks));
    chapterStartIndices =
        chapterStartIndices == null ? List.of() : List.copyOf(chapterStartIndices);
  }

  public static CheckpointState fresh(
      String sourceHash,
      CheckpointConfig config,
      int totalChunks,
      List<ChapterBoundary> chapterStartIndices) {
    return new CheckpointState(sourceHash, config, totalChunks, List.of(), chapterStartIndices);
  }

  public CheckpointState withCompletedChunks(Collection<Integer> completed) {
    return new CheckpointState(
        sourceHash, config, totalChunks, List.copyOf(completed), chapterStartIndices);
  }
}
