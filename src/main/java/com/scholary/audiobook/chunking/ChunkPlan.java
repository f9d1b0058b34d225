package com.scholary.audiobook.chunking;

import java.util.List;

/**
 * Result of planning: the ordered chunk list plus where each non-empty chapter starts.
 */
public record ChunkPlan(List<Chunk> chunks, List<ChapterBoundary> boundaries) {

  public ChunkPlan {
    chunks = List.copyOf(chunks);
    boundaries = List.copyOf(boundaries);
  }

  public int totalChunks() {
    return chunks.size();
  }

  public int totalChars() {
    return chunks.stream().mapToInt(c -> c.text().length()).sum();
  }

  /** Chunk indices where chapters start, in chapter order. */
  public List<Integer> chapterStartIndices() {
    return boundaries.stream().map(ChapterBoundary::firstChunkIndex).toList();
  }
}
