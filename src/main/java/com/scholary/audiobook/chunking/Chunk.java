package com.scholary.audiobook.chunking;

/**
 * A bounded unit of text submitted to the synthesis backend as one call.
 *
 * <p>The index is the single source of truth for the order of the final audio.
 */
public record Chunk(int index, String text, int chapterIndex) {

  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index cannot be negative");
    }
    if (text == null || text.isEmpty()) {
      throw new IllegalArgumentException("Chunk text cannot be empty");
    }
  }
}
