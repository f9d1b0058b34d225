package com.scholary.audiobook.chunking;

/** Maps a chapter to the first chunk that belongs to it. */
public record ChapterBoundary(int chapterIndex, int firstChunkIndex, String title) {

  /** Title to show in chapter markers; falls back to a numbered label. */
  public String displayTitle(int ordinal) {
    return title == null || title.isBlank() ? "Chapter " + ordinal : title;
  }
}
