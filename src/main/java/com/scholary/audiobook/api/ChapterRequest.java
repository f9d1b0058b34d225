package com.scholary.audiobook.api;

import com.scholary.audiobook.chunking.Chapter;
import jakarta.validation.constraints.NotNull;

/** One chapter of the book. The title is optional. */
public record ChapterRequest(String title, @NotNull String text) {

  public Chapter toChapter() {
    return new Chapter(title, text);
  }
}
