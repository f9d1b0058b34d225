package com.scholary.audiobook.chunking;

/**
 * One chapter of source text, in reading order.
 *
 * <p>The title is optional and only feeds chapter markers in chaptered output formats.
 */
public record Chapter(String title, String text) {

  public Chapter {
    if (title == null) {
      title = "";
    }
    if (text == null) {
      text = "";
    }
  }

  public static Chapter of(String text) {
    return new Chapter("", text);
  }
}
