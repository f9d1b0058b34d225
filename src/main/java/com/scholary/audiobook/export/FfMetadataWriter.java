package com.scholary.audiobook.export;

import com.scholary.audiobook.audio.ChapterMarker;

/**
 * Renders ffmpeg's FFMETADATA1 format with one {@code [CHAPTER]} section per marker.
 *
 * <p>Special characters ({@code = ; # \} and newlines) are backslash-escaped as the format
 * requires.
 */
final class FfMetadataWriter {

  private FfMetadataWriter() {}

  static String render(ExportJob job, int sampleRate) {
    StringBuilder out = new StringBuilder(";FFMETADATA1\n");
    if (job.title() != null && !job.title().isBlank()) {
      out.append("title=").append(escape(job.title())).append('\n');
      out.append("album=").append(escape(job.title())).append('\n');
    }
    if (job.author() != null && !job.author().isBlank()) {
      out.append("artist=").append(escape(job.author())).append('\n');
    }
    out.append("genre=Audiobook\n");

    for (ChapterMarker chapter : job.chapters()) {
      out.append("\n[CHAPTER]\nTIMEBASE=1/1000\n");
      out.append("START=").append(chapter.startMillis(sampleRate)).append('\n');
      out.append("END=").append(chapter.endMillis(sampleRate)).append('\n');
      out.append("title=").append(escape(chapter.title())).append('\n');
    }
    return out.toString();
  }

  static String escape(String value) {
    StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (c == '=' || c == ';' || c == '#' || c == '\\' || c == '\n') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
