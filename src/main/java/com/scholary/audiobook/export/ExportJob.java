package com.scholary.audiobook.export;

import com.scholary.audiobook.audio.ChapterMarker;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything the encoder needs besides the audio itself.
 *
 * @param format output container
 * @param bitrate audio bitrate such as {@code 192k}
 * @param normalize whether to apply loudness normalization
 * @param title book title, may be null
 * @param author book author, may be null
 * @param coverArt cover image for chaptered formats, may be null
 * @param chapters chapter markers, empty for streaming exports
 */
public record ExportJob(
    OutputFormat format,
    String bitrate,
    boolean normalize,
    String title,
    String author,
    Path coverArt,
    List<ChapterMarker> chapters) {

  public ExportJob {
    chapters = chapters == null ? List.of() : List.copyOf(chapters);
  }

  public ExportJob withChapters(List<ChapterMarker> markers) {
    return new ExportJob(format, bitrate, normalize, title, author, coverArt, markers);
  }
}
