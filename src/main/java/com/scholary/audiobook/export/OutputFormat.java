package com.scholary.audiobook.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Container formats the exporter can produce. */
public enum OutputFormat {
  MP3("mp3", true, false),
  M4B("m4b", false, true);

  private final String extension;
  private final boolean streamable;
  private final boolean chaptered;

  OutputFormat(String extension, boolean streamable, boolean chaptered) {
    this.extension = extension;
    this.streamable = streamable;
    this.chaptered = chaptered;
  }

  @JsonValue
  public String extension() {
    return extension;
  }

  /** Whether the encoder can consume PCM while synthesis is still running. */
  public boolean streamable() {
    return streamable;
  }

  /** Whether the container carries chapter markers and cover art. */
  public boolean chaptered() {
    return chaptered;
  }

  @JsonCreator
  public static OutputFormat fromName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "mp3" -> MP3;
      case "m4b" -> M4B;
      default -> throw new IllegalArgumentException("Unsupported format: " + name);
    };
  }
}
