package com.scholary.audiobook.audio;

/** A chapter's position in the assembled audio, in samples. */
public record ChapterMarker(String title, long startSample, long endSample) {

  public long startMillis(int sampleRate) {
    return startSample * 1000L / sampleRate;
  }

  public long endMillis(int sampleRate) {
    return endSample * 1000L / sampleRate;
  }
}
