package com.scholary.audiobook.backend;

/** Raw backend output for one chunk: mono float samples in [-1.0, 1.0]. */
public record SynthesizedAudio(float[] samples, int sampleRate) {

  public SynthesizedAudio {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
  }
}
