package com.scholary.audiobook.backend;

/**
 * Deterministic backend that renders a tone instead of speech.
 *
 * <p>The length is {@code samplesPerChar} per character and the pitch is derived from the text, so
 * identical text always produces identical samples. Useful for exercising the pipeline without an
 * inference server.
 */
public class MockSynthesisBackend implements SynthesisBackend {

  private static final float AMPLITUDE = 0.3f;

  private final int sampleRate;
  private final int samplesPerChar;

  public MockSynthesisBackend(int sampleRate, int samplesPerChar) {
    this.sampleRate = sampleRate;
    this.samplesPerChar = samplesPerChar;
  }

  @Override
  public BackendType type() {
    return BackendType.MOCK;
  }

  @Override
  public int sampleRate() {
    return sampleRate;
  }

  @Override
  public void initialize() {}

  @Override
  public SynthesizedAudio generate(String text) {
    if (text == null || text.isEmpty()) {
      throw new SynthesisBackendException("Cannot synthesize empty text");
    }
    double frequency = 220.0 + Math.floorMod(text.hashCode(), 220);
    float[] samples = new float[text.length() * samplesPerChar];
    for (int i = 0; i < samples.length; i++) {
      samples[i] = (float) (AMPLITUDE * StrictMath.sin(2 * Math.PI * frequency * i / sampleRate));
    }
    return new SynthesizedAudio(samples, sampleRate);
  }
}
