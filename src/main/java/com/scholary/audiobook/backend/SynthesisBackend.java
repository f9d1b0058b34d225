package com.scholary.audiobook.backend;

/**
 * Text-to-speech capability used by the pipeline.
 *
 * <p>A backend is created per run and owned by that run's coordinator. Implementations are not
 * required to be thread-safe: the pipeline never calls {@link #generate} concurrently.
 */
public interface SynthesisBackend {

  /** The concrete backend this handle talks to. */
  BackendType type();

  /** Sample rate of every {@link SynthesizedAudio} this backend returns. */
  int sampleRate();

  /**
   * Prepare the backend for generation (load the model, check the server).
   *
   * @throws SynthesisBackendException if the backend is unusable
   */
  void initialize();

  /**
   * Synthesize one chunk of text.
   *
   * @param text the chunk text
   * @return mono float samples and their sample rate
   * @throws SynthesisBackendException if synthesis fails
   */
  SynthesizedAudio generate(String text);

  /** Release backend resources. Called once per run, also after failures. */
  default void cleanup() {}
}
