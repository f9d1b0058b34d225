package com.scholary.audiobook.backend;

/**
 * Exception thrown when a synthesis backend fails to initialize or to generate audio.
 *
 * <p>Backend failures end the run. They are never retried automatically: a model that failed on a
 * chunk usually fails again, and each attempt can hold the accelerator for minutes.
 */
public class SynthesisBackendException extends RuntimeException {

  public SynthesisBackendException(String message) {
    super(message);
  }

  public SynthesisBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
