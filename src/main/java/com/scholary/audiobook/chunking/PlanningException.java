package com.scholary.audiobook.chunking;

/**
 * Thrown when text cannot be planned into chunks.
 *
 * <p>Covers invalid planning parameters (non-positive chunk size, bad split pattern) and the
 * no-content case. Planning is deterministic, so retrying never helps.
 */
public class PlanningException extends RuntimeException {

  public PlanningException(String message) {
    super(message);
  }

  public PlanningException(String message, Throwable cause) {
    super(message, cause);
  }
}
