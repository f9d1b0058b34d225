package com.scholary.audiobook.checkpoint;

/**
 * Thrown when checkpoint state cannot be created or persisted.
 *
 * <p>A failed read is not an error (the chunk is regenerated); a failed write is, because
 * continuing would leave the state claiming progress that is not on disk.
 */
public class CheckpointException extends RuntimeException {

  public CheckpointException(String message) {
    super(message);
  }

  public CheckpointException(String message, Throwable cause) {
    super(message, cause);
  }
}
