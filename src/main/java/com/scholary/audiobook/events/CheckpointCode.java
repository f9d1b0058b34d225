package com.scholary.audiobook.events;

/** Checkpoint lifecycle codes carried by {@code CHECKPOINT:} events. */
public enum CheckpointCode {
  /** No checkpoint exists for the output. */
  NONE,
  /** Probe found a checkpoint; detail is {@code total:completed}. */
  FOUND,
  /** Existing state cannot be reused; detail names the mismatch. */
  INVALID,
  /** Resuming; detail is the number of completed chunks. */
  RESUMING,
  REUSED,
  MISSING_AUDIO,
  SAVED,
  /** Checkpoint directory removed after a successful export. */
  CLEANED
}
