package com.scholary.audiobook.events;

/** What a pipeline worker is doing, reported in {@code WORKER:} events. */
public enum WorkerState {
  INFER,
  ENCODE
}
