package com.scholary.audiobook.events;

/** Coarse run phases, in the order a successful run passes through them. */
public enum Phase {
  PARSING,
  INFERENCE,
  CONCATENATING,
  EXPORTING,
  DONE
}
