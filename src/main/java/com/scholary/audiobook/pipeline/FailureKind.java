package com.scholary.audiobook.pipeline;

/** Why a run ended without output. */
public enum FailureKind {
  PLANNING,
  BACKEND,
  EXPORT,
  CHECKPOINT
}
