package com.scholary.audiobook.checkpoint;

/**
 * Settings that change either the synthesized waveform or the exported file.
 *
 * <p>A checkpoint is only reusable when every field matches the current run. The backend is the
 * resolved backend name, never "auto", so a resume that resolves differently is a mismatch.
 */
public record CheckpointConfig(
    String voice,
    double speed,
    String lang,
    String backend,
    int chunkChars,
    String splitPattern,
    String format,
    String bitrate,
    boolean normalize) {}
