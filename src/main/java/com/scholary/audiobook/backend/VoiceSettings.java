package com.scholary.audiobook.backend;

/** Per-run voice parameters handed to a backend when it is created. */
public record VoiceSettings(String voice, double speed, String lang, String splitPattern) {}
