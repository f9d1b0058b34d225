package com.scholary.audiobook.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;

/** Kokoro running on Apple Silicon through MLX. The fast path when it is available. */
public class MlxSynthesisBackend extends HttpSynthesisBackend {

  public MlxSynthesisBackend(
      BackendProperties properties,
      VoiceSettings voiceSettings,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      BackendHealthCheck healthCheck) {
    super(
        properties.mlx(),
        voiceSettings,
        httpClient,
        objectMapper,
        healthCheck,
        Duration.ofSeconds(properties.probeTimeoutSeconds()));
  }

  @Override
  public BackendType type() {
    return BackendType.MLX;
  }
}
