package com.scholary.audiobook.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;

/** Kokoro on PyTorch (CUDA, MPS or CPU). */
public class PyTorchSynthesisBackend extends HttpSynthesisBackend {

  public PyTorchSynthesisBackend(
      BackendProperties properties,
      VoiceSettings voiceSettings,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      BackendHealthCheck healthCheck) {
    super(
        properties.pytorch(),
        voiceSettings,
        httpClient,
        objectMapper,
        healthCheck,
        Duration.ofSeconds(properties.probeTimeoutSeconds()));
  }

  @Override
  public BackendType type() {
    return BackendType.PYTORCH;
  }
}
