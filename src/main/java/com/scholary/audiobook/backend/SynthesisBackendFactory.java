package com.scholary.audiobook.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import org.springframework.stereotype.Component;

/** Builds a fresh backend handle for one run. */
@Component
public class SynthesisBackendFactory {

  private final BackendProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final BackendHealthCheck healthCheck;

  public SynthesisBackendFactory(
      BackendProperties properties,
      HttpClient synthesisHttpClient,
      ObjectMapper objectMapper,
      BackendHealthCheck healthCheck) {
    this.properties = properties;
    this.httpClient = synthesisHttpClient;
    this.objectMapper = objectMapper;
    this.healthCheck = healthCheck;
  }

  /**
   * Create a backend of a concrete type.
   *
   * @param type resolved backend type, never {@link BackendType#AUTO}
   * @param voiceSettings voice parameters for the run
   */
  public SynthesisBackend create(BackendType type, VoiceSettings voiceSettings) {
    return switch (type) {
      case MLX -> new MlxSynthesisBackend(
          properties, voiceSettings, httpClient, objectMapper, healthCheck);
      case PYTORCH -> new PyTorchSynthesisBackend(
          properties, voiceSettings, httpClient, objectMapper, healthCheck);
      case MOCK -> new MockSynthesisBackend(
          properties.mock().sampleRate(), properties.mock().samplesPerChar());
      case AUTO -> throw new IllegalArgumentException("Resolve AUTO before creating a backend");
    };
  }
}
