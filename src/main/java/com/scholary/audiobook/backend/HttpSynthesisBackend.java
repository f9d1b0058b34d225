package com.scholary.audiobook.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.audio.PcmConverter;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for backends that call a Kokoro inference server over HTTP.
 *
 * <p>The server takes {@code POST /v1/synthesize} with a JSON body and answers with raw
 * little-endian float32 mono samples. The sample rate is sent in the {@code X-Sample-Rate} header
 * and must match the configured rate, because the encoder is started before the first chunk.
 *
 * <p>Requests carry no read timeout. Only the client's connect timeout applies, because a long
 * chunk on a cold model can take minutes.
 */
public abstract class HttpSynthesisBackend implements SynthesisBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSynthesisBackend.class);

  static final String SAMPLE_RATE_HEADER = "X-Sample-Rate";

  private final BackendProperties.Server server;
  private final VoiceSettings voiceSettings;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final BackendHealthCheck healthCheck;
  private final Duration healthTimeout;

  protected HttpSynthesisBackend(
      BackendProperties.Server server,
      VoiceSettings voiceSettings,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      BackendHealthCheck healthCheck,
      Duration healthTimeout) {
    this.server = server;
    this.voiceSettings = voiceSettings;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.healthCheck = healthCheck;
    this.healthTimeout = healthTimeout;
  }

  @Override
  public int sampleRate() {
    return server.sampleRate();
  }

  @Override
  public void initialize() {
    LOGGER.info("Initializing {} backend: baseUrl={}", type().wireName(), server.baseUrl());
    if (!healthCheck.isHealthy(server.baseUrl(), healthTimeout)) {
      throw new SynthesisBackendException(
          String.format(
              "%s backend is not reachable at %s", type().wireName(), server.baseUrl()));
    }
  }

  @Override
  public SynthesizedAudio generate(String text) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(server.baseUrl() + "/v1/synthesize"))
            .header("Content-Type", "application/json")
            .header("Accept", "application/octet-stream")
            .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody(text)))
            .build();

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new SynthesisBackendException(
          type().wireName() + " synthesis request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SynthesisBackendException("Synthesis interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new SynthesisBackendException(
          String.format(
              "%s backend returned status %d: %s",
              type().wireName(),
              response.statusCode(),
              new String(response.body(), StandardCharsets.UTF_8)));
    }

    int sampleRate = parseSampleRate(response);
    if (sampleRate != server.sampleRate()) {
      throw new SynthesisBackendException(
          String.format(
              "%s backend returned %d Hz audio, expected %d Hz",
              type().wireName(), sampleRate, server.sampleRate()));
    }
    float[] samples;
    try {
      samples = PcmConverter.float32FromBytes(response.body());
    } catch (IllegalArgumentException e) {
      throw new SynthesisBackendException("Malformed audio from " + type().wireName(), e);
    }
    LOGGER.debug("Synthesized {} chars into {} samples", text.length(), samples.length);
    return new SynthesizedAudio(samples, sampleRate);
  }

  @Override
  public void cleanup() {
    LOGGER.debug("Released {} backend", type().wireName());
  }

  /** Model identifier the server should load for this backend. */
  protected String modelId() {
    return server.modelId();
  }

  private byte[] requestBody(String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", modelId());
    body.put("text", text);
    body.put("voice", voiceSettings.voice());
    body.put("speed", voiceSettings.speed());
    body.put("lang", voiceSettings.lang());
    body.put("splitPattern", voiceSettings.splitPattern());
    try {
      return objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new SynthesisBackendException("Failed to encode synthesis request", e);
    }
  }

  private int parseSampleRate(HttpResponse<byte[]> response) {
    return response
        .headers()
        .firstValue(SAMPLE_RATE_HEADER)
        .map(
            value -> {
              try {
                return Integer.parseInt(value.trim());
              } catch (NumberFormatException e) {
                throw new SynthesisBackendException("Invalid sample rate header: " + value, e);
              }
            })
        .orElse(server.sampleRate());
  }
}
