package com.scholary.audiobook.backend;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for synthesis backends.
 *
 * <p>The accelerated backends are Kokoro inference servers reached over HTTP. There is no read
 * timeout on synthesis requests because a long chunk can legitimately take minutes.
 */
@ConfigurationProperties(prefix = "backend")
@Validated
public record BackendProperties(
    @NotNull @Valid Server mlx,
    @NotNull @Valid Server pytorch,
    @NotNull @Valid Mock mock,
    @Positive int connectTimeoutSeconds,
    @Positive int probeTimeoutSeconds,
    @Positive int resolutionCacheMinutes) {

  public record Server(
      @NotBlank String baseUrl, @NotBlank String modelId, @Positive int sampleRate) {}

  public record Mock(@Positive int sampleRate, @Positive int samplesPerChar) {}
}
