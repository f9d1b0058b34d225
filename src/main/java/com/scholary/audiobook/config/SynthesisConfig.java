package com.scholary.audiobook.config;

import com.scholary.audiobook.backend.BackendProperties;
import com.scholary.audiobook.export.FfmpegProperties;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for synthesis-related beans.
 *
 * <p>Enables the property records to be loaded from application.yml and builds the HTTP client
 * shared by the inference-server backends.
 */
@Configuration
@EnableConfigurationProperties({
  SynthesisProperties.class,
  BackendProperties.class,
  FfmpegProperties.class
})
public class SynthesisConfig {

  /** Connect timeout only; synthesis requests may legitimately run for minutes. */
  @Bean
  public HttpClient synthesisHttpClient(BackendProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }
}
