package com.scholary.audiobook.backend;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Checks the {@code /health} endpoint of an inference server. */
@Component
public class BackendHealthCheck {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendHealthCheck.class);

  private final HttpClient httpClient;

  public BackendHealthCheck(HttpClient synthesisHttpClient) {
    this.httpClient = synthesisHttpClient;
  }

  /**
   * Whether the server answers its health endpoint with 200 within the timeout.
   *
   * @param baseUrl server base URL
   * @param timeout how long to wait for the answer
   */
  public boolean isHealthy(String baseUrl, Duration timeout) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/health"))
            .timeout(timeout)
            .GET()
            .build();
    try {
      HttpResponse<Void> response =
          httpClient.send(request, HttpResponse.BodyHandlers.discarding());
      return response.statusCode() == 200;
    } catch (IOException e) {
      LOGGER.debug("Health check failed for {}: {}", baseUrl, e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
