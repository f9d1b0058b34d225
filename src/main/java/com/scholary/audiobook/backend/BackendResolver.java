package com.scholary.audiobook.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a requested backend into a concrete one.
 *
 * <p>{@link BackendType#AUTO} prefers MLX and falls back to PyTorch when the MLX server does not
 * answer its health check. The outcome is cached for a few minutes so a burst of jobs does not
 * probe the server once per job.
 */
@Component
public class BackendResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackendResolver.class);

  private final BackendProperties properties;
  private final BackendHealthCheck healthCheck;
  private final Cache<BackendType, BackendType> resolved;

  public BackendResolver(BackendProperties properties, BackendHealthCheck healthCheck) {
    this.properties = properties;
    this.healthCheck = healthCheck;
    this.resolved =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(properties.resolutionCacheMinutes()))
            .maximumSize(1)
            .build();
  }

  public BackendType resolve(BackendType requested) {
    if (requested != BackendType.AUTO) {
      return requested;
    }
    return resolved.get(BackendType.AUTO, key -> probe());
  }

  private BackendType probe() {
    boolean mlxUp =
        healthCheck.isHealthy(
            properties.mlx().baseUrl(), Duration.ofSeconds(properties.probeTimeoutSeconds()));
    BackendType choice = mlxUp ? BackendType.MLX : BackendType.PYTORCH;
    LOGGER.info("Auto-selected {} backend", choice.wireName());
    return choice;
  }
}
