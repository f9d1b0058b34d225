package com.scholary.audiobook.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for synthesis jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted after a while and memory stays bounded.
 * Jobs are lost on restart; the checkpoint directory is what survives a crash, not the job.
 */
@Repository
public class JobRepository {

  private final Cache<String, SynthesisJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(SynthesisJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<SynthesisJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public SynthesisJob getById(String jobId) {
    return findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
