package com.scholary.skynet.upload.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for upload jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted by size and age.
 */
@Repository
public class UploadJobRepository {

  private final Cache<String, UploadJob> cache;

  public UploadJobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(UploadJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<UploadJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /** Finds a job that has not yet reached a terminal status. */
  public Optional<UploadJob> findActive(String jobId) {
    return findById(jobId).filter(job -> !job.getStatus().isTerminal());
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
