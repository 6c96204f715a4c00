package com.scholary.skynet.upload.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools: {@code taskExecutor} runs async upload jobs and {@code uploadExecutor} runs
 * the resumable sessions. A job thread blocks until its sessions finish, so the two must not share
 * a pool.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public ThreadPoolTaskExecutor taskExecutor(
      @Value("${upload.executor.jobThreads}") int threads,
      @Value("${upload.executor.jobQueueSize}") int queueSize) {
    return pool(threads, queueSize, "upload-job-");
  }

  @Bean(name = "uploadExecutor")
  public ThreadPoolTaskExecutor uploadExecutor(
      @Value("${upload.executor.sessionThreads}") int threads,
      @Value("${upload.executor.sessionQueueSize}") int queueSize) {
    return pool(threads, queueSize, "upload-session-");
  }

  private static ThreadPoolTaskExecutor pool(int threads, int queueSize, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
