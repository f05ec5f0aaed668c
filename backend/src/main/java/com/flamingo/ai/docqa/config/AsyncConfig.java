package com.flamingo.ai.docqa.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-index-");
    executor.initialize();
    return executor;
  }

  /** Runs embedding batches; sized for the configured number of concurrent batches per call. */
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(RagConfig ragConfig) {
    int concurrent = Math.max(1, ragConfig.getEmbedding().getMaxConcurrentBatches());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrent * 2);
    executor.setMaxPoolSize(concurrent * 4);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  /**
   * Runs answer generation. A plain {@link ExecutorService} so that a timed-out generation can be
   * cancelled through the {@code Future} returned by {@code submit}, interrupting its retries.
   */
  @Bean(name = "generationExecutor", destroyMethod = "shutdown")
  public ExecutorService generationExecutor() {
    return new ThreadPoolExecutor(
        4,
        16,
        60L,
        TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(50),
        new CustomizableThreadFactory("generate-"),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
