package com.flamingo.ai.docqa.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resilience4j time limit for answer generation; retries are built per call. */
@Configuration
public class ResilienceConfig {

  /** Bounds a whole answer generation, fallbacks and backoff included. */
  @Bean
  public TimeLimiter generationTimeLimiter(RagConfig ragConfig) {
    TimeLimiterConfig config =
        TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofSeconds(ragConfig.getGeneration().getTimeoutSeconds()))
            .cancelRunningFuture(true)
            .build();
    return TimeLimiter.of("generation", config);
  }
}
