package com.flamingo.ai.ragdocs.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools used by the indexing pipeline. */
@Configuration
public class AsyncConfig {

  /** Runs embedding batches of a sync cycle in parallel. */
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
