package com.flamingo.ai.devicerag.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async operations.
 *
 * <p>Each fan-out level has its own pool: a template field task waits on variation searches, and
 * a batch of fill items waits on generation calls, so sharing a pool between levels could starve
 * the inner tasks.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    return executor(2, 4, 100, "doc-proc-");
  }

  @Bean(name = "templateFieldExecutor")
  public Executor templateFieldExecutor() {
    return executor(4, 8, 500, "template-field-");
  }

  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    return executor(8, 16, 1000, "retrieval-");
  }

  @Bean(name = "generationExecutor")
  public Executor generationExecutor(RagConfig ragConfig) {
    int concurrent = ragConfig.getGeneration().getMaxConcurrent();
    return executor(concurrent, Math.max(concurrent, 8), 500, "generation-");
  }

  private static Executor executor(int core, int max, int queue, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(core);
    executor.setMaxPoolSize(max);
    executor.setQueueCapacity(queue);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
