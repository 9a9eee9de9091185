package com.flamingo.ai.personachat.config;

import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors and the clock shared by the pipeline. */
@Configuration
public class AsyncConfig {

  /** Runs the concurrent embed-and-upsert calls of one embedding batch. */
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(PipelineConfig pipelineConfig) {
    int batchSize = pipelineConfig.getEmbedding().getBatchSize();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(batchSize);
    executor.setMaxPoolSize(batchSize * 2);
    executor.setQueueCapacity(pipelineConfig.getEmbedding().getPageSize());
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
