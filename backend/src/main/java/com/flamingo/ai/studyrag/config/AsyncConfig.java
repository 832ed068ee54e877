package com.flamingo.ai.studyrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for ingestion and query work. */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "queryExecutor")
  public ThreadPoolTaskExecutor queryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("query-");
    executor.initialize();
    return executor;
  }
}
