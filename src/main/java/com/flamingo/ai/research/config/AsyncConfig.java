package com.flamingo.ai.research.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for the research workflow's fan-out stages and streaming runs. */
@Configuration
public class AsyncConfig {

  /** Per-query search calls of one iteration. */
  @Bean(name = "searchExecutor")
  public Executor searchExecutor(ResearchConfig researchConfig) {
    int size = researchConfig.getConcurrency().getSearchPoolSize();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }

  /** Per-document grading calls. */
  @Bean(name = "gradingExecutor")
  public Executor gradingExecutor(ResearchConfig researchConfig) {
    int size = researchConfig.getConcurrency().getGradingPoolSize();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("grade-");
    executor.initialize();
    return executor;
  }

  /** Drives streamed research runs node by node. */
  @Bean(name = "researchStreamExecutor")
  public Executor researchStreamExecutor(ResearchConfig researchConfig) {
    ResearchConfig.Concurrency concurrency = researchConfig.getConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency.getStreamPoolSize());
    executor.setMaxPoolSize(concurrency.getStreamMaxPoolSize());
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("research-");
    executor.initialize();
    return executor;
  }
}
