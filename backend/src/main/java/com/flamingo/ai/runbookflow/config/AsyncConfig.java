package com.flamingo.ai.runbookflow.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the threads that run analysis pipelines. */
@Configuration
public class AsyncConfig {

  /** One pipeline per task. Stages within a pipeline never run concurrently. */
  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }
}
