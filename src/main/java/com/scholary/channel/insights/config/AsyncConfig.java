package com.scholary.channel.insights.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background job execution.
 *
 * <p>Sets up a bounded thread pool for jobs. The pool size caps how many jobs call the rate-limited
 * provider at the same time; once the queue is full new jobs fail fast instead of piling up.
 */
@Configuration
@EnableConfigurationProperties(JobProperties.class)
public class AsyncConfig {

  @Bean(name = "jobTaskExecutor")
  public ThreadPoolTaskExecutor jobTaskExecutor(JobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
