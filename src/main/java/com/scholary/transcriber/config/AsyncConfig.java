package com.scholary.transcriber.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up the worker pool that runs transcription tasks. The scheduler never hands it more
 * tasks than it has slots, but a cancelled run may still be draining its last provider call when
 * the next task is dispatched, so the queue is left unbounded and the next task waits for the
 * thread instead of being rejected.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "transcriptionExecutor")
  public ThreadPoolTaskExecutor transcriptionExecutor(SchedulerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrency());
    executor.setMaxPoolSize(properties.maxConcurrency());
    executor.setThreadNamePrefix("transcription-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
