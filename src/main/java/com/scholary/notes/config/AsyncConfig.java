package com.scholary.notes.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async job execution.
 *
 * <p>Two bounded pools: {@code stageExecutor} runs the heavy stages (extraction, transcription,
 * note generation, alignment), {@code pipelineExecutor} runs the short continuations between them
 * (acquisition, persistence, billing). A full queue rejects the job's next stage and the job
 * fails.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "stageExecutor")
  public Executor stageExecutor(PipelineProperties properties) {
    return boundedExecutor(properties.workerThreads(), properties.workerQueueSize(), "stage-");
  }

  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor(PipelineProperties properties) {
    return boundedExecutor(
        properties.pipelineThreads(), properties.workerQueueSize(), "pipeline-");
  }

  private static ThreadPoolTaskExecutor boundedExecutor(
      int threads, int queueSize, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
