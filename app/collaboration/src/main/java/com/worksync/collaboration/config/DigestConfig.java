/*
 * Where: collaboration service configuration
 * What: digest evaluator, digest worker pool and the scheduler that fires the jobs
 * Why: the per-user pool is bounded separately from the scheduler threads
 */
package com.worksync.collaboration.config;

import com.worksync.collaboration.digest.TriggerEvaluator;
import com.worksync.collaboration.digest.TriggerPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class DigestConfig {

  @Bean
  public TriggerEvaluator triggerEvaluator(DigestProperties properties) {
    return new TriggerEvaluator(TriggerPolicy.from(properties));
  }

  @Bean(name = "digestExecutor")
  public ThreadPoolTaskExecutor digestExecutor(DigestProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setThreadNamePrefix("digest-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  // @EnableWebSocket registers its own TaskScheduler; @Scheduled resolves this one by name.
  @Bean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("collaboration-scheduler-");
    return scheduler;
  }
}
