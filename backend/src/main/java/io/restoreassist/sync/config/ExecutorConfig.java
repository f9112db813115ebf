package io.restoreassist.sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the two independent directions of traffic. Outbound provider calls and inbound
 * webhook application never share threads, so a stalled accounting API cannot delay payment
 * events.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "providerCallExecutor")
  ThreadPoolTaskExecutor providerCallExecutor(SyncProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.worker().count());
    executor.setMaxPoolSize(properties.worker().count() * 2);
    executor.setQueueCapacity(properties.worker().count() * 25);
    executor.setThreadNamePrefix("provider-call-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean(name = "webhookExecutor")
  ThreadPoolTaskExecutor webhookExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("webhook-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
