package com.scholary.coach.config;

import com.scholary.coach.readiness.ReadinessProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for analysis execution.
 *
 * <p>Sets up a bounded thread pool for running analyses off the servlet thread. An analysis spends
 * most of its time blocked on the readiness poll and the generation call, so the pool size caps
 * the number of concurrent upstream conversations.
 */
@Configuration
@EnableConfigurationProperties({AnalysisProperties.class, ReadinessProperties.class})
public class AnalysisConfig {

  @Bean(name = "analysisExecutor")
  public ThreadPoolTaskExecutor analysisExecutor(AnalysisProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }
}
