package com.scholary.coach.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for analysis requests.
 *
 * <p>Controls the worker pool that runs analyses, the overall request deadline and the request
 * size limit.
 */
@ConfigurationProperties(prefix = "coach.analysis")
@Validated
public record AnalysisProperties(
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    @NotNull Duration requestTimeout,
    @Positive int maxTechniques) {}
