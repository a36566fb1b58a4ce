package com.scholary.coach.ratelimit;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for per-user hourly quotas.
 *
 * <p>{@code store} selects where counters live: {@code redis} for shared deployments, {@code
 * memory} for a single instance.
 */
@ConfigurationProperties(prefix = "coach.rate-limit")
@Validated
public record RateLimitProperties(
    @NotNull Store store,
    @Positive int textPerHour,
    @Positive int mediaPerHour,
    @Positive long memoryMaxEntries) {

  public enum Store {
    REDIS,
    MEMORY
  }

  public int limitFor(ResourceClass resourceClass) {
    return resourceClass == ResourceClass.MEDIA_ANALYSIS ? mediaPerHour : textPerHour;
  }
}
