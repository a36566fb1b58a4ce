package com.scholary.coach.readiness;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for waiting on server-side file processing. */
@ConfigurationProperties(prefix = "coach.readiness")
@Validated
public record ReadinessProperties(@NotNull Duration pollInterval, @NotNull Duration timeout) {}
