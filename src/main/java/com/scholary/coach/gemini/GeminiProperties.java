package com.scholary.coach.gemini;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini API client.
 *
 * <p>Every outbound call is bounded by {@code requestTimeout}; the readiness poll adds its own
 * overall deadline on top.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @NotBlank String mediaModel,
    @NotNull Duration connectTimeout,
    @NotNull Duration requestTimeout,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @Positive int mediaMaxOutputTokens) {}
