package com.scholary.coach.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for session tokens and identity checks.
 *
 * <p>The JWT secret is used for HS256, so it must be at least 32 bytes long.
 */
@ConfigurationProperties(prefix = "coach.auth")
@Validated
public record AuthProperties(
    @NotBlank @Size(min = 32) String jwtSecret,
    @NotBlank String allowedDomain,
    String googleClientId,
    @NotBlank String googleJwkSetUri,
    @NotNull Duration accessTokenTtl,
    @NotNull Duration refreshTokenTtl) {}
