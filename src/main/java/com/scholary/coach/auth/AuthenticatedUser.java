package com.scholary.coach.auth;

import java.time.Instant;

/**
 * The caller behind a verified session token.
 *
 * <p>Lives for a single request and is never persisted.
 */
public record AuthenticatedUser(String userId, String email, Instant expiresAt) {}
