package com.scholary.coach.api;

/** Liveness answer for the root path. */
public record HealthResponse(String name, String version, String status) {}
