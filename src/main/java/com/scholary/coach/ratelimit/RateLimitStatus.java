package com.scholary.coach.ratelimit;

/** Read-only view of a caller's current quota window. */
public record RateLimitStatus(long used, long limit, long remaining, long resetsInSeconds) {}
