package com.scholary.coach.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.coach.ratelimit.RateLimitStatus;

/** Current quota usage for the caller. */
public record RateLimitStatusResponse(
    long used, long limit, long remaining, @JsonProperty("resets_in") long resetsIn) {

  public static RateLimitStatusResponse from(RateLimitStatus status) {
    return new RateLimitStatusResponse(
        status.used(), status.limit(), status.remaining(), status.resetsInSeconds());
  }
}
