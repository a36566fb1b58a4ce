package com.scholary.coach.ratelimit;

/** Exception thrown when a caller has used up the hourly quota for a resource. */
public class RateLimitedException extends RuntimeException {

  private final long limit;
  private final long retryAfterSeconds;

  public RateLimitedException(String message, long limit, long retryAfterSeconds) {
    super(message);
    this.limit = limit;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long getLimit() {
    return limit;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
