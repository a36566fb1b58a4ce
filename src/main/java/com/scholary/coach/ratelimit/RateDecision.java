package com.scholary.coach.ratelimit;

/**
 * Outcome of a quota check.
 *
 * <p>An allowed decision holds one reserved unit under {@code counterKey}; the caller must either
 * commit or release it. A denied decision reserves nothing.
 */
public record RateDecision(
    boolean allowed, long currentCount, long retryAfterSeconds, String counterKey) {

  static RateDecision allowed(long currentCount, String counterKey) {
    return new RateDecision(true, currentCount, 0, counterKey);
  }

  static RateDecision denied(long currentCount, long retryAfterSeconds, String counterKey) {
    return new RateDecision(false, currentCount, retryAfterSeconds, counterKey);
  }
}
