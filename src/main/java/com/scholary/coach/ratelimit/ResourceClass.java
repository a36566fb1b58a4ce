package com.scholary.coach.ratelimit;

/**
 * Expensive resources with independent hourly quotas.
 *
 * <p>Exhausting one quota never blocks the other.
 */
public enum ResourceClass {
  TEXT_ANALYSIS("text"),
  MEDIA_ANALYSIS("video");

  private final String keySegment;

  ResourceClass(String keySegment) {
    this.keySegment = keySegment;
  }

  public String keySegment() {
    return keySegment;
  }
}
