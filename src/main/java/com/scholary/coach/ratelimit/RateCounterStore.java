package com.scholary.coach.ratelimit;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Shared counter storage for rate accounting.
 *
 * <p>This is the only state shared between requests. Implementations must make {@link
 * #incrementIfBelow} atomic so concurrent requests from the same user cannot both slip under the
 * ceiling.
 */
public interface RateCounterStore {

  /**
   * Read a counter.
   *
   * @param key the counter key
   * @return the current value, or 0 if the counter does not exist
   */
  long get(String key);

  /**
   * Atomically increment a counter unless it has reached the ceiling.
   *
   * @param key the counter key
   * @param ceiling the maximum value the counter may reach
   * @param ttl expiry applied after the write
   * @return the new value, or empty if the counter was already at the ceiling
   */
  OptionalLong incrementIfBelow(String key, long ceiling, Duration ttl);

  /**
   * Decrement a counter, never going below zero.
   *
   * @param key the counter key
   * @param ttl expiry applied after the write
   */
  void decrement(String key, Duration ttl);
}
