package com.scholary.coach.ratelimit;

import com.scholary.coach.auth.AuthenticatedUser;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-user, per-hour request accounting.
 *
 * <p>A check atomically reserves one unit in the current UTC hour bucket. The reservation is
 * committed once the expensive downstream call has succeeded, or released when it fails, so a
 * failed request never consumes quota and concurrent requests cannot over-admit.
 */
@Service
public class RateAccountant {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateAccountant.class);

  static final Duration COUNTER_TTL = Duration.ofHours(1);

  private final RateCounterStore store;
  private final Clock clock;

  public RateAccountant(RateCounterStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * Check the quota and reserve one unit if there is room.
   *
   * @param user the caller
   * @param resourceClass which quota to charge
   * @param limit the hourly ceiling
   * @return an allowed decision holding a reservation, or a denied decision with retry-after
   */
  public RateDecision checkAndReserve(
      AuthenticatedUser user, ResourceClass resourceClass, int limit) {
    Instant now = clock.instant();
    String key = HourBucket.counterKey(resourceClass, user.userId(), now);

    OptionalLong reserved = store.incrementIfBelow(key, limit, COUNTER_TTL);
    if (reserved.isPresent()) {
      LOGGER.debug(
          "Quota reserved: userId={}, resource={}, count={}/{}",
          user.userId(),
          resourceClass,
          reserved.getAsLong(),
          limit);
      return RateDecision.allowed(reserved.getAsLong(), key);
    }

    long retryAfter = HourBucket.secondsUntilNextHour(now);
    LOGGER.info(
        "Quota exhausted: userId={}, resource={}, limit={}, retryAfter={}s",
        user.userId(),
        resourceClass,
        limit,
        retryAfter);
    return RateDecision.denied(store.get(key), retryAfter, key);
  }

  /** Mark a reservation as consumed. The unit already sits in the counter, so nothing is written. */
  public void commit(RateDecision decision) {
    if (decision.allowed()) {
      LOGGER.debug("Quota committed: key={}, count={}", decision.counterKey(), decision.currentCount());
    }
  }

  /** Give a reserved unit back after a failed request. */
  public void release(RateDecision decision) {
    if (!decision.allowed()) {
      return;
    }
    try {
      store.decrement(decision.counterKey(), COUNTER_TTL);
      LOGGER.debug("Quota released: key={}", decision.counterKey());
    } catch (RuntimeException e) {
      // The unit stays consumed until the bucket expires.
      LOGGER.warn("Failed to release quota: key={}", decision.counterKey(), e);
    }
  }

  /** Current usage for display; never reserves anything. */
  public RateLimitStatus status(AuthenticatedUser user, ResourceClass resourceClass, int limit) {
    Instant now = clock.instant();
    long used = store.get(HourBucket.counterKey(resourceClass, user.userId(), now));
    return new RateLimitStatus(
        used, limit, Math.max(0, limit - used), HourBucket.secondsUntilNextHour(now));
  }
}
