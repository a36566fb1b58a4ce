package com.scholary.coach.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory counter store using Caffeine.
 *
 * <p>Only suitable for a single instance: counters reset on restart and are not shared between
 * replicas. Each write stores the TTL it was given and the entry expires that long after the last
 * write. The map's {@code compute} gives the per-key atomicity the interface requires.
 */
public class InMemoryRateCounterStore implements RateCounterStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRateCounterStore.class);

  private final Cache<String, Counter> counters;

  public InMemoryRateCounterStore(long maxSize) {
    this(maxSize, Ticker.systemTicker());
  }

  InMemoryRateCounterStore(long maxSize, Ticker ticker) {
    this.counters =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new WriteTtlExpiry())
            .ticker(ticker)
            .build();
    LOGGER.info("Initialized in-memory rate counters: maxSize={}", maxSize);
  }

  @Override
  public long get(String key) {
    Counter counter = counters.getIfPresent(key);
    return counter == null ? 0 : counter.count();
  }

  @Override
  public OptionalLong incrementIfBelow(String key, long ceiling, Duration ttl) {
    AtomicBoolean incremented = new AtomicBoolean(false);
    Counter counter =
        counters
            .asMap()
            .compute(
                key,
                (k, current) -> {
                  long count = current == null ? 0 : current.count();
                  if (count >= ceiling) {
                    return current;
                  }
                  incremented.set(true);
                  return new Counter(count + 1, ttl);
                });
    return incremented.get() ? OptionalLong.of(counter.count()) : OptionalLong.empty();
  }

  @Override
  public void decrement(String key, Duration ttl) {
    counters
        .asMap()
        .computeIfPresent(
            key,
            (k, current) -> current.count() <= 1 ? null : new Counter(current.count() - 1, ttl));
  }

  private record Counter(long count, Duration ttl) {}

  /** Expire each counter one stored TTL after its last write; reads do not extend it. */
  private static final class WriteTtlExpiry implements Expiry<String, Counter> {

    @Override
    public long expireAfterCreate(String key, Counter value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Counter value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Counter value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
