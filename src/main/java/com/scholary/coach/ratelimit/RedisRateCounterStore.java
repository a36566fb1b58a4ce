package com.scholary.coach.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed counter store.
 *
 * <p>Increment-with-ceiling runs as a Lua script so the read and the write are one atomic step on
 * the server. Every write refreshes the key's TTL.
 */
public class RedisRateCounterStore implements RateCounterStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisRateCounterStore.class);

  private static final RedisScript<Long> INCREMENT_IF_BELOW =
      new DefaultRedisScript<>(
          String.join(
              "\n",
              "local current = tonumber(redis.call('GET', KEYS[1]) or '0')",
              "if current >= tonumber(ARGV[1]) then",
              "  return -1",
              "end",
              "current = redis.call('INCR', KEYS[1])",
              "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[2]))",
              "return current"),
          Long.class);

  private static final RedisScript<Long> DECREMENT_TO_ZERO =
      new DefaultRedisScript<>(
          String.join(
              "\n",
              "local current = tonumber(redis.call('GET', KEYS[1]) or '0')",
              "if current <= 0 then",
              "  return 0",
              "end",
              "current = redis.call('DECR', KEYS[1])",
              "redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))",
              "return current"),
          Long.class);

  private final StringRedisTemplate redis;

  public RedisRateCounterStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public long get(String key) {
    String value = redis.opsForValue().get(key);
    return value == null ? 0 : Long.parseLong(value);
  }

  @Override
  public OptionalLong incrementIfBelow(String key, long ceiling, Duration ttl) {
    Long result =
        redis.execute(
            INCREMENT_IF_BELOW,
            List.of(key),
            String.valueOf(ceiling),
            String.valueOf(ttl.toSeconds()));
    if (result == null || result < 0) {
      return OptionalLong.empty();
    }
    LOGGER.debug("Counter incremented: key={}, value={}", key, result);
    return OptionalLong.of(result);
  }

  @Override
  public void decrement(String key, Duration ttl) {
    Long result = redis.execute(DECREMENT_TO_ZERO, List.of(key), String.valueOf(ttl.toSeconds()));
    LOGGER.debug("Counter decremented: key={}, value={}", key, result);
  }
}
