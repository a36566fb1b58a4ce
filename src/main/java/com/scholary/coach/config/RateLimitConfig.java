package com.scholary.coach.config;

import com.scholary.coach.ratelimit.InMemoryRateCounterStore;
import com.scholary.coach.ratelimit.RateCounterStore;
import com.scholary.coach.ratelimit.RateLimitProperties;
import com.scholary.coach.ratelimit.RedisRateCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Configuration for rate counters.
 *
 * <p>Picks the counter store from {@code coach.rate-limit.store}. Redis is the default because
 * counters must be shared once more than one instance serves traffic.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitConfig.class);

  @Bean
  public RateCounterStore rateCounterStore(
      RateLimitProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
    if (properties.store() == RateLimitProperties.Store.MEMORY) {
      return new InMemoryRateCounterStore(properties.memoryMaxEntries());
    }
    LOGGER.info("Using Redis rate counters");
    return new RedisRateCounterStore(redisTemplate.getObject());
  }
}
