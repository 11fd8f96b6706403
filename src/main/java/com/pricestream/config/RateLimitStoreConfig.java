package com.pricestream.config;

import com.pricestream.ratelimit.InMemoryRateLimitStore;
import com.pricestream.ratelimit.RateLimitConfig;
import com.pricestream.ratelimit.RateLimitStore;
import com.pricestream.ratelimit.RedisRateLimitStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the rate-limit window store from {@code pricestream.rate-limit.store}:
 * {@code redis} (default) shares limits across instances, {@code memory} keeps them local.
 */
@Configuration
public class RateLimitStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "pricestream.rate-limit.store", havingValue = "redis", matchIfMissing = true)
    public RateLimitStore redisRateLimitStore(StringRedisTemplate stringRedisTemplate, RateLimitConfig rateLimitConfig) {
        log.info("Using Redis rate limit store (key prefix {})", rateLimitConfig.getKeyPrefix());
        return new RedisRateLimitStore(stringRedisTemplate, rateLimitConfig.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "pricestream.rate-limit.store", havingValue = "memory")
    public RateLimitStore inMemoryRateLimitStore(Clock clock) {
        log.info("Using in-memory rate limit store");
        return new InMemoryRateLimitStore(clock);
    }
}
