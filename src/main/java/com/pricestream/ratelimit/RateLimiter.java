package com.pricestream.ratelimit;

import com.pricestream.domain.model.CallerIdentity;
import com.pricestream.observability.PriceStreamMetrics;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Sliding-window request limiter shared by the WebSocket and HTTP adapters.
 *
 * <p>Keys are namespaced by caller kind: {@code user:<id>} for authenticated callers,
 * {@code ip:<address>} for anonymous ones, and {@code strict:} in front of either for
 * strict checks. A rejected call is never recorded, so a caller hammering a full window
 * regains capacity as soon as old entries expire.
 *
 * <p>The limiter fails open: when the store is unreachable the request is allowed and the
 * incident is logged and counted. Availability of the stream matters more than exact
 * limits during a store outage.
 */
@Service
@EnableConfigurationProperties(RateLimitConfig.class)
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final String STRICT_PREFIX = "strict:";

    private final RateLimitStore store;
    private final RateLimitConfig config;
    private final Clock clock;
    private final PriceStreamMetrics metrics;

    public RateLimiter(RateLimitStore store, RateLimitConfig config, Clock clock, PriceStreamMetrics metrics) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    public RateLimitResult check(String identifier, int limit, long windowMs) {
        long now = clock.millis();
        RateLimitStore.WindowState state;
        try {
            state = store.acquire(identifier, limit, windowMs, now);
        } catch (RuntimeException e) {
            log.warn("Rate limit store unavailable, allowing request for {}: {}", identifier, e.getMessage());
            metrics.rateLimitFailOpen();
            return new RateLimitResult(true, limit, limit, now + windowMs, windowMs);
        }

        long resetAt = state.oldestTimestamp() + windowMs;
        if (!state.admitted()) {
            log.debug("Rate limit exceeded for {} ({} requests per {}ms)", identifier, limit, windowMs);
            metrics.rateLimitRejected();
            return new RateLimitResult(false, limit, 0, resetAt, windowMs);
        }
        return new RateLimitResult(true, limit, Math.max(0, limit - state.count()), resetAt, windowMs);
    }

    public RateLimitResult checkStandard(CallerIdentity identity) {
        return check(keyFor(identity), standardLimit(identity), standardWindowMs(identity));
    }

    public RateLimitResult checkStrict(CallerIdentity identity) {
        int divisor = Math.max(1, config.getStrictDivisor());
        int strictLimit = Math.max(1, (standardLimit(identity) + divisor - 1) / divisor);
        return check(STRICT_PREFIX + keyFor(identity), strictLimit, config.getStrictWindowMs());
    }

    private String keyFor(CallerIdentity identity) {
        return identity.isAuthenticated() ? "user:" + identity.userId() : "ip:" + identity.remoteAddress();
    }

    private int standardLimit(CallerIdentity identity) {
        return identity.isAuthenticated()
                ? config.limitFor(identity.tier()).getRequests()
                : config.getAnonymousRequests();
    }

    private long standardWindowMs(CallerIdentity identity) {
        return identity.isAuthenticated()
                ? config.limitFor(identity.tier()).getWindowMs()
                : config.getAnonymousWindowMs();
    }
}
