package com.pricestream.ratelimit;

import com.pricestream.domain.enums.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for request rate limiting under the {@code pricestream.rate-limit} prefix.
 *
 * <p>Standard limits apply to every inbound client request. Strict limits guard expensive
 * operations (alert creation, manual refresh) with {@code limit / strictDivisor} requests,
 * rounded up, in a separate key namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pricestream.rate-limit")
public class RateLimitConfig {

    /** {@code redis} or {@code memory}. */
    private String store = "redis";

    private String keyPrefix = "pricestream:ratelimit:";
    private int anonymousRequests = 100;
    private long anonymousWindowMs = 60000;
    private int strictDivisor = 10;
    private long strictWindowMs = 60000;

    private TierLimit free = new TierLimit(100, 60000);
    private TierLimit pro = new TierLimit(1000, 60000);
    private TierLimit enterprise = new TierLimit(10000, 60000);

    public TierLimit limitFor(SubscriptionTier tier) {
        if (tier == null) {
            return free;
        }
        return switch (tier) {
            case FREE -> free;
            case PRO -> pro;
            case ENTERPRISE -> enterprise;
        };
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierLimit {
        private int requests;
        private long windowMs;
    }
}
