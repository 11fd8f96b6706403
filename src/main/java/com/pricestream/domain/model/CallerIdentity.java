package com.pricestream.domain.model;

import com.pricestream.domain.enums.SubscriptionTier;

/**
 * Caller identity as resolved by the transport or HTTP adapter. The core never
 * authenticates; it only consumes the user id and tier it is handed.
 *
 * @param userId authenticated user id, or null for anonymous callers
 * @param tier subscription tier; FREE for anonymous callers
 * @param remoteAddress network address used to key anonymous rate limits
 */
public record CallerIdentity(String userId, SubscriptionTier tier, String remoteAddress) {

    /** Request/session attribute under which adapters store the resolved identity. */
    public static final String ATTRIBUTE = "pricestream.callerIdentity";

    public CallerIdentity {
        if (userId != null && userId.isBlank()) {
            userId = null;
        }
        if (tier == null) {
            tier = SubscriptionTier.FREE;
        }
        if (remoteAddress == null || remoteAddress.isBlank()) {
            remoteAddress = "unknown";
        }
    }

    public static CallerIdentity anonymous(String remoteAddress) {
        return new CallerIdentity(null, SubscriptionTier.FREE, remoteAddress);
    }

    public static CallerIdentity resolve(String userId, String tier, String remoteAddress) {
        if (userId == null || userId.isBlank()) {
            return anonymous(remoteAddress);
        }
        return new CallerIdentity(userId.trim(), SubscriptionTier.fromValue(tier), remoteAddress);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }
}
