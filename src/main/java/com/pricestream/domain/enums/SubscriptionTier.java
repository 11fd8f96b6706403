package com.pricestream.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Subscription tier of an authenticated user. Drives the request rate limit and the
 * number of active alerts the user may hold.
 */
public enum SubscriptionTier {
    FREE,
    PRO,
    ENTERPRISE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse for tiers supplied by the gateway; unknown or blank values fall back to FREE. */
    public static SubscriptionTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}
