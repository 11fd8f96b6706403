package com.pricestream.subscription;

import java.util.List;

/**
 * Result of a subscribe call.
 *
 * @param applied normalized symbols now subscribed as a result of this call
 * @param unsupported requested symbols outside the supported set, as normalized
 * @param subscribed the connection's full subscription set afterwards, sorted
 */
public record SubscriptionResult(List<String> applied, List<String> unsupported, List<String> subscribed) {

    public boolean hasUnsupported() {
        return !unsupported.isEmpty();
    }
}
