package com.pricestream.alert;

import com.pricestream.domain.enums.SubscriptionTier;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for price alerts under the {@code pricestream.alerts} prefix.
 *
 * <p>Caps bound the number of pending alerts a user may hold per tier.
 * {@code evaluationThreads} sizes the executor that evaluates symbols in parallel.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pricestream.alerts")
public class AlertConfig {

    private int freeMaxAlerts = 5;
    private int proMaxAlerts = 50;
    private int enterpriseMaxAlerts = 500;
    private int evaluationThreads = 4;

    public int maxAlertsFor(SubscriptionTier tier) {
        if (tier == null) {
            return freeMaxAlerts;
        }
        return switch (tier) {
            case FREE -> freeMaxAlerts;
            case PRO -> proMaxAlerts;
            case ENTERPRISE -> enterpriseMaxAlerts;
        };
    }
}
