package com.pricestream.scheduler;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the update cycle under the {@code pricestream.price-update} prefix.
 *
 * <p>{@code intervalMs} is read directly by the {@code @Scheduled} expression; it is bound
 * here as well so it can be reported in status responses.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pricestream.price-update")
public class PriceUpdateConfig {

    private boolean enabled = true;
    private long intervalMs = 10000;
    private long initialDelayMs = 1000;
    private long shutdownGraceMs = 10000;
}
