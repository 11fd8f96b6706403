package com.pricestream.scheduler;

import java.time.Instant;

/**
 * Summary of one update cycle.
 *
 * @param symbolsUpdated snapshots received from the price source
 * @param pricesDelivered price_update messages delivered across all connections
 * @param alertsTriggered alerts that transitioned to triggered
 * @param fetchFailed whether the price fetch failed, making this an empty cycle
 */
public record UpdateCycleStats(
        Instant startedAt,
        long durationMs,
        int symbolsUpdated,
        int pricesDelivered,
        int alertsTriggered,
        boolean fetchFailed) {}
