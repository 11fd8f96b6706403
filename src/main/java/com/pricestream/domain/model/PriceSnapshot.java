package com.pricestream.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time market data for one symbol as reported by the price source.
 *
 * <p>Snapshots are immutable and shared by reference between the broadcast path, the
 * alert evaluator and the latest-price book. Only {@code symbol} and {@code price} are
 * guaranteed; the 24h statistics may be null when the source omits them.
 */
@Value
@Builder
public class PriceSnapshot {

    String symbol;
    BigDecimal price;

    /** Absolute 24h change in quote currency. */
    BigDecimal change24h;

    /** 24h change in percent, e.g. -2.5 for a 2.5% drop. */
    BigDecimal changePercent24h;

    BigDecimal volume24h;
    BigDecimal marketCap;
    Instant lastUpdated;
}
