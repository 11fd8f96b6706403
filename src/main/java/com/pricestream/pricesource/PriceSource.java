package com.pricestream.pricesource;

import com.pricestream.domain.model.PriceSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Upstream market data feed.
 *
 * <p>Fetch methods perform network I/O and throw
 * {@link com.pricestream.exception.PriceSourceException} when the upstream is unreachable
 * or answers with an error. Symbols missing from an otherwise successful response are
 * simply absent from the result.
 */
public interface PriceSource {

    List<PriceSnapshot> fetchAll();

    Optional<PriceSnapshot> fetchOne(String symbol);

    /** Upper-case symbols this source can price. Constant for the life of the source. */
    Set<String> supportedSymbols();
}
