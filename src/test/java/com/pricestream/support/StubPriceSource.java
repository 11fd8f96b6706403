package com.pricestream.support;

import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.pricesource.PriceSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Price source double with a fixed symbol set and settable prices. */
public class StubPriceSource implements PriceSource {

    public static final Set<String> DEFAULT_SYMBOLS = Set.of("BTC", "ETH", "SOL", "DOGE");

    private final Set<String> supported;
    private final Map<String, PriceSnapshot> prices = new LinkedHashMap<>();
    private volatile RuntimeException failure;

    public StubPriceSource() {
        this(DEFAULT_SYMBOLS);
    }

    public StubPriceSource(Set<String> supported) {
        this.supported = Set.copyOf(supported);
    }

    public StubPriceSource price(String symbol, String price) {
        prices.put(symbol, snapshot(symbol, price));
        return this;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public synchronized List<PriceSnapshot> fetchAll() {
        if (failure != null) {
            throw failure;
        }
        return new ArrayList<>(prices.values());
    }

    @Override
    public synchronized Optional<PriceSnapshot> fetchOne(String symbol) {
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(prices.get(symbol));
    }

    @Override
    public Set<String> supportedSymbols() {
        return supported;
    }

    public static PriceSnapshot snapshot(String symbol, String price) {
        return PriceSnapshot.builder()
                .symbol(symbol)
                .price(new BigDecimal(price))
                .lastUpdated(Instant.parse("2026-01-15T10:00:00Z"))
                .build();
    }
}
