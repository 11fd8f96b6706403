package com.pricestream.pricesource;

import com.pricestream.domain.model.PriceSnapshot;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Last snapshot seen per symbol. Fed by the update scheduler after every successful fetch
 * and read by new subscribers (initial price) and alert creation (base price).
 */
@Component
public class LatestPriceBook {

    private final Map<String, PriceSnapshot> latest = new ConcurrentHashMap<>();

    public void record(Collection<PriceSnapshot> snapshots) {
        for (PriceSnapshot snapshot : snapshots) {
            record(snapshot);
        }
    }

    public void record(PriceSnapshot snapshot) {
        if (snapshot != null && snapshot.getSymbol() != null && snapshot.getPrice() != null) {
            latest.put(snapshot.getSymbol(), snapshot);
        }
    }

    public Optional<PriceSnapshot> get(String symbol) {
        return symbol == null ? Optional.empty() : Optional.ofNullable(latest.get(symbol));
    }

    public int size() {
        return latest.size();
    }
}
