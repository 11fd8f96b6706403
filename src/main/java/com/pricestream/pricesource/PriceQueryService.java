package com.pricestream.pricesource;

import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.PriceSourceException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-side price lookups for the REST API.
 *
 * <p>Answers from the {@link LatestPriceBook} when it has a snapshot and goes to the
 * {@link PriceSource} only for symbols the book has not seen yet. Fetched snapshots are
 * recorded in the book.
 */
@Service
public class PriceQueryService {

    private static final Logger log = LoggerFactory.getLogger(PriceQueryService.class);

    private static final int MAX_SYMBOL_LENGTH = 10;

    private final PriceSource priceSource;
    private final LatestPriceBook latestPriceBook;

    public PriceQueryService(PriceSource priceSource, LatestPriceBook latestPriceBook) {
        this.priceSource = priceSource;
        this.latestPriceBook = latestPriceBook;
    }

    public List<String> supportedSymbols() {
        return List.copyOf(new TreeSet<>(priceSource.supportedSymbols()));
    }

    public PriceSnapshot getPrice(String symbol) {
        String normalized = normalize(symbol);
        if (normalized.isEmpty() || normalized.length() > MAX_SYMBOL_LENGTH) {
            throw new BusinessException("Symbol must be 1 to " + MAX_SYMBOL_LENGTH + " characters");
        }
        if (!priceSource.supportedSymbols().contains(normalized)) {
            throw new BusinessException(
                    ErrorCode.SYMBOL_NOT_FOUND,
                    "Symbol '" + normalized + "' is not supported",
                    Map.of("supportedSymbols", supportedSymbols()));
        }

        Optional<PriceSnapshot> latest = latestPriceBook.get(normalized);
        if (latest.isPresent()) {
            return latest.get();
        }
        try {
            Optional<PriceSnapshot> fetched = priceSource.fetchOne(normalized);
            fetched.ifPresent(latestPriceBook::record);
            return fetched.orElseThrow(PriceQueryService::unavailable);
        } catch (PriceSourceException e) {
            log.warn("Price lookup for {} failed: {}", normalized, e.getMessage());
            throw unavailable();
        }
    }

    /**
     * Prices for the given comma-separated symbols, or for every supported symbol when
     * {@code symbolsParam} is blank. Symbols without a known price are left out.
     */
    public List<PriceSnapshot> getPrices(String symbolsParam) {
        Set<String> requested = parseSymbols(symbolsParam);

        List<PriceSnapshot> prices = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String symbol : requested) {
            latestPriceBook.get(symbol).ifPresentOrElse(prices::add, () -> missing.add(symbol));
        }
        if (missing.isEmpty()) {
            return prices;
        }

        try {
            latestPriceBook.record(priceSource.fetchAll());
        } catch (PriceSourceException e) {
            log.warn("Price lookup for {} failed, answering with cached prices only: {}", missing, e.getMessage());
            return prices;
        }
        prices.clear();
        for (String symbol : requested) {
            latestPriceBook.get(symbol).ifPresent(prices::add);
        }
        return prices;
    }

    // ---- Internal ----

    private Set<String> parseSymbols(String symbolsParam) {
        if (symbolsParam == null || symbolsParam.isBlank()) {
            return new TreeSet<>(priceSource.supportedSymbols());
        }
        Set<String> requested = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String raw : symbolsParam.split(",")) {
            String symbol = normalize(raw);
            if (symbol.isEmpty()) {
                continue;
            }
            if (priceSource.supportedSymbols().contains(symbol)) {
                requested.add(symbol);
            } else {
                invalid.add(symbol);
            }
        }
        if (!invalid.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.INVALID_SYMBOLS,
                    "Unsupported symbols: " + String.join(", ", invalid),
                    Map.of("invalidSymbols", invalid, "supportedSymbols", supportedSymbols()));
        }
        return requested;
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static BusinessException unavailable() {
        return new BusinessException(ErrorCode.PRICE_UNAVAILABLE, "Price data is temporarily unavailable");
    }
}
