package com.pricestream.pricesource;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.exception.PriceSourceException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link PriceSource} backed by the CoinGecko {@code /simple/price} endpoint.
 *
 * <p>All supported coins are fetched with one request. Coins missing from the response,
 * or without a price, are left out of the result rather than failing the batch. Transport
 * and HTTP errors surface as {@link PriceSourceException}; there is no retry here, the
 * scheduler simply tries again on its next tick.
 */
@Component
@EnableConfigurationProperties(PriceSourceConfig.class)
public class CoinGeckoPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoPriceSource.class);

    private static final String API_KEY_HEADER = "x-cg-demo-api-key";
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final RestTemplate restTemplate;
    private final PriceSourceConfig config;
    private final Clock clock;

    /** Upper-case symbol to coin id, in configuration order. */
    private final Map<String, String> coinIdsBySymbol;

    @Autowired
    public CoinGeckoPriceSource(RestTemplateBuilder restTemplateBuilder, PriceSourceConfig config, Clock clock) {
        this(
                restTemplateBuilder
                        .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                        .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                        .build(),
                config,
                clock);
    }

    public CoinGeckoPriceSource(RestTemplate restTemplate, PriceSourceConfig config, Clock clock) {
        this.restTemplate = restTemplate;
        this.config = config;
        this.clock = clock;
        Map<String, String> coinIds = new LinkedHashMap<>();
        config.getSymbols().forEach((symbol, coinId) -> coinIds.put(symbol.trim().toUpperCase(Locale.ROOT), coinId));
        this.coinIdsBySymbol = Collections.unmodifiableMap(coinIds);
        log.info("CoinGecko price source configured for {} symbols", coinIdsBySymbol.size());
    }

    @Override
    public List<PriceSnapshot> fetchAll() {
        return fetch(coinIdsBySymbol.keySet());
    }

    @Override
    public Optional<PriceSnapshot> fetchOne(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (!coinIdsBySymbol.containsKey(normalized)) {
            return Optional.empty();
        }
        return fetch(List.of(normalized)).stream().findFirst();
    }

    @Override
    public Set<String> supportedSymbols() {
        return coinIdsBySymbol.keySet();
    }

    // ---- Internal ----

    private List<PriceSnapshot> fetch(Collection<String> symbols) {
        if (symbols.isEmpty()) {
            return List.of();
        }
        List<String> coinIds = symbols.stream().map(coinIdsBySymbol::get).toList();
        String url = UriComponentsBuilder.fromUriString(config.getBaseUrl())
                .path("/simple/price")
                .queryParam("ids", String.join(",", coinIds))
                .queryParam("vs_currencies", config.getVsCurrency())
                .queryParam("include_24hr_change", "true")
                .queryParam("include_24hr_vol", "true")
                .queryParam("include_market_cap", "true")
                .queryParam("include_last_updated_at", "true")
                .build()
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.set(API_KEY_HEADER, config.getApiKey());
        }

        JsonNode body;
        try {
            body = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            throw new PriceSourceException("CoinGecko request failed: " + e.getMessage(), e);
        }
        if (body == null || !body.isObject()) {
            throw new PriceSourceException("CoinGecko returned an empty or malformed response");
        }

        List<PriceSnapshot> snapshots = new ArrayList<>();
        for (String symbol : symbols) {
            JsonNode coin = body.get(coinIdsBySymbol.get(symbol));
            if (coin == null) {
                log.debug("No CoinGecko data for {}", symbol);
                continue;
            }
            toSnapshot(symbol, coin).ifPresent(snapshots::add);
        }
        log.debug("Fetched {} of {} prices from CoinGecko", snapshots.size(), symbols.size());
        return snapshots;
    }

    private Optional<PriceSnapshot> toSnapshot(String symbol, JsonNode coin) {
        String currency = config.getVsCurrency();
        BigDecimal price = decimal(coin, currency);
        if (price == null) {
            return Optional.empty();
        }

        BigDecimal changePercent = decimal(coin, currency + "_24h_change");
        BigDecimal change = changePercent == null
                ? null
                : price.multiply(changePercent).divide(ONE_HUNDRED, MathContext.DECIMAL64);
        long lastUpdatedAt = coin.path("last_updated_at").asLong(0);

        return Optional.of(PriceSnapshot.builder()
                .symbol(symbol)
                .price(price)
                .change24h(change)
                .changePercent24h(changePercent)
                .volume24h(decimal(coin, currency + "_24h_vol"))
                .marketCap(decimal(coin, currency + "_market_cap"))
                .lastUpdated(lastUpdatedAt > 0 ? Instant.ofEpochSecond(lastUpdatedAt) : clock.instant())
                .build());
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.decimalValue();
    }
}
