package com.pricestream.pricesource;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the CoinGecko price feed under the {@code pricestream.price-source} prefix.
 *
 * <p>{@code symbols} maps each supported ticker to its CoinGecko coin id. The key set is
 * the service's supported-symbol set.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pricestream.price-source")
public class PriceSourceConfig {

    private String baseUrl = "https://api.coingecko.com/api/v3";

    /** Optional demo API key, sent as {@code x-cg-demo-api-key}. */
    private String apiKey;

    private long connectTimeoutMs = 5000;
    private long readTimeoutMs = 10000;
    private String vsCurrency = "usd";

    private Map<String, String> symbols = defaultSymbols();

    private static Map<String, String> defaultSymbols() {
        Map<String, String> symbols = new LinkedHashMap<>();
        symbols.put("BTC", "bitcoin");
        symbols.put("ETH", "ethereum");
        symbols.put("SOL", "solana");
        symbols.put("AVAX", "avalanche-2");
        symbols.put("MATIC", "matic-network");
        symbols.put("DOT", "polkadot");
        symbols.put("ADA", "cardano");
        symbols.put("XRP", "ripple");
        symbols.put("DOGE", "dogecoin");
        symbols.put("LINK", "chainlink");
        symbols.put("UNI", "uniswap");
        symbols.put("ATOM", "cosmos");
        symbols.put("LTC", "litecoin");
        symbols.put("BCH", "bitcoin-cash");
        symbols.put("NEAR", "near");
        return symbols;
    }
}
