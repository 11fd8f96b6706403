package com.pricestream.api.controller;

import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.pricesource.PriceQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Price queries behind the standard rate limit.
 *
 * <ul>
 *   <li>{@code GET /api/prices?symbols=BTC,ETH} -- latest prices, all supported symbols when omitted</li>
 *   <li>{@code GET /api/prices/symbols} -- supported symbols</li>
 *   <li>{@code GET /api/prices/{symbol}} -- latest price for one symbol</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/prices")
public class PriceController {

    private final PriceQueryService priceQueryService;

    public PriceController(PriceQueryService priceQueryService) {
        this.priceQueryService = priceQueryService;
    }

    @GetMapping
    public List<PriceSnapshot> getPrices(@RequestParam(required = false) String symbols) {
        return priceQueryService.getPrices(symbols);
    }

    @GetMapping("/symbols")
    public List<String> getSupportedSymbols() {
        return priceQueryService.supportedSymbols();
    }

    @GetMapping("/{symbol}")
    public PriceSnapshot getPrice(@PathVariable String symbol) {
        return priceQueryService.getPrice(symbol);
    }
}
