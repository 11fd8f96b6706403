package com.pricestream.unit.pricesource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.exception.BaseException;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.PriceSourceException;
import com.pricestream.pricesource.LatestPriceBook;
import com.pricestream.pricesource.PriceQueryService;
import com.pricestream.support.StubPriceSource;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PriceQueryServiceTest {

    private StubPriceSource priceSource;
    private LatestPriceBook latestPriceBook;
    private PriceQueryService service;

    @BeforeEach
    void setUp() {
        priceSource = new StubPriceSource().price("BTC", "67000").price("ETH", "3500");
        latestPriceBook = new LatestPriceBook();
        service = new PriceQueryService(priceSource, latestPriceBook);
    }

    @Test
    @DisplayName("a cached price is served without calling the source")
    void servesFromBook() {
        latestPriceBook.record(StubPriceSource.snapshot("BTC", "66000"));
        priceSource.failWith(new PriceSourceException("down"));

        assertThat(service.getPrice("btc").getPrice()).isEqualByComparingTo("66000");
    }

    @Test
    @DisplayName("an uncached price is fetched and recorded")
    void fetchesAndRecords() {
        PriceSnapshot snapshot = service.getPrice(" eth ");

        assertThat(snapshot.getPrice()).isEqualByComparingTo(new BigDecimal("3500"));
        assertThat(latestPriceBook.get("ETH")).contains(snapshot);
    }

    @Test
    @DisplayName("symbols longer than ten characters are a validation error")
    void rejectsLongSymbols() {
        assertThatThrownBy(() -> service.getPrice("ABCDEFGHIJK"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BaseException) e).getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("all prices come back sorted by symbol, skipping symbols without a price")
    void allPrices() {
        assertThat(service.getPrices(null))
                .extracting(PriceSnapshot::getSymbol)
                .containsExactly("BTC", "ETH");
        assertThat(latestPriceBook.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failed fetch answers with the cached prices only")
    void fallsBackToBook() {
        latestPriceBook.record(StubPriceSource.snapshot("ETH", "3400"));
        priceSource.failWith(new PriceSourceException("down"));

        assertThat(service.getPrices("BTC,ETH"))
                .extracting(PriceSnapshot::getSymbol)
                .containsExactly("ETH");
    }

    @Test
    @DisplayName("empty entries in the symbol list are ignored")
    void ignoresEmptyEntries() {
        assertThat(service.getPrices("BTC,,"))
                .extracting(PriceSnapshot::getSymbol)
                .containsExactly("BTC");
    }
}
