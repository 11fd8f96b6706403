package com.pricestream.unit.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pricestream.api.controller.StreamController;
import com.pricestream.config.ApiResponseAdvice;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.GlobalExceptionHandler;
import com.pricestream.observability.PriceStreamMetrics;
import com.pricestream.ratelimit.InMemoryRateLimitStore;
import com.pricestream.ratelimit.RateLimitConfig;
import com.pricestream.ratelimit.RateLimitInterceptor;
import com.pricestream.ratelimit.RateLimiter;
import com.pricestream.scheduler.PriceUpdateScheduler;
import com.pricestream.scheduler.SchedulerStats;
import com.pricestream.scheduler.UpdateCycleStats;
import com.pricestream.subscription.ConnectionConfig;
import com.pricestream.subscription.SubscriptionRegistry;
import com.pricestream.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class StreamControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SubscriptionRegistry subscriptionRegistry;

    @Mock
    private PriceUpdateScheduler priceUpdateScheduler;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        PriceStreamMetrics metrics = new PriceStreamMetrics(new SimpleMeterRegistry(), mock(SubscriptionRegistry.class));
        RateLimiter rateLimiter =
                new RateLimiter(new InMemoryRateLimitStore(clock), new RateLimitConfig(), clock, metrics);
        ConnectionConfig connectionConfig = new ConnectionConfig();
        connectionConfig.setMaxConnections(500);

        mockMvc = MockMvcBuilders.standaloneSetup(
                        new StreamController(subscriptionRegistry, priceUpdateScheduler, connectionConfig))
                .addInterceptors(new RateLimitInterceptor(rateLimiter, clock))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static SchedulerStats stats(boolean paused) {
        return new SchedulerStats(true, paused, false, 10_000, 12, 1, 0, null);
    }

    @Test
    @DisplayName("GET /api/stream/status reports connections, symbols and scheduler counters")
    void statusReportsCountersAndSymbols() throws Exception {
        when(subscriptionRegistry.connectionCount()).thenReturn(3);
        when(subscriptionRegistry.subscribedSymbols()).thenReturn(List.of("BTC", "ETH"));
        when(subscriptionRegistry.getSupportedSymbols()).thenReturn(Set.of("SOL", "BTC", "ETH"));
        when(priceUpdateScheduler.stats()).thenReturn(stats(false));

        mockMvc.perform(get("/api/stream/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.connections").value(3))
                .andExpect(jsonPath("$.data.maxConnections").value(500))
                .andExpect(jsonPath("$.data.subscribedSymbols[0]").value("BTC"))
                .andExpect(jsonPath("$.data.supportedSymbols[2]").value("SOL"))
                .andExpect(jsonPath("$.data.scheduler.cyclesCompleted").value(12))
                .andExpect(jsonPath("$.data.scheduler.paused").value(false));
    }

    @Test
    @DisplayName("POST /api/stream/refresh returns the stats of the cycle it ran")
    void refresh() throws Exception {
        UpdateCycleStats cycle = new UpdateCycleStats(Instant.parse("2026-01-15T10:00:00Z"), 42, 15, 30, 1, false);
        when(priceUpdateScheduler.triggerNow()).thenReturn(Optional.of(cycle));

        mockMvc.perform(post("/api/stream/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.symbolsUpdated").value(15))
                .andExpect(jsonPath("$.data.alertsTriggered").value(1));
    }

    @Test
    @DisplayName("POST /api/stream/refresh while a cycle runs returns 409")
    void refreshWhileRunning() throws Exception {
        when(priceUpdateScheduler.triggerNow()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/stream/refresh"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("UPDATE_IN_PROGRESS"));
    }

    @Test
    @DisplayName("POST /api/stream/refresh when stopped returns 503")
    void refreshWhenStopped() throws Exception {
        when(priceUpdateScheduler.triggerNow())
                .thenThrow(new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, "Price updates are not running"));

        mockMvc.perform(post("/api/stream/refresh"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("SERVICE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("POST /api/stream/pause and /resume toggle scheduled ticks")
    void pauseAndResume() throws Exception {
        when(priceUpdateScheduler.stats()).thenReturn(stats(true), stats(false));

        mockMvc.perform(post("/api/stream/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.paused").value(true));
        mockMvc.perform(post("/api/stream/resume"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.paused").value(false));

        verify(priceUpdateScheduler).pause();
        verify(priceUpdateScheduler).resume();
    }
}
