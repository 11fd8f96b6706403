package com.pricestream.api.controller;

import com.pricestream.api.dto.response.StreamStatusResponse;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.ratelimit.StrictRateLimit;
import com.pricestream.scheduler.PriceUpdateScheduler;
import com.pricestream.scheduler.SchedulerStats;
import com.pricestream.scheduler.UpdateCycleStats;
import com.pricestream.subscription.ConnectionConfig;
import com.pricestream.subscription.SubscriptionRegistry;
import java.util.List;
import java.util.TreeSet;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for the price stream.
 *
 * <ul>
 *   <li>{@code GET /api/stream/status} -- connections, subscribed symbols, scheduler counters</li>
 *   <li>{@code POST /api/stream/refresh} -- run an update cycle now (strict rate limit)</li>
 *   <li>{@code POST /api/stream/pause}, {@code /resume} -- suspend or resume scheduled ticks</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final SubscriptionRegistry subscriptionRegistry;
    private final PriceUpdateScheduler priceUpdateScheduler;
    private final ConnectionConfig connectionConfig;

    public StreamController(
            SubscriptionRegistry subscriptionRegistry,
            PriceUpdateScheduler priceUpdateScheduler,
            ConnectionConfig connectionConfig) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.priceUpdateScheduler = priceUpdateScheduler;
        this.connectionConfig = connectionConfig;
    }

    @GetMapping("/status")
    public StreamStatusResponse getStatus() {
        return StreamStatusResponse.builder()
                .connections(subscriptionRegistry.connectionCount())
                .maxConnections(connectionConfig.getMaxConnections())
                .subscribedSymbols(subscriptionRegistry.subscribedSymbols())
                .supportedSymbols(List.copyOf(new TreeSet<>(subscriptionRegistry.getSupportedSymbols())))
                .scheduler(priceUpdateScheduler.stats())
                .build();
    }

    @PostMapping("/refresh")
    @StrictRateLimit
    public UpdateCycleStats refresh() {
        return priceUpdateScheduler.triggerNow().orElseThrow(() -> new BusinessException(
                ErrorCode.UPDATE_IN_PROGRESS, "An update cycle is already running"));
    }

    @PostMapping("/pause")
    public SchedulerStats pause() {
        priceUpdateScheduler.pause();
        return priceUpdateScheduler.stats();
    }

    @PostMapping("/resume")
    public SchedulerStats resume() {
        priceUpdateScheduler.resume();
        return priceUpdateScheduler.stats();
    }
}
