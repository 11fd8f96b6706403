package com.pricestream.scheduler;

import com.pricestream.alert.AlertEvaluator;
import com.pricestream.dispatch.BroadcastDispatcher;
import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.domain.model.TriggeredAlert;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.observability.PriceStreamMetrics;
import com.pricestream.pricesource.LatestPriceBook;
import com.pricestream.pricesource.PriceSource;
import com.pricestream.subscription.SubscriptionRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives the periodic fetch, broadcast and evaluate cycle.
 *
 * <p><b>Single-flight:</b> at most one cycle runs at a time. The tick thread only claims
 * the in-flight flag and hands the cycle to the dedicated update executor, so a tick that
 * fires while a slow cycle is still running finds the flag taken and is skipped (counted,
 * never queued). Manual triggers go through the same flag and run on the caller's thread.
 *
 * <p><b>Cycle:</b> fetch all prices, record them in the latest-price book, broadcast each
 * to its subscribers, then evaluate alerts. A failed fetch makes the cycle empty; any other
 * failure is logged and counted and never escapes to the scheduler thread.
 *
 * <p><b>Lifecycle:</b> ticks are ignored until {@link #start()}. On {@link #stop()} new
 * ticks are refused, an in-flight cycle gets up to {@code shutdownGraceMs} to finish,
 * and then the registry is drained so every client sees a clean close.
 */
@Service
@EnableConfigurationProperties(PriceUpdateConfig.class)
public class PriceUpdateScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PriceUpdateScheduler.class);

    private final PriceSource priceSource;
    private final LatestPriceBook latestPriceBook;
    private final BroadcastDispatcher broadcastDispatcher;
    private final AlertEvaluator alertEvaluator;
    private final SubscriptionRegistry subscriptionRegistry;
    private final PriceUpdateConfig config;
    private final Executor updateExecutor;
    private final Clock clock;
    private final PriceStreamMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final Object cycleMonitor = new Object();

    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong cyclesSkipped = new AtomicLong();
    private final AtomicLong cyclesFailed = new AtomicLong();
    private volatile UpdateCycleStats lastCycle;

    public PriceUpdateScheduler(
            PriceSource priceSource,
            LatestPriceBook latestPriceBook,
            BroadcastDispatcher broadcastDispatcher,
            AlertEvaluator alertEvaluator,
            SubscriptionRegistry subscriptionRegistry,
            PriceUpdateConfig config,
            @Qualifier("priceUpdateExecutor") Executor updateExecutor,
            Clock clock,
            PriceStreamMetrics metrics) {
        this.priceSource = priceSource;
        this.latestPriceBook = latestPriceBook;
        this.broadcastDispatcher = broadcastDispatcher;
        this.alertEvaluator = alertEvaluator;
        this.subscriptionRegistry = subscriptionRegistry;
        this.config = config;
        this.updateExecutor = updateExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Scheduled(
            fixedRateString = "${pricestream.price-update.interval-ms:10000}",
            initialDelayString = "${pricestream.price-update.initial-delay-ms:1000}")
    public void onTick() {
        if (!config.isEnabled() || !running.get() || paused.get()) {
            return;
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            recordSkip("scheduled tick");
            return;
        }
        try {
            updateExecutor.execute(() -> {
                try {
                    runCycle();
                } finally {
                    finishCycle();
                }
            });
        } catch (RejectedExecutionException e) {
            finishCycle();
            recordSkip("scheduled tick (executor rejected)");
        }
    }

    /**
     * Runs one cycle on the calling thread under the single-flight guard.
     *
     * @return the cycle's stats, or empty when another cycle was already in flight
     * @throws BusinessException with SERVICE_UNAVAILABLE when the scheduler is stopped, or
     *     INTERNAL_ERROR when the cycle failed unexpectedly
     */
    public Optional<UpdateCycleStats> triggerNow() {
        if (!running.get()) {
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, "Price updates are not running");
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            recordSkip("manual trigger");
            return Optional.empty();
        }
        try {
            log.info("Manual price update triggered");
            UpdateCycleStats stats = runCycle();
            if (stats == null) {
                throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Price update cycle failed");
            }
            return Optional.of(stats);
        } finally {
            finishCycle();
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Price updates paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Price updates resumed");
        }
    }

    public SchedulerStats stats() {
        return new SchedulerStats(
                running.get(),
                paused.get(),
                cycleInFlight.get(),
                config.getIntervalMs(),
                cyclesCompleted.get(),
                cyclesSkipped.get(),
                cyclesFailed.get(),
                lastCycle);
    }

    // ---- SmartLifecycle ----

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Price update scheduler started (interval {}ms, enabled={})", config.getIntervalMs(), config.isEnabled());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping price update scheduler");
        if (!awaitIdle(config.getShutdownGraceMs())) {
            log.warn("Update cycle still running after {}ms, draining connections anyway", config.getShutdownGraceMs());
        }
        int closed = subscriptionRegistry.drain();
        log.info("Price update scheduler stopped, {} connections closed", closed);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** Highest phase: stops before the web server, so clients get a close frame. */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    // ---- Internal ----

    /** Returns null when the cycle failed. */
    private UpdateCycleStats runCycle() {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        try {
            List<PriceSnapshot> prices;
            try {
                prices = priceSource.fetchAll();
            } catch (RuntimeException e) {
                log.warn("Price fetch failed, no update this cycle: {}", e.getMessage());
                cyclesFailed.incrementAndGet();
                metrics.cycleFailed();
                return record(new UpdateCycleStats(startedAt, elapsedMs(start), 0, 0, 0, true));
            }

            latestPriceBook.record(prices);
            int delivered = 0;
            for (PriceSnapshot price : prices) {
                delivered += broadcastDispatcher.broadcastPrice(price);
            }
            List<TriggeredAlert> triggered = alertEvaluator.evaluate(prices);

            UpdateCycleStats stats =
                    new UpdateCycleStats(startedAt, elapsedMs(start), prices.size(), delivered, triggered.size(), false);
            cyclesCompleted.incrementAndGet();
            metrics.cycleCompleted(Duration.ofNanos(System.nanoTime() - start));
            log.info(
                    "Price update complete: {} symbols, {} deliveries to {} connections, {} alerts triggered in {}ms",
                    stats.symbolsUpdated(),
                    stats.pricesDelivered(),
                    subscriptionRegistry.connectionCount(),
                    stats.alertsTriggered(),
                    stats.durationMs());
            return record(stats);
        } catch (RuntimeException e) {
            cyclesFailed.incrementAndGet();
            metrics.cycleFailed();
            log.error("Price update cycle failed", e);
            return null;
        }
    }

    private UpdateCycleStats record(UpdateCycleStats stats) {
        lastCycle = stats;
        return stats;
    }

    private void recordSkip(String source) {
        cyclesSkipped.incrementAndGet();
        metrics.cycleSkipped();
        log.debug("Skipping {}: previous update cycle still in flight", source);
    }

    private void finishCycle() {
        synchronized (cycleMonitor) {
            cycleInFlight.set(false);
            cycleMonitor.notifyAll();
        }
    }

    private boolean awaitIdle(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        synchronized (cycleMonitor) {
            while (cycleInFlight.get()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    cycleMonitor.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
