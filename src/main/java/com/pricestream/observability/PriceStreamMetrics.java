package com.pricestream.observability;

import com.pricestream.subscription.SubscriptionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the service's custom Micrometer metrics:
 * <ul>
 *   <li><b>stream.connections</b> (gauge): live registered connections</li>
 *   <li><b>stream.cycles.completed / skipped / failed</b> (counters): update cycle outcomes</li>
 *   <li><b>stream.cycle.duration</b> (timer): duration of completed update cycles</li>
 *   <li><b>alerts.triggered</b> (counter): alerts transitioned to triggered</li>
 *   <li><b>ratelimit.rejected</b> (counter): requests rejected by the rate limiter</li>
 *   <li><b>ratelimit.failopen</b> (counter): requests allowed because the limiter store failed</li>
 * </ul>
 *
 * <p>The connection gauge is polled from the registry at scrape time.
 */
@Service
public class PriceStreamMetrics {

    private final Counter cyclesCompleted;
    private final Counter cyclesSkipped;
    private final Counter cyclesFailed;
    private final Counter alertsTriggered;
    private final Counter rateLimitRejected;
    private final Counter rateLimitFailOpen;
    private final Timer cycleDuration;

    public PriceStreamMetrics(MeterRegistry meterRegistry, SubscriptionRegistry subscriptionRegistry) {
        this.cyclesCompleted = Counter.builder("stream.cycles.completed")
                .description("Price update cycles that ran to completion")
                .register(meterRegistry);

        this.cyclesSkipped = Counter.builder("stream.cycles.skipped")
                .description("Ticks skipped because a cycle was still in flight")
                .register(meterRegistry);

        this.cyclesFailed = Counter.builder("stream.cycles.failed")
                .description("Cycles with a failed price fetch or an unexpected error")
                .register(meterRegistry);

        this.alertsTriggered = Counter.builder("alerts.triggered")
                .description("Alerts transitioned to triggered")
                .register(meterRegistry);

        this.rateLimitRejected = Counter.builder("ratelimit.rejected")
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry);

        this.rateLimitFailOpen = Counter.builder("ratelimit.failopen")
                .description("Requests allowed because the rate limit store was unavailable")
                .register(meterRegistry);

        this.cycleDuration = Timer.builder("stream.cycle.duration")
                .description("Duration of completed price update cycles")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);

        meterRegistry.gauge("stream.connections", subscriptionRegistry, SubscriptionRegistry::connectionCount);
    }

    public void cycleCompleted(Duration duration) {
        cyclesCompleted.increment();
        cycleDuration.record(duration);
    }

    public void cycleSkipped() {
        cyclesSkipped.increment();
    }

    public void cycleFailed() {
        cyclesFailed.increment();
    }

    public void alertsTriggered(int count) {
        if (count > 0) {
            alertsTriggered.increment(count);
        }
    }

    public void rateLimitRejected() {
        rateLimitRejected.increment();
    }

    public void rateLimitFailOpen() {
        rateLimitFailOpen.increment();
    }
}
