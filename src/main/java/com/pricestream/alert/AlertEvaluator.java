package com.pricestream.alert;

import com.pricestream.dispatch.BroadcastDispatcher;
import com.pricestream.domain.enums.AlertCondition;
import com.pricestream.domain.model.Alert;
import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.domain.model.TriggeredAlert;
import com.pricestream.observability.PriceStreamMetrics;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Evaluates pending price alerts against a batch of fresh snapshots.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>Each symbol's pending alerts are loaded and checked in parallel on the alert
 *       evaluation executor. A failure for one symbol is logged and skips that symbol.</li>
 *   <li>All candidates from the pass are persisted as triggered with one
 *       {@link AlertRepository#markTriggeredBatch} call, before anything is announced.</li>
 *   <li>Only the alerts the store actually transitioned are announced. An alert that was
 *       deactivated, deleted or triggered by a concurrent pass after it was loaded is not
 *       returned by the store and stays silent.</li>
 * </ol>
 *
 * <p>If the batch write fails nothing is announced and the alerts remain pending, so the
 * next pass picks them up again.
 */
@Service
public class AlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final AlertRepository alertRepository;
    private final BroadcastDispatcher broadcastDispatcher;
    private final Executor evaluationExecutor;
    private final Clock clock;
    private final PriceStreamMetrics metrics;

    public AlertEvaluator(
            AlertRepository alertRepository,
            BroadcastDispatcher broadcastDispatcher,
            @Qualifier("alertEvaluationExecutor") Executor evaluationExecutor,
            Clock clock,
            PriceStreamMetrics metrics) {
        this.alertRepository = alertRepository;
        this.broadcastDispatcher = broadcastDispatcher;
        this.evaluationExecutor = evaluationExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Evaluates every pending alert for the snapshots' symbols, persists the triggers and
     * notifies the owners.
     *
     * @return the alerts that transitioned to triggered in this pass
     */
    public List<TriggeredAlert> evaluate(List<PriceSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return List.of();
        }

        // Last snapshot wins when a batch carries the same symbol twice
        Map<String, PriceSnapshot> latestBySymbol = new LinkedHashMap<>();
        for (PriceSnapshot snapshot : snapshots) {
            latestBySymbol.put(snapshot.getSymbol(), snapshot);
        }

        List<CompletableFuture<List<TriggeredAlert>>> futures = new ArrayList<>();
        for (PriceSnapshot snapshot : latestBySymbol.values()) {
            futures.add(CompletableFuture.supplyAsync(() -> findCandidates(snapshot), evaluationExecutor));
        }

        Map<String, TriggeredAlert> candidates = new LinkedHashMap<>();
        for (CompletableFuture<List<TriggeredAlert>> future : futures) {
            for (TriggeredAlert candidate : future.join()) {
                candidates.putIfAbsent(candidate.alert().getId(), candidate);
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Alert> transitioned;
        try {
            transitioned = alertRepository.markTriggeredBatch(candidates.keySet(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to persist {} alert triggers, batch aborted and left pending", candidates.size(), e);
            return List.of();
        }

        List<TriggeredAlert> triggered = new ArrayList<>();
        for (Alert alert : transitioned) {
            TriggeredAlert candidate = candidates.get(alert.getId());
            if (candidate != null) {
                triggered.add(new TriggeredAlert(alert, candidate.snapshot()));
            }
        }
        if (triggered.size() < candidates.size()) {
            log.info(
                    "{} of {} alert candidates were superseded before the trigger batch committed",
                    candidates.size() - triggered.size(),
                    candidates.size());
        }

        for (TriggeredAlert alert : triggered) {
            log.info(
                    "Alert {} triggered for user {}: {} {} at price {}",
                    alert.alert().getId(),
                    alert.alert().getUserId(),
                    alert.alert().getSymbol(),
                    alert.alert().getCondition().getWireName(),
                    alert.snapshot().getPrice());
            broadcastDispatcher.notifyAlertTriggered(alert.alert(), alert.snapshot());
        }
        metrics.alertsTriggered(triggered.size());
        return triggered;
    }

    /**
     * Pure trigger test for one alert at {@code price}.
     *
     * <ul>
     *   <li>ABOVE: price &ge; target</li>
     *   <li>BELOW: price &le; target</li>
     *   <li>PERCENT_CHANGE: {@code (price - base) / base * 100} compared with the threshold;
     *       a positive threshold needs a move at least that far up, a negative one at least
     *       that far down. A zero threshold, or a missing or zero base, never fires.</li>
     * </ul>
     */
    public boolean shouldTrigger(Alert alert, BigDecimal price) {
        if (alert.getCondition() == null || price == null) {
            return false;
        }
        AlertCondition condition = alert.getCondition();
        return switch (condition) {
            case ABOVE -> alert.getTargetPrice() != null && price.compareTo(alert.getTargetPrice()) >= 0;
            case BELOW -> alert.getTargetPrice() != null && price.compareTo(alert.getTargetPrice()) <= 0;
            case PERCENT_CHANGE -> percentChangeReached(alert.getBasePrice(), alert.getPercentChange(), price);
        };
    }

    // ---- Internal ----

    private List<TriggeredAlert> findCandidates(PriceSnapshot snapshot) {
        try {
            List<Alert> pending = alertRepository.loadActiveBySymbol(snapshot.getSymbol());
            List<TriggeredAlert> candidates = new ArrayList<>();
            for (Alert alert : pending) {
                if (alert.isPending() && shouldTrigger(alert, snapshot.getPrice())) {
                    candidates.add(new TriggeredAlert(alert, snapshot));
                }
            }
            return candidates;
        } catch (RuntimeException e) {
            log.warn("Skipping alert evaluation for {}: {}", snapshot.getSymbol(), e.getMessage(), e);
            return List.of();
        }
    }

    private boolean percentChangeReached(BigDecimal basePrice, BigDecimal threshold, BigDecimal price) {
        if (basePrice == null || threshold == null || basePrice.signum() == 0 || threshold.signum() == 0) {
            return false;
        }
        BigDecimal actual = price.subtract(basePrice)
                .divide(basePrice, MathContext.DECIMAL64)
                .multiply(ONE_HUNDRED);
        return threshold.signum() > 0 ? actual.compareTo(threshold) >= 0 : actual.compareTo(threshold) <= 0;
    }
}
