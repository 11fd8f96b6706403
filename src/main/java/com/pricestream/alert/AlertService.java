package com.pricestream.alert;

import com.pricestream.domain.enums.AlertCondition;
import com.pricestream.domain.enums.SubscriptionTier;
import com.pricestream.domain.model.Alert;
import com.pricestream.domain.model.PriceSnapshot;
import com.pricestream.exception.BusinessException;
import com.pricestream.exception.ErrorCode;
import com.pricestream.exception.PriceSourceException;
import com.pricestream.exception.ResourceNotFoundException;
import com.pricestream.pricesource.LatestPriceBook;
import com.pricestream.pricesource.PriceSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Owner-scoped alert management: create, list, get, deactivate and delete.
 *
 * <p>Creation checks the symbol against the supported set, enforces that exactly the
 * field matching the condition is set, applies the tier's active-alert cap and captures
 * the current price as the alert's base price. The cap check and the insert run under a
 * lock striped by user id so concurrent creates by one user cannot overshoot the cap.
 */
@Service
@EnableConfigurationProperties(AlertConfig.class)
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertRepository alertRepository;
    private final PriceSource priceSource;
    private final LatestPriceBook latestPriceBook;
    private final AlertConfig alertConfig;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    /** Guards the cap check and insert; a user always maps to the same stripe. */
    private final Object[] userLockStripes = new Object[LOCK_STRIPES];

    public AlertService(
            AlertRepository alertRepository,
            PriceSource priceSource,
            LatestPriceBook latestPriceBook,
            AlertConfig alertConfig,
            Clock clock) {
        this.alertRepository = alertRepository;
        this.priceSource = priceSource;
        this.latestPriceBook = latestPriceBook;
        this.alertConfig = alertConfig;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            userLockStripes[i] = new Object();
        }
    }

    public Alert createAlert(
            String userId,
            SubscriptionTier tier,
            String symbol,
            AlertCondition condition,
            BigDecimal targetPrice,
            BigDecimal percentChange) {
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (!priceSource.supportedSymbols().contains(normalized)) {
            throw new BusinessException(
                    ErrorCode.INVALID_SYMBOL,
                    "Unsupported symbol: " + symbol,
                    Map.of("supportedSymbols", new TreeSet<>(priceSource.supportedSymbols())));
        }
        validateConditionFields(condition, targetPrice, percentChange);

        Optional<BigDecimal> basePrice = currentPrice(normalized);
        if (condition == AlertCondition.PERCENT_CHANGE && basePrice.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.PRICE_UNAVAILABLE, "No current price for " + normalized + " to measure the change from");
        }

        synchronized (lockFor(userId)) {
            long active = alertRepository.countActive(userId);
            int maxAlerts = alertConfig.maxAlertsFor(tier);
            if (active >= maxAlerts) {
                throw new BusinessException(
                        ErrorCode.ALERT_LIMIT_REACHED,
                        "Alert limit reached. Your " + tier.getValue() + " tier allows " + maxAlerts + " active alerts.",
                        Map.of("currentCount", active, "maxAlerts", maxAlerts, "tier", tier.getValue()));
            }

            Alert alert = Alert.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .symbol(normalized)
                    .condition(condition)
                    .targetPrice(condition.usesTargetPrice() ? targetPrice : null)
                    .percentChange(condition.usesTargetPrice() ? null : percentChange)
                    .basePrice(basePrice.orElse(null))
                    .triggered(false)
                    .active(true)
                    .createdAt(clock.instant())
                    .build();
            Alert created = alertRepository.create(alert);
            log.info(
                    "Alert {} created for user {}: {} {} (base price {})",
                    created.getId(),
                    userId,
                    normalized,
                    condition.getWireName(),
                    created.getBasePrice());
            return created;
        }
    }

    public List<Alert> listAlerts(String userId, boolean activeOnly) {
        return alertRepository.findByOwner(userId, activeOnly);
    }

    public Alert getAlert(String alertId, String userId) {
        return alertRepository.findById(alertId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }

    public Alert deactivateAlert(String alertId, String userId) {
        Alert alert = alertRepository.deactivate(alertId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        log.info("Alert {} deactivated by user {}", alertId, userId);
        return alert;
    }

    public void deleteAlert(String alertId, String userId) {
        if (!alertRepository.delete(alertId, userId)) {
            throw new ResourceNotFoundException("Alert", alertId);
        }
        log.info("Alert {} deleted by user {}", alertId, userId);
    }

    // ---- Internal ----

    private Object lockFor(String userId) {
        return userLockStripes[Math.floorMod(userId.hashCode(), LOCK_STRIPES)];
    }

    private void validateConditionFields(AlertCondition condition, BigDecimal targetPrice, BigDecimal percentChange) {
        if (condition == null) {
            throw new BusinessException("Alert condition is required");
        }
        if (condition.usesTargetPrice()) {
            if (targetPrice == null || targetPrice.signum() <= 0) {
                throw new BusinessException("A positive targetPrice is required for " + condition.getWireName() + " alerts");
            }
            if (percentChange != null) {
                throw new BusinessException("percentChange is not allowed for " + condition.getWireName() + " alerts");
            }
        } else {
            if (percentChange == null || percentChange.signum() == 0) {
                throw new BusinessException("A non-zero percentChange is required for percent_change alerts");
            }
            if (targetPrice != null) {
                throw new BusinessException("targetPrice is not allowed for percent_change alerts");
            }
        }
    }

    private Optional<BigDecimal> currentPrice(String symbol) {
        Optional<PriceSnapshot> latest = latestPriceBook.get(symbol);
        if (latest.isPresent()) {
            return latest.map(PriceSnapshot::getPrice);
        }
        try {
            Optional<PriceSnapshot> fetched = priceSource.fetchOne(symbol);
            fetched.ifPresent(latestPriceBook::record);
            return fetched.map(PriceSnapshot::getPrice);
        } catch (PriceSourceException e) {
            log.warn("Could not fetch a base price for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
