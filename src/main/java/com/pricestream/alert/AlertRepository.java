package com.pricestream.alert;

import com.pricestream.domain.model.Alert;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for price alerts. Owner-scoped operations only touch alerts belonging
 * to {@code userId}.
 */
public interface AlertRepository {

    /** Active, not yet triggered alerts for one symbol. */
    List<Alert> loadActiveBySymbol(String symbol);

    Alert create(Alert alert);

    /**
     * Transitions the given alerts to triggered in one atomic batch. Only alerts that are
     * still active and untriggered at commit time are transitioned; exactly those are
     * returned, already carrying their triggered state.
     */
    List<Alert> markTriggeredBatch(Collection<String> alertIds, Instant triggeredAt);

    Optional<Alert> deactivate(String alertId, String userId);

    boolean delete(String alertId, String userId);

    /** Number of active alerts held by the user, triggered or not. */
    long countActive(String userId);

    List<Alert> findByOwner(String userId, boolean activeOnly);

    Optional<Alert> findById(String alertId, String userId);
}
