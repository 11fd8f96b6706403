package com.pricestream.repository;

import com.pricestream.alert.AlertRepository;
import com.pricestream.domain.model.Alert;
import com.pricestream.entity.AlertEntity;
import com.pricestream.mapper.AlertMapper;
import com.pricestream.repository.jpa.AlertJpaRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link AlertRepository} on Spring Data JPA.
 *
 * <p>{@link #markTriggeredBatch} locks the still-pending rows among the requested ids,
 * flips them to triggered and returns them, all in one transaction. Rows deactivated,
 * deleted or triggered by someone else before the lock was taken are simply not selected,
 * so they are neither transitioned nor returned.
 */
@Repository
public class JpaAlertRepository implements AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaAlertRepository.class);

    private final AlertJpaRepository alertJpaRepository;
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public JpaAlertRepository(AlertJpaRepository alertJpaRepository) {
        this.alertJpaRepository = alertJpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> loadActiveBySymbol(String symbol) {
        return alertMapper.toDomainList(alertJpaRepository.findBySymbolAndActiveTrueAndTriggeredFalse(symbol));
    }

    @Override
    @Transactional
    public Alert create(Alert alert) {
        AlertEntity saved = alertJpaRepository.save(alertMapper.toEntity(alert));
        return alertMapper.toDomain(saved);
    }

    @Override
    @Transactional
    public List<Alert> markTriggeredBatch(Collection<String> alertIds, Instant triggeredAt) {
        if (alertIds == null || alertIds.isEmpty()) {
            return List.of();
        }
        List<AlertEntity> pending = alertJpaRepository.findPendingForUpdate(alertIds);
        for (AlertEntity entity : pending) {
            entity.setTriggered(true);
            entity.setTriggeredAt(triggeredAt);
        }
        List<AlertEntity> saved = alertJpaRepository.saveAll(pending);
        log.debug("Marked {} of {} alerts as triggered", saved.size(), alertIds.size());
        return alertMapper.toDomainList(saved);
    }

    @Override
    @Transactional
    public Optional<Alert> deactivate(String alertId, String userId) {
        return alertJpaRepository.findOwnedForUpdate(alertId, userId).map(entity -> {
            entity.setActive(false);
            return alertMapper.toDomain(alertJpaRepository.save(entity));
        });
    }

    @Override
    @Transactional
    public boolean delete(String alertId, String userId) {
        Optional<AlertEntity> entity = alertJpaRepository.findOwnedForUpdate(alertId, userId);
        entity.ifPresent(alertJpaRepository::delete);
        return entity.isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive(String userId) {
        return alertJpaRepository.countByUserIdAndActiveTrue(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> findByOwner(String userId, boolean activeOnly) {
        List<AlertEntity> entities = activeOnly
                ? alertJpaRepository.findByUserIdAndActiveTrueAndTriggeredFalseOrderByCreatedAtDesc(userId)
                : alertJpaRepository.findByUserIdOrderByCreatedAtDesc(userId);
        return alertMapper.toDomainList(entities);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findById(String alertId, String userId) {
        return alertJpaRepository.findByIdAndUserId(alertId, userId).map(alertMapper::toDomain);
    }
}
