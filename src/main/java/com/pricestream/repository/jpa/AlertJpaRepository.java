package com.pricestream.repository.jpa;

import com.pricestream.entity.AlertEntity;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the price_alerts table.
 *
 * <p>The {@code ForUpdate} queries take pessimistic write locks so a trigger batch and an
 * owner's deactivate/delete on the same row serialize: whichever commits first wins and
 * the other sees the committed state.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    List<AlertEntity> findBySymbolAndActiveTrueAndTriggeredFalse(String symbol);

    List<AlertEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    List<AlertEntity> findByUserIdAndActiveTrueAndTriggeredFalseOrderByCreatedAtDesc(String userId);

    Optional<AlertEntity> findByIdAndUserId(String id, String userId);

    long countByUserIdAndActiveTrue(String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AlertEntity a WHERE a.id IN :ids AND a.active = true AND a.triggered = false")
    List<AlertEntity> findPendingForUpdate(@Param("ids") Collection<String> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AlertEntity a WHERE a.id = :id AND a.userId = :userId")
    Optional<AlertEntity> findOwnedForUpdate(@Param("id") String id, @Param("userId") String userId);
}
