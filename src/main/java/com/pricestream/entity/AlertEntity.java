package com.pricestream.entity;

import com.pricestream.domain.enums.AlertCondition;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the price_alerts table.
 *
 * <p>Ids are UUID strings assigned by the application. Pending alerts (active and not
 * triggered) are looked up by symbol on every evaluation pass, hence the symbol index.
 */
@Entity
@Table(
        name = "price_alerts",
        indexes = {
            @Index(name = "idx_price_alerts_symbol_pending", columnList = "symbol, active, triggered"),
            @Index(name = "idx_price_alerts_user", columnList = "user_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, length = 10)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_condition", nullable = false, columnDefinition = "varchar(20)")
    private AlertCondition condition;

    @Column(name = "target_price", precision = 24, scale = 8)
    private BigDecimal targetPrice;

    @Column(name = "percent_change", precision = 12, scale = 4)
    private BigDecimal percentChange;

    @Column(name = "base_price", precision = 24, scale = 8)
    private BigDecimal basePrice;

    @Column(nullable = false)
    private boolean triggered;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "triggered_at")
    private Instant triggeredAt;
}
