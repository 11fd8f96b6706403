package com.pricestream.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricestream.domain.enums.AlertCondition;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A user-defined price alert.
 *
 * <p>Exactly one of {@code targetPrice} (ABOVE/BELOW) and {@code percentChange}
 * (PERCENT_CHANGE) is set. {@code basePrice} is the symbol's price when the alert was
 * created and is the reference for percent-change evaluation.
 *
 * <p>Lifecycle: created active and untriggered; transitions to triggered at most once.
 * The owner may deactivate or delete it at any time, which supersedes a pending trigger.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;
    private String userId;
    private String symbol;
    private AlertCondition condition;
    private BigDecimal targetPrice;
    private BigDecimal percentChange;
    private BigDecimal basePrice;

    @JsonProperty("isTriggered")
    private boolean triggered;

    @JsonProperty("isActive")
    private boolean active;

    private Instant createdAt;
    private Instant triggeredAt;

    @JsonIgnore
    public boolean isPending() {
        return active && !triggered;
    }
}
