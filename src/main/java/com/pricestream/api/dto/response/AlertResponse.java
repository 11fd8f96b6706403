package com.pricestream.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricestream.domain.enums.AlertCondition;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {

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
}
