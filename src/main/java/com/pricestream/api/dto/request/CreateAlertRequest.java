package com.pricestream.api.dto.request;

import com.pricestream.domain.enums.AlertCondition;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating a price alert.
 * {@code targetPrice} goes with above/below, {@code percentChange} with percent_change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAlertRequest {

    @NotBlank
    @Size(max = 10)
    private String symbol;

    @NotNull
    private AlertCondition condition;

    @Positive
    private BigDecimal targetPrice;

    @DecimalMin("-100")
    @DecimalMax("10000")
    private BigDecimal percentChange;
}
