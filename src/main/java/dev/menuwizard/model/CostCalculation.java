package dev.menuwizard.model;

import java.math.BigDecimal;

/**
 * Cost figures shown on the cost step. All fields are nullable until computed.
 */
public record CostCalculation(
    BigDecimal totalCost,
    BigDecimal costPerServing,
    BigDecimal suggestedPrice,
    BigDecimal currentMargin,
    BigDecimal targetMargin
) {
    public static final BigDecimal DEFAULT_TARGET_MARGIN = BigDecimal.valueOf(30);

    public static CostCalculation defaults() {
        return new CostCalculation(null, null, null, null, DEFAULT_TARGET_MARGIN);
    }
}
