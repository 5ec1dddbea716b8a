package dev.menuwizard.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Pricing for a menu item. Ignored when creating a recipe.
 */
public record SalesSettings(
    BigDecimal price,
    BigDecimal margin,
    @JsonProperty("isAvailable") boolean isAvailable
) {
    public SalesSettings {
        price = price == null ? BigDecimal.ZERO : price;
        margin = margin == null ? BigDecimal.ZERO : margin;
    }

    public static SalesSettings defaults() {
        return new SalesSettings(BigDecimal.ZERO, BigDecimal.ZERO, true);
    }
}
