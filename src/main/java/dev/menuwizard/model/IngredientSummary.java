package dev.menuwizard.model;

import java.math.BigDecimal;

/**
 * Read-only catalog entry offered on the ingredients step.
 */
public record IngredientSummary(
    String id,
    String name,
    String unit,
    BigDecimal costPerUnit
) {}
