package dev.menuwizard.model;

import java.math.BigDecimal;

public record IngredientPayload(
    String ingredientId,
    BigDecimal quantity,
    String unit
) {}
