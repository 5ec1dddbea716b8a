package dev.menuwizard.model;

import java.math.BigDecimal;

/**
 * One ingredient used by the recipe or menu item.
 */
public record IngredientLine(
    String ingredientId,
    String name,
    BigDecimal quantity,
    String unit,
    BigDecimal costPerUnit // null until picked from the catalog
) {
    public IngredientLine {
        name = name == null ? "" : name;
        quantity = quantity == null ? BigDecimal.ZERO : quantity;
        unit = unit == null ? "" : unit;
    }

    public static IngredientLine from(IngredientSummary summary, BigDecimal quantity, String unit) {
        return new IngredientLine(summary.id(), summary.name(), quantity,
            unit == null ? summary.unit() : unit, summary.costPerUnit());
    }

    public IngredientLine withQuantity(BigDecimal quantity) {
        return new IngredientLine(ingredientId, name, quantity, unit, costPerUnit);
    }
}
