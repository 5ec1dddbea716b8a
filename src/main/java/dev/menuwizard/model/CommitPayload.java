package dev.menuwizard.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outbound create/update request. The fields shared by both shapes come first; only
 * {@link MenuItemPayload} carries sales settings.
 */
public sealed interface CommitPayload {

    String name();

    String description();

    int servings();

    int prepTimeMinutes();

    int cookTimeMinutes();

    String instructions();

    List<IngredientPayload> ingredients();

    record RecipePayload(
        String name,
        String description,
        int servings,
        int prepTimeMinutes,
        int cookTimeMinutes,
        String instructions,
        List<IngredientPayload> ingredients
    ) implements CommitPayload {
        public RecipePayload {
            ingredients = List.copyOf(ingredients);
        }
    }

    record MenuItemPayload(
        String name,
        String description,
        int servings,
        int prepTimeMinutes,
        int cookTimeMinutes,
        String instructions,
        List<IngredientPayload> ingredients,
        String category,
        BigDecimal price,
        BigDecimal margin,
        @JsonProperty("isAvailable") boolean isAvailable
    ) implements CommitPayload {
        public MenuItemPayload {
            ingredients = List.copyOf(ingredients);
        }
    }
}
