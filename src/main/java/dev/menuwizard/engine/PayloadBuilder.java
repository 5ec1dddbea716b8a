package dev.menuwizard.engine;

import dev.menuwizard.model.*;
import dev.menuwizard.model.CommitPayload.MenuItemPayload;
import dev.menuwizard.model.CommitPayload.RecipePayload;

import java.util.List;

/**
 * Projects session fields onto the outbound request for the chosen creation type.
 */
public final class PayloadBuilder {

    private PayloadBuilder() {}

    public static CommitPayload build(SessionFields fields, Discriminator discriminator) {
        if (discriminator == null) {
            throw new IllegalArgumentException("Creation type not chosen");
        }
        return switch (discriminator) {
            case RECIPE -> buildRecipe(fields);
            case MENU_ITEM -> buildMenuItem(fields);
        };
    }

    public static RecipePayload buildRecipe(SessionFields fields) {
        BasicInfo info = fields.basicInfo();
        Preparation prep = fields.preparation();
        return new RecipePayload(
            info.name().trim(),
            info.description(),
            info.servings(),
            prep.preparationMinutes(),
            prep.cookingMinutes(),
            prep.instructions(),
            ingredients(fields)
        );
    }

    public static MenuItemPayload buildMenuItem(SessionFields fields) {
        BasicInfo info = fields.basicInfo();
        Preparation prep = fields.preparation();
        SalesSettings sales = fields.salesSettings();
        return new MenuItemPayload(
            info.name().trim(),
            info.description(),
            info.servings(),
            prep.preparationMinutes(),
            prep.cookingMinutes(),
            prep.instructions(),
            ingredients(fields),
            info.category(),
            sales.price(),
            sales.margin(),
            sales.isAvailable()
        );
    }

    private static List<IngredientPayload> ingredients(SessionFields fields) {
        return fields.ingredients().stream()
            .map(line -> new IngredientPayload(line.ingredientId(), line.quantity(), line.unit()))
            .toList();
    }
}
