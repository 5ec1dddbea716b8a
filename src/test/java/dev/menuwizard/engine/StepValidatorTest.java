package dev.menuwizard.engine;

import dev.menuwizard.model.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static dev.menuwizard.model.Discriminator.MENU_ITEM;
import static dev.menuwizard.model.Discriminator.RECIPE;
import static org.assertj.core.api.Assertions.assertThat;

class StepValidatorTest {

    private final StepRegistry registry = TestFixtures.registry();

    @Test
    void completeRecipeHasNoErrors() {
        assertThat(StepValidator.validateAll(registry, TestFixtures.recipeFields(), RECIPE)).isEmpty();
    }

    @Test
    void completeMenuItemHasNoErrors() {
        assertThat(StepValidator.validateAll(registry, TestFixtures.menuItemFields(), MENU_ITEM)).isEmpty();
    }

    @Test
    void creationTypeRequiresAChoice() {
        assertThat(StepValidator.validate(StepId.CREATION_TYPE, SessionFields.defaults(), null))
            .containsExactly("Choose whether to create a recipe or a menu item");
        assertThat(StepValidator.validate(StepId.CREATION_TYPE, SessionFields.defaults(), RECIPE)).isEmpty();
    }

    @Test
    void basicInfoErrorsComeInDisplayOrder() {
        var fields = new SessionFields(new BasicInfo("  ", "", "", 0), null, null, null, null);

        assertThat(StepValidator.validate(StepId.BASIC_INFO, fields, MENU_ITEM))
            .containsExactly("Name is required", "Choose a category", "Servings must be at least 1");
        assertThat(StepValidator.validate(StepId.BASIC_INFO, fields, RECIPE))
            .containsExactly("Name is required", "Servings must be at least 1");
    }

    @Test
    void ingredientsNeedAtLeastOneLine() {
        assertThat(StepValidator.validate(StepId.INGREDIENTS, SessionFields.defaults(), RECIPE))
            .containsExactly("Add at least one ingredient");
    }

    @Test
    void everyIngredientNeedsAPositiveQuantity() {
        var fields = new SessionFields(null, List.of(
            new IngredientLine("1", "Flour", new BigDecimal("2"), "kg", null),
            new IngredientLine("2", "Butter", BigDecimal.ZERO, "kg", null),
            new IngredientLine(null, "", new BigDecimal("-1"), "g", null)
        ), null, null, null);

        assertThat(StepValidator.validate(StepId.INGREDIENTS, fields, RECIPE)).containsExactly(
            "Ingredient Butter: quantity must be greater than 0",
            "Ingredient #3: pick an ingredient from the catalog",
            "Ingredient #3: quantity must be greater than 0");
    }

    @Test
    void salesSettingsOnlyCheckedForMenuItems() {
        var fields = new SessionFields(null, null, null, null,
            new SalesSettings(BigDecimal.ZERO, new BigDecimal("-5"), true));

        assertThat(StepValidator.validate(StepId.SALES_SETTINGS, fields, MENU_ITEM))
            .containsExactly("Price must be greater than 0", "Margin cannot be negative");
        assertThat(StepValidator.validate(StepId.SALES_SETTINGS, fields, RECIPE)).isEmpty();
    }

    @Test
    void targetMarginMustBeAPercentage() {
        var fields = new SessionFields(null, null, null,
            new CostCalculation(null, null, null, null, new BigDecimal("120")), null);

        assertThat(StepValidator.validate(StepId.COST_CALCULATION, fields, RECIPE))
            .containsExactly("Target margin must be between 0 and 100%");
    }

    @Test
    void preparationTimesCannotBeNegative() {
        var fields = new SessionFields(null, null, new Preparation("", -1, -2), null, null);

        assertThat(StepValidator.validate(StepId.PREPARATION, fields, RECIPE))
            .containsExactly("Preparation time cannot be negative", "Cooking time cannot be negative");
    }

    @Test
    void validateAllKeysErrorsByRequiredStepInOrder() {
        var fields = new SessionFields(new BasicInfo("", "", "", 1), null, null, null, null);

        var errors = StepValidator.validateAll(registry, fields, MENU_ITEM);

        assertThat(errors.keySet())
            .containsExactly(StepId.BASIC_INFO, StepId.INGREDIENTS, StepId.SALES_SETTINGS);
        assertThat(errors.get(StepId.BASIC_INFO)).containsExactly("Name is required", "Choose a category");
    }

    @Test
    void validateAllSkipsStepsOutsideTheFlow() {
        // sales settings are not part of a recipe
        var fields = new SessionFields(TestFixtures.basicInfo("Soup", 2),
            TestFixtures.recipeFields().ingredients(), null, null,
            new SalesSettings(BigDecimal.ZERO, BigDecimal.ZERO, true));

        assertThat(StepValidator.validateAll(registry, fields, RECIPE)).isEmpty();
    }

    @Test
    void validateAllChecksOptionalStepsThatAreSent() {
        var fields = new SessionFields(TestFixtures.basicInfo("Soup", 2),
            TestFixtures.recipeFields().ingredients(), new Preparation("", -10, -5), null, null);

        var errors = StepValidator.validateAll(registry, fields, RECIPE);

        assertThat(errors).containsOnlyKeys(StepId.PREPARATION);
        assertThat(errors.get(StepId.PREPARATION))
            .containsExactly("Preparation time cannot be negative", "Cooking time cannot be negative");
    }

    @Test
    void validateAllWithoutChoiceFlagsCreationType() {
        var errors = StepValidator.validateAll(registry, TestFixtures.recipeFields(), null);

        assertThat(errors).containsOnlyKeys(StepId.CREATION_TYPE);
    }
}
