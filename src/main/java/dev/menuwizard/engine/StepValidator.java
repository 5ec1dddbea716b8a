package dev.menuwizard.engine;

import dev.menuwizard.model.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-step validation rules. Messages come back in the order they should be shown.
 */
public final class StepValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private StepValidator() {}

    /**
     * Validate one step. Returns an empty list if the step is complete.
     *
     * @param discriminator the chosen creation type, or null if not chosen yet
     */
    public static List<String> validate(StepId step, SessionFields fields, Discriminator discriminator) {
        var errors = new ArrayList<String>();

        switch (step) {
            case CREATION_TYPE -> {
                if (discriminator == null) {
                    errors.add("Choose whether to create a recipe or a menu item");
                }
            }
            case BASIC_INFO -> {
                BasicInfo info = fields.basicInfo();
                if (info.name().isBlank()) {
                    errors.add("Name is required");
                }
                if (discriminator == Discriminator.MENU_ITEM && info.category().isBlank()) {
                    errors.add("Choose a category");
                }
                if (info.servings() < 1) {
                    errors.add("Servings must be at least 1");
                }
            }
            case INGREDIENTS -> {
                if (fields.ingredients().isEmpty()) {
                    errors.add("Add at least one ingredient");
                }
                List<IngredientLine> lines = fields.ingredients();
                for (int i = 0; i < lines.size(); i++) {
                    IngredientLine line = lines.get(i);
                    boolean picked = line.ingredientId() != null && !line.ingredientId().isBlank();
                    String label = !line.name().isBlank() ? line.name() : picked ? line.ingredientId() : "#" + (i + 1);
                    if (!picked) {
                        errors.add("Ingredient %s: pick an ingredient from the catalog".formatted(label));
                    }
                    if (line.quantity().signum() <= 0) {
                        errors.add("Ingredient %s: quantity must be greater than 0".formatted(label));
                    }
                }
            }
            case PREPARATION -> {
                Preparation prep = fields.preparation();
                if (prep.preparationMinutes() < 0) {
                    errors.add("Preparation time cannot be negative");
                }
                if (prep.cookingMinutes() < 0) {
                    errors.add("Cooking time cannot be negative");
                }
            }
            case COST_CALCULATION -> {
                BigDecimal target = fields.costCalculation().targetMargin();
                if (target != null && (target.signum() < 0 || target.compareTo(HUNDRED) >= 0)) {
                    errors.add("Target margin must be between 0 and 100%");
                }
            }
            case SALES_SETTINGS -> {
                if (discriminator == Discriminator.MENU_ITEM) {
                    SalesSettings sales = fields.salesSettings();
                    if (sales.price().signum() <= 0) {
                        errors.add("Price must be greater than 0");
                    }
                    if (sales.margin().signum() < 0) {
                        errors.add("Margin cannot be negative");
                    }
                }
            }
            case PREVIEW -> {
                // nothing to check beyond the other steps
            }
        }

        return errors;
    }

    /**
     * Validate every step the session has to pass for this creation type, plus the optional
     * steps whose data is still sent with the payload. Only steps with errors appear in the
     * result, in registry order. Used before committing.
     */
    public static Map<StepId, List<String>> validateAll(StepRegistry registry, SessionFields fields,
                                                        Discriminator discriminator) {
        var errorsByStep = new LinkedHashMap<StepId, List<String>>();
        for (StepDefinition step : registry.allSteps()) {
            if (!step.isOptional() && !step.isRequiredFor(discriminator)) {
                continue;
            }
            List<String> errors = validate(step.id(), fields, discriminator);
            if (!errors.isEmpty()) {
                errorsByStep.put(step.id(), errors);
            }
        }
        return errorsByStep;
    }
}
