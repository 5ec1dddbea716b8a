package dev.menuwizard.model;

import java.util.List;

/**
 * Everything the user has entered so far. Each sub-object is immutable and is only ever
 * replaced as a whole, so a reference to an instance is also a snapshot of it.
 */
public record SessionFields(
    BasicInfo basicInfo,
    List<IngredientLine> ingredients,
    Preparation preparation,
    CostCalculation costCalculation,
    SalesSettings salesSettings
) {
    public SessionFields {
        basicInfo = basicInfo == null ? BasicInfo.empty() : basicInfo;
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        preparation = preparation == null ? Preparation.empty() : preparation;
        costCalculation = costCalculation == null ? CostCalculation.defaults() : costCalculation;
        salesSettings = salesSettings == null ? SalesSettings.defaults() : salesSettings;
    }

    public static SessionFields defaults() {
        return new SessionFields(null, null, null, null, null);
    }

    /**
     * Shallow merge: every sub-object present in the patch replaces ours, the rest are kept.
     */
    public SessionFields merge(FieldsPatch patch) {
        return new SessionFields(
            patch.basicInfo() != null ? patch.basicInfo() : basicInfo,
            patch.ingredients() != null ? patch.ingredients() : ingredients,
            patch.preparation() != null ? patch.preparation() : preparation,
            patch.costCalculation() != null ? patch.costCalculation() : costCalculation,
            patch.salesSettings() != null ? patch.salesSettings() : salesSettings
        );
    }
}
