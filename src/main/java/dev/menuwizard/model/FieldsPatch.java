package dev.menuwizard.model;

import java.util.List;

/**
 * A partial update of {@link SessionFields}. Null components are left untouched by a merge.
 */
public record FieldsPatch(
    BasicInfo basicInfo,
    List<IngredientLine> ingredients,
    Preparation preparation,
    CostCalculation costCalculation,
    SalesSettings salesSettings
) {
    public FieldsPatch {
        ingredients = ingredients == null ? null : List.copyOf(ingredients);
    }

    public static FieldsPatch of(BasicInfo basicInfo) {
        return new FieldsPatch(basicInfo, null, null, null, null);
    }

    public static FieldsPatch of(List<IngredientLine> ingredients) {
        return new FieldsPatch(null, ingredients, null, null, null);
    }

    public static FieldsPatch of(Preparation preparation) {
        return new FieldsPatch(null, null, preparation, null, null);
    }

    public static FieldsPatch of(CostCalculation costCalculation) {
        return new FieldsPatch(null, null, null, costCalculation, null);
    }

    public static FieldsPatch of(SalesSettings salesSettings) {
        return new FieldsPatch(null, null, null, null, salesSettings);
    }

    /** A patch that replaces every sub-object, used to restore a snapshot. */
    public static FieldsPatch replacing(SessionFields fields) {
        return new FieldsPatch(fields.basicInfo(), fields.ingredients(), fields.preparation(),
            fields.costCalculation(), fields.salesSettings());
    }

    public boolean isEmpty() {
        return basicInfo == null && ingredients == null && preparation == null
            && costCalculation == null && salesSettings == null;
    }
}
