package dev.menuwizard.backend;

import dev.menuwizard.model.IngredientSummary;

import java.util.List;

/**
 * Read-only source of the ingredients a user can pick. The wizard never writes to it.
 */
@FunctionalInterface
public interface IngredientCatalog {

    List<IngredientSummary> listIngredients();
}
