package dev.menuwizard.model;

/**
 * Instructions and timings, in minutes.
 */
public record Preparation(
    String instructions,
    int preparationMinutes,
    int cookingMinutes
) {
    public Preparation {
        instructions = instructions == null ? "" : instructions;
    }

    public static Preparation empty() {
        return new Preparation("", 0, 0);
    }
}
