package dev.menuwizard.model;

/**
 * Tunables read from the step definitions resource.
 */
public record WizardSettings(
    int historyLimit
) {
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    public static WizardSettings defaults() {
        return new WizardSettings(DEFAULT_HISTORY_LIMIT);
    }
}
