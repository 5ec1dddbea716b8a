package dev.menuwizard.model;

import java.util.List;

/**
 * The master step list and settings, as loaded from {@code wizard-steps.json}.
 */
public record WizardDefinition(
    List<StepDefinition> steps,
    WizardSettings settings
) {
    public WizardDefinition {
        steps = List.copyOf(steps);
    }
}
