package dev.menuwizard.model;

import java.util.Set;

/**
 * Static description of one wizard step.
 */
public record StepDefinition(
    StepId id,
    String title,
    String description,
    boolean isOptional,
    Set<Discriminator> requiredFor // null means required for every creation type
) {
    public StepDefinition {
        requiredFor = requiredFor == null ? null : Set.copyOf(requiredFor);
    }

    /**
     * Whether this step takes part in navigation for the given creation type.
     * A conditional step is never required before the creation type is chosen.
     */
    public boolean isRequiredFor(Discriminator discriminator) {
        if (isOptional) {
            return false;
        }
        if (requiredFor == null) {
            return true;
        }
        return discriminator != null && requiredFor.contains(discriminator);
    }
}
