package dev.menuwizard.engine;

import dev.menuwizard.model.Discriminator;
import dev.menuwizard.model.StepDefinition;
import dev.menuwizard.model.StepId;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed, ordered list of wizard steps and the rule deciding which of them a session
 * has to walk through.
 */
public final class StepRegistry {

    private final List<StepDefinition> steps;

    public StepRegistry(List<StepDefinition> steps) {
        List<String> errors = check(steps);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid step definitions: " + String.join("; ", errors));
        }
        this.steps = List.copyOf(steps);
    }

    /**
     * Check a master list. Returns an empty list if usable, or the problems found.
     */
    public static List<String> check(List<StepDefinition> steps) {
        var errors = new ArrayList<String>();
        if (steps == null || steps.isEmpty()) {
            errors.add("No steps defined");
            return errors;
        }

        Set<StepId> seen = EnumSet.noneOf(StepId.class);
        for (StepDefinition step : steps) {
            if (step.id() == null) {
                errors.add("Step with title '%s' has no id".formatted(step.title()));
                continue;
            }
            if (!seen.add(step.id())) {
                errors.add("Duplicate step '%s'".formatted(step.id()));
            }
            if (step.title() == null || step.title().isBlank()) {
                errors.add("Step '%s' has missing or empty title".formatted(step.id()));
            }
            if (step.requiredFor() != null && step.requiredFor().isEmpty()) {
                errors.add("Step '%s' has an empty requiredFor set".formatted(step.id()));
            }
        }

        StepDefinition first = steps.get(0);
        StepDefinition last = steps.get(steps.size() - 1);
        if (first.id() != StepId.CREATION_TYPE) {
            errors.add("First step must be '%s' but was '%s'".formatted(StepId.CREATION_TYPE, first.id()));
        }
        if (last.id() != StepId.PREVIEW) {
            errors.add("Last step must be '%s' but was '%s'".formatted(StepId.PREVIEW, last.id()));
        }
        for (StepDefinition end : List.of(first, last)) {
            if (end.isOptional() || end.requiredFor() != null) {
                errors.add("Step '%s' must be required for every creation type".formatted(end.id()));
            }
        }
        return errors;
    }

    /** Every defined step, in order. */
    public List<StepDefinition> allSteps() {
        return steps;
    }

    /**
     * The steps a session walks through for the given creation type, in master order.
     * {@code discriminator} may be null before the user has chosen.
     */
    public List<StepDefinition> requiredSteps(Discriminator discriminator) {
        return steps.stream()
            .filter(step -> step.isRequiredFor(discriminator))
            .toList();
    }

    /** Just the ids of {@link #requiredSteps}. */
    public List<StepId> requiredStepIds(Discriminator discriminator) {
        return requiredSteps(discriminator).stream()
            .map(StepDefinition::id)
            .toList();
    }

    public Optional<StepDefinition> definition(StepId id) {
        return steps.stream().filter(step -> step.id() == id).findFirst();
    }
}
