package dev.menuwizard.engine;

import dev.menuwizard.model.Discriminator;
import dev.menuwizard.model.StepId;

import java.util.List;

/**
 * Progress figures for the navigation bar. Always derived from the required steps of the
 * current creation type, so they shift when that choice changes.
 */
public final class ProgressCalculator {

    public record Progress(int stepNumber, int stepCount, int percent) {}

    private ProgressCalculator() {}

    /**
     * Percentage through the flow, rounded to a whole number. A step outside the flow counts
     * as not started.
     */
    public static int progress(StepRegistry registry, StepId currentStep, Discriminator discriminator) {
        return describe(registry, currentStep, discriminator).percent();
    }

    public static Progress describe(StepRegistry registry, StepId currentStep, Discriminator discriminator) {
        List<StepId> steps = registry.requiredStepIds(discriminator);
        int stepNumber = steps.indexOf(currentStep) + 1;
        int percent = (int) Math.round(stepNumber * 100.0 / steps.size());
        return new Progress(stepNumber, steps.size(), percent);
    }
}
