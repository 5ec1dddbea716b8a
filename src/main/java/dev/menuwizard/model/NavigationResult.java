package dev.menuwizard.model;

import java.util.List;

/**
 * What a navigation request did.
 */
public sealed interface NavigationResult {

    /** The wizard moved. */
    record Moved(StepId from, StepId to) implements NavigationResult {}

    /** The current step has errors; the wizard stayed put. */
    record Blocked(StepId step, List<String> errors) implements NavigationResult {
        public Blocked {
            errors = List.copyOf(errors);
        }
    }

    /** Nothing to do, e.g. next on the last step. */
    record Stayed(StepId step) implements NavigationResult {}

    /** The move is not allowed right now. Not shown to the user. */
    record Refused(StepId step, String reason) implements NavigationResult {}

    default boolean moved() {
        return this instanceof Moved;
    }
}
