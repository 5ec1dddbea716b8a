package dev.menuwizard.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of committing a wizard session.
 */
public sealed interface CommitResult {

    /** Saved; the session is finished. */
    record Committed(Discriminator kind, CommittedEntity entity) implements CommitResult {}

    /** Some required step has errors. Nothing was sent. */
    record ValidationFailed(Map<StepId, List<String>> errorsByStep) implements CommitResult {
        public ValidationFailed {
            errorsByStep = Map.copyOf(errorsByStep);
        }
    }

    /** The gateway call failed. The session stays open for a retry. */
    record Failed(String message) implements CommitResult {}
}
