package dev.menuwizard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The closed set of wizard steps. Host UIs switch over this exhaustively to pick a form.
 */
public enum StepId {
    CREATION_TYPE("creation-type"),
    BASIC_INFO("basic-info"),
    INGREDIENTS("ingredients"),
    PREPARATION("preparation"),
    COST_CALCULATION("cost-calculation"),
    SALES_SETTINGS("sales-settings"),
    PREVIEW("preview");

    private final String id;

    StepId(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Look up a step by its wire id, e.g. {@code "basic-info"}. */
    public static Optional<StepId> fromId(String id) {
        for (StepId step : values()) {
            if (step.id.equals(id)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static StepId parse(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown step id: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
