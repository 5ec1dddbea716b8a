package dev.menuwizard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * What the wizard is creating. Chosen on the first step; decides which later steps are required.
 */
public enum Discriminator {
    RECIPE("recipe"),
    MENU_ITEM("menu-item");

    private final String id;

    Discriminator(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<Discriminator> fromId(String id) {
        for (Discriminator d : values()) {
            if (d.id.equals(id)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Discriminator parse(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown creation type: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
