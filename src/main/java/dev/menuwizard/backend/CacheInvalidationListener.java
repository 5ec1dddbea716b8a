package dev.menuwizard.backend;

import dev.menuwizard.model.Discriminator;

/**
 * Told once after a successful save so dependent views can refresh.
 */
@FunctionalInterface
public interface CacheInvalidationListener {

    void onEntityCommitted(Discriminator kind);
}
