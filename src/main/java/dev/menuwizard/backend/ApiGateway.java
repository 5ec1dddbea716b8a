package dev.menuwizard.backend;

import dev.menuwizard.model.CommitPayload.MenuItemPayload;
import dev.menuwizard.model.CommitPayload.RecipePayload;
import dev.menuwizard.model.CommittedEntity;

import java.util.concurrent.CompletableFuture;

/**
 * Remote API used to save what the wizard produced. Implementations own transport, auth and
 * retries; the wizard never retries a call on its own since none of these are idempotent.
 * A failed call completes the future exceptionally, typically with a {@link GatewayException}.
 */
public interface ApiGateway {

    CompletableFuture<CommittedEntity> createRecipe(RecipePayload payload);

    CompletableFuture<CommittedEntity> updateRecipe(String id, RecipePayload payload);

    CompletableFuture<CommittedEntity> createMenuItem(MenuItemPayload payload);

    CompletableFuture<CommittedEntity> updateMenuItem(String id, MenuItemPayload payload);
}
