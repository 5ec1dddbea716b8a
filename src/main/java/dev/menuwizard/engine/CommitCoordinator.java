package dev.menuwizard.engine;

import dev.menuwizard.backend.ApiGateway;
import dev.menuwizard.backend.CacheInvalidationListener;
import dev.menuwizard.backend.GatewayException;
import dev.menuwizard.model.*;
import dev.menuwizard.model.CommitPayload.MenuItemPayload;
import dev.menuwizard.model.CommitPayload.RecipePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Turns a finished session into one create or update call. Nothing is sent unless every
 * required step validates.
 */
public final class CommitCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(CommitCoordinator.class);

    private final StepRegistry registry;
    private final ApiGateway gateway;
    private final CacheInvalidationListener cacheListener;

    public CommitCoordinator(StepRegistry registry, ApiGateway gateway, CacheInvalidationListener cacheListener) {
        this.registry = registry;
        this.gateway = gateway;
        this.cacheListener = cacheListener;
    }

    /**
     * Validate, build the payload and send it.
     *
     * @param entityId id of the entity being edited, or null to create a new one
     * @return a future that always completes normally with the outcome
     */
    public CompletableFuture<CommitResult> commit(SessionFields fields, Discriminator discriminator, String entityId) {
        Map<StepId, List<String>> errors = StepValidator.validateAll(registry, fields, discriminator);
        if (!errors.isEmpty()) {
            LOG.info("Commit refused, steps with errors: {}", errors.keySet());
            return CompletableFuture.completedFuture(new CommitResult.ValidationFailed(errors));
        }

        CommitPayload payload = PayloadBuilder.build(fields, discriminator);
        CompletableFuture<CommittedEntity> call;
        try {
            call = send(payload, entityId);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.<CommitResult>handle((entity, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                LOG.warn("Saving {} failed", discriminator, cause);
                return new CommitResult.Failed(failureMessage(discriminator, cause));
            }
            LOG.info("Saved {} '{}' ({})", discriminator, payload.name(), entity.id());
            notifyCache(discriminator);
            return new CommitResult.Committed(discriminator, entity);
        });
    }

    private CompletableFuture<CommittedEntity> send(CommitPayload payload, String entityId) {
        CompletableFuture<CommittedEntity> call;
        if (payload instanceof RecipePayload recipe) {
            call = entityId == null ? gateway.createRecipe(recipe) : gateway.updateRecipe(entityId, recipe);
        } else {
            MenuItemPayload menuItem = (MenuItemPayload) payload;
            call = entityId == null ? gateway.createMenuItem(menuItem) : gateway.updateMenuItem(entityId, menuItem);
        }
        if (call == null) {
            throw new GatewayException("Gateway returned no response", 0);
        }
        return call.thenApply(entity -> {
            if (entity == null) {
                throw new GatewayException("Gateway returned no entity", 0);
            }
            return entity;
        });
    }

    private void notifyCache(Discriminator kind) {
        try {
            cacheListener.onEntityCommitted(kind);
        } catch (RuntimeException e) {
            // already saved
            LOG.warn("Cache invalidation after saving {} failed", kind, e);
        }
    }

    static String failureMessage(Discriminator kind, Throwable cause) {
        String what = kind == Discriminator.RECIPE ? "recipe" : "menu item";
        if (cause instanceof GatewayException rejected && rejected.status() >= 400 && rejected.status() < 500
            && rejected.getMessage() != null) {
            return "Could not save the %s: %s".formatted(what, rejected.getMessage());
        }
        return "Something went wrong while saving the %s. Please try again.".formatted(what);
    }
}
