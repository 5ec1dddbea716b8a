package dev.menuwizard.engine;

import dev.menuwizard.backend.ApiGateway;
import dev.menuwizard.backend.CacheInvalidationListener;
import dev.menuwizard.model.CommitPayload;
import dev.menuwizard.model.CommitPayload.MenuItemPayload;
import dev.menuwizard.model.CommitPayload.RecipePayload;
import dev.menuwizard.model.CommittedEntity;
import dev.menuwizard.model.Discriminator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fake gateway and cache listener. Records every call and answers with {@link #nextResponse},
 * or with an immediate success when that is null.
 */
class RecordingGateway implements ApiGateway, CacheInvalidationListener {

    record Call(String operation, String id, CommitPayload payload) {}

    final List<Call> calls = new ArrayList<>();
    final List<Discriminator> invalidations = new ArrayList<>();
    CompletableFuture<CommittedEntity> nextResponse;

    @Override
    public CompletableFuture<CommittedEntity> createRecipe(RecipePayload payload) {
        return answer(new Call("createRecipe", null, payload));
    }

    @Override
    public CompletableFuture<CommittedEntity> updateRecipe(String id, RecipePayload payload) {
        return answer(new Call("updateRecipe", id, payload));
    }

    @Override
    public CompletableFuture<CommittedEntity> createMenuItem(MenuItemPayload payload) {
        return answer(new Call("createMenuItem", null, payload));
    }

    @Override
    public CompletableFuture<CommittedEntity> updateMenuItem(String id, MenuItemPayload payload) {
        return answer(new Call("updateMenuItem", id, payload));
    }

    @Override
    public void onEntityCommitted(Discriminator kind) {
        invalidations.add(kind);
    }

    Call lastCall() {
        return calls.get(calls.size() - 1);
    }

    private CompletableFuture<CommittedEntity> answer(Call call) {
        calls.add(call);
        if (nextResponse != null) {
            return nextResponse;
        }
        String id = call.id() != null ? call.id() : "new-" + calls.size();
        return CompletableFuture.completedFuture(new CommittedEntity(id, call.payload().name()));
    }
}
