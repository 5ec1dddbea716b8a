package dev.menuwizard.engine;

import dev.menuwizard.backend.ApiGateway;
import dev.menuwizard.backend.CacheInvalidationListener;
import dev.menuwizard.backend.IngredientCatalog;
import dev.menuwizard.model.WizardDefinition;
import dev.menuwizard.model.WizardDraft;
import dev.menuwizard.model.WizardSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Opens wizard sessions. Collaborators are handed in here once and shared by every session.
 * Each "create" gets its own independent session; an existing entity can only be open in one
 * edit session at a time.
 *
 * <p>Call from the host's event thread. {@code hostExecutor} runs tasks on that thread; commit
 * results are handed back through it, so sessions and the set of open edits are only ever
 * touched there.
 */
public final class WizardSessions {

    private static final Logger LOG = LoggerFactory.getLogger(WizardSessions.class);

    private final StepRegistry registry;
    private final WizardSettings settings;
    private final CommitCoordinator commitCoordinator;
    private final IngredientCatalog catalog;
    private final Executor hostExecutor;
    private final Set<String> openEdits = new HashSet<>();

    public WizardSessions(WizardDefinition definition, ApiGateway gateway,
                          CacheInvalidationListener cacheListener, IngredientCatalog catalog,
                          Executor hostExecutor) {
        this.registry = new StepRegistry(definition.steps());
        this.settings = definition.settings();
        this.commitCoordinator = new CommitCoordinator(registry, gateway, cacheListener);
        this.catalog = catalog;
        this.hostExecutor = hostExecutor;
    }

    /**
     * Use the step definitions bundled on the classpath.
     */
    public static WizardSessions withDefaults(ApiGateway gateway, CacheInvalidationListener cacheListener,
                                              IngredientCatalog catalog, Executor hostExecutor)
        throws IOException {
        return new WizardSessions(WizardDefinitionLoader.loadDefault(), gateway, cacheListener, catalog, hostExecutor);
    }

    public StepRegistry registry() {
        return registry;
    }

    /** Start a blank session. */
    public WizardSession openCreate() {
        LOG.info("Opening wizard session for a new entity");
        return new WizardSession(registry, settings, commitCoordinator, catalog, hostExecutor,
            new WizardDraft(null, null, null), () -> {});
    }

    /**
     * Start a session pre-filled from an existing entity. It still begins on the creation
     * type step, with the type already selected.
     *
     * @throws IllegalStateException if that entity is already open in another session
     */
    public WizardSession openEdit(WizardDraft draft) {
        String id = draft.entityId();
        if (id == null) {
            throw new IllegalArgumentException("Edit draft has no entity id");
        }
        if (!openEdits.add(id)) {
            throw new IllegalStateException("Entity '%s' is already open in another wizard session".formatted(id));
        }
        LOG.info("Opening wizard session to edit {} '{}'", draft.discriminator(), id);
        return new WizardSession(registry, settings, commitCoordinator, catalog, hostExecutor, draft,
            () -> openEdits.remove(id));
    }

    public boolean isOpenForEdit(String entityId) {
        return openEdits.contains(entityId);
    }
}
