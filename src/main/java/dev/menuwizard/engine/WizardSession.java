package dev.menuwizard.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.menuwizard.backend.IngredientCatalog;
import dev.menuwizard.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * One in-progress run of the creation wizard. Every user action goes through here: data
 * changes are snapshotted for undo before they are merged, "next" validates the current
 * step, and commit hands the fields to the {@link CommitCoordinator}.
 *
 * <p>Not thread-safe. A session is driven from the host UI's event thread. The commit's gateway
 * call may complete on any thread, so its result is applied through {@code hostExecutor},
 * which must run tasks on that same event thread.
 */
public final class WizardSession {

    private static final Logger LOG = LoggerFactory.getLogger(WizardSession.class);

    private final StepRegistry registry;
    private final SessionStore store;
    private final HistoryManager history;
    private final NavigationController navigation;
    private final CommitCoordinator commitCoordinator;
    private final IngredientCatalog catalog;
    private final Executor hostExecutor;
    private final Runnable onClose;
    private final String entityId;
    private final Map<StepId, List<String>> errorsByStep = new EnumMap<>(StepId.class);

    private Discriminator discriminator;
    private boolean editGroupOpen;
    private boolean closed;

    WizardSession(StepRegistry registry, WizardSettings settings, CommitCoordinator commitCoordinator,
                  IngredientCatalog catalog, Executor hostExecutor, WizardDraft seed, Runnable onClose) {
        this.registry = registry;
        this.store = new SessionStore(seed.fields());
        this.history = new HistoryManager(store, settings.historyLimit());
        this.navigation = new NavigationController(registry);
        this.commitCoordinator = commitCoordinator;
        this.catalog = catalog;
        this.hostExecutor = hostExecutor;
        this.onClose = onClose;
        this.entityId = seed.entityId();
        this.discriminator = seed.discriminator();
    }

    // --- state -------------------------------------------------------------------------

    public StepId currentStep() { return navigation.currentStep(); }
    public Discriminator discriminator() { return discriminator; }
    public SessionFields fields() { return store.fields(); }
    public Optional<String> entityId() { return Optional.ofNullable(entityId); }
    public boolean isEditing() { return entityId != null; }
    public boolean isBusy() { return navigation.busy(); }
    public boolean isClosed() { return closed; }
    public boolean canUndo() { return history.canUndo(); }
    public boolean canRedo() { return history.canRedo(); }
    public Set<StepId> completedSteps() { return navigation.completedSteps(); }

    public List<String> errors(StepId step) {
        return errorsByStep.getOrDefault(step, List.of());
    }

    public Map<StepId, List<String>> errorsByStep() {
        return Map.copyOf(errorsByStep);
    }

    public List<StepDefinition> requiredSteps() {
        return registry.requiredSteps(discriminator);
    }

    public int progress() {
        return ProgressCalculator.progress(registry, currentStep(), discriminator);
    }

    public ProgressCalculator.Progress progressDetails() {
        return ProgressCalculator.describe(registry, currentStep(), discriminator);
    }

    /** Whether the next button should be enabled. */
    public boolean canGoNext() {
        List<StepId> steps = registry.requiredStepIds(discriminator);
        return !closed && !isBusy()
            && steps.indexOf(currentStep()) < steps.size() - 1
            && StepValidator.validate(currentStep(), fields(), discriminator).isEmpty();
    }

    public boolean canGoPrevious() {
        return !closed && !isBusy() && currentStep() != StepId.CREATION_TYPE;
    }

    public List<IngredientSummary> availableIngredients() {
        return catalog.listIngredients();
    }

    // --- data --------------------------------------------------------------------------

    /**
     * Choose recipe or menu item. Only possible on the first step; returns false otherwise.
     */
    public boolean chooseDiscriminator(Discriminator choice) {
        ensureOpen();
        if (!navigation.canChangeDiscriminator()) {
            LOG.debug("Creation type change refused on step '{}'", currentStep());
            return false;
        }
        if (choice != discriminator) {
            history.discardRedo();
            discriminator = choice;
        }
        errorsByStep.remove(StepId.CREATION_TYPE);
        return true;
    }

    /**
     * One discrete user action: snapshot, then merge.
     */
    public void update(FieldsPatch patch) {
        ensureOpen();
        settle();
        history.recordBeforeChange();
        store.update(patch);
        errorsByStep.remove(currentStep());
    }

    /**
     * Apply a JSON patch from the host UI as one discrete action.
     *
     * @return false if the patch was rejected, in which case nothing changed
     */
    public boolean update(JsonNode patch) {
        ensureOpen();
        Optional<FieldsPatch> parsed = SessionStore.readPatch(patch);
        parsed.ifPresent(this::update);
        return parsed.isPresent();
    }

    /**
     * Apply an edit that is still in progress, such as typing. Only the first edit of a group
     * is snapshotted; {@link #settle()} ends the group.
     */
    public void editTransient(FieldsPatch patch) {
        ensureOpen();
        if (!editGroupOpen) {
            history.recordBeforeChange();
            editGroupOpen = true;
        }
        store.update(patch);
        errorsByStep.remove(currentStep());
    }

    /** The host UI's commit point for transient edits (blur, input settled). */
    public void settle() {
        editGroupOpen = false;
    }

    public void addIngredient(IngredientSummary ingredient, BigDecimal quantity, String unit) {
        var lines = new ArrayList<>(fields().ingredients());
        lines.add(IngredientLine.from(ingredient, quantity, unit));
        update(FieldsPatch.of(lines));
    }

    public void replaceIngredient(int index, IngredientLine line) {
        var lines = new ArrayList<>(fields().ingredients());
        Objects.checkIndex(index, lines.size());
        lines.set(index, line);
        update(FieldsPatch.of(lines));
    }

    public void removeIngredient(int index) {
        var lines = new ArrayList<>(fields().ingredients());
        Objects.checkIndex(index, lines.size());
        lines.remove(index);
        update(FieldsPatch.of(lines));
    }

    /** Set the price; the margin follows. */
    public void changePrice(BigDecimal price) {
        update(FieldsPatch.of(PriceMarginSync.withPrice(fields().salesSettings(), totalCost(), price)));
    }

    /** Set the margin; the price follows. */
    public void changeMargin(BigDecimal margin) {
        update(FieldsPatch.of(PriceMarginSync.withMargin(fields().salesSettings(), totalCost(), margin)));
    }

    /**
     * The computed total cost if the cost step has produced one, otherwise the sum of the
     * ingredient lines whose unit cost is known.
     */
    public BigDecimal totalCost() {
        BigDecimal computed = fields().costCalculation().totalCost();
        if (computed != null) {
            return computed;
        }
        return fields().ingredients().stream()
            .filter(line -> line.costPerUnit() != null)
            .map(line -> line.costPerUnit().multiply(line.quantity()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // --- history -----------------------------------------------------------------------

    /** Allowed while a commit is in flight; the request already sent is unaffected. */
    public boolean undo() {
        ensureOpen();
        settle();
        boolean undone = history.undo();
        if (undone) {
            errorsByStep.remove(currentStep());
        }
        return undone;
    }

    public boolean redo() {
        ensureOpen();
        settle();
        boolean redone = history.redo();
        if (redone) {
            errorsByStep.remove(currentStep());
        }
        return redone;
    }

    // --- navigation --------------------------------------------------------------------

    public NavigationResult goNext() {
        ensureOpen();
        settle();
        NavigationResult result = navigation.goNext(fields(), discriminator);
        if (result instanceof NavigationResult.Blocked blocked) {
            errorsByStep.put(blocked.step(), blocked.errors());
        } else if (result instanceof NavigationResult.Moved moved) {
            errorsByStep.remove(moved.from());
        }
        return result;
    }

    public NavigationResult goPrevious() {
        ensureOpen();
        settle();
        return navigation.goPrevious(discriminator);
    }

    public NavigationResult goToStep(StepId target) {
        ensureOpen();
        settle();
        return navigation.goToStep(target, discriminator);
    }

    public NavigationResult enterFromLink(String path) {
        ensureOpen();
        settle();
        return navigation.enterFromLink(path, discriminator);
    }

    // --- lifecycle ---------------------------------------------------------------------

    /**
     * Save the session. Only available on the preview step and not while a save is pending.
     * On success the session closes; otherwise it stays open with the errors recorded.
     */
    public CompletableFuture<CommitResult> commit() {
        ensureOpen();
        if (isBusy()) {
            throw new IllegalStateException("A save is already in progress");
        }
        if (currentStep() != StepId.PREVIEW) {
            throw new IllegalStateException("Commit is only available on the preview step, not '%s'"
                .formatted(currentStep()));
        }
        settle();
        errorsByStep.remove(StepId.PREVIEW);
        navigation.setBusy(true);

        CompletableFuture<CommitResult> pending;
        try {
            pending = commitCoordinator.commit(fields(), discriminator, entityId);
        } catch (RuntimeException e) {
            navigation.setBusy(false);
            throw e;
        }
        return pending.handleAsync((result, error) -> {
            navigation.setBusy(false);
            if (error != null) {
                throw error instanceof CompletionException completion ? completion : new CompletionException(error);
            }
            return applyCommitResult(result);
        }, hostExecutor);
    }

    /**
     * Discard the session. The host UI asks for confirmation first. Cancelling twice is harmless.
     */
    public void cancel() {
        if (closed) {
            return;
        }
        LOG.info("Wizard session cancelled on step '{}'", currentStep());
        close();
    }

    private CommitResult applyCommitResult(CommitResult result) {
        if (result instanceof CommitResult.Committed) {
            close();
        } else if (result instanceof CommitResult.ValidationFailed failed) {
            errorsByStep.clear();
            errorsByStep.putAll(failed.errorsByStep());
        } else if (result instanceof CommitResult.Failed failed) {
            errorsByStep.put(StepId.PREVIEW, List.of(failed.message()));
        }
        return result;
    }

    private void close() {
        closed = true;
        editGroupOpen = false;
        history.clear();
        onClose.run();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Wizard session is closed");
        }
    }
}
