package dev.menuwizard.engine;

import dev.menuwizard.model.Discriminator;
import dev.menuwizard.model.NavigationResult;
import dev.menuwizard.model.SessionFields;
import dev.menuwizard.model.StepId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The wizard's state machine. Its states are the required steps for the current creation
 * type; that set only changes while the user is on {@link StepId#CREATION_TYPE}.
 */
public final class NavigationController {

    private static final Logger LOG = LoggerFactory.getLogger(NavigationController.class);

    public static final String LINK_BASE_PATH = "/recepthantering/wizard";

    private static final Pattern LINK_PATTERN = Pattern.compile("^" + Pattern.quote(LINK_BASE_PATH) + "/([a-z-]+)/?$");

    private final StepRegistry registry;
    private StepId currentStep;
    private final Set<StepId> completedSteps;
    private boolean busy;

    public NavigationController(StepRegistry registry) {
        this.registry = registry;
        this.currentStep = StepId.CREATION_TYPE;
        this.completedSteps = EnumSet.noneOf(StepId.class);
        this.busy = false;
    }

    public StepId currentStep() { return currentStep; }
    public boolean busy() { return busy; }

    public Set<StepId> completedSteps() {
        return completedSteps.isEmpty() ? Set.of() : Set.copyOf(completedSteps);
    }

    public boolean isCompleted(StepId step) {
        return completedSteps.contains(step);
    }

    /** Set while a commit is in flight; every transition is refused meanwhile. */
    public void setBusy(boolean busy) {
        this.busy = busy;
    }

    /** The creation type may only change on the first step. */
    public boolean canChangeDiscriminator() {
        return currentStep == StepId.CREATION_TYPE && !busy;
    }

    /**
     * Validate the current step and advance if it is clean. On the last step this does
     * nothing; committing is a separate action.
     */
    public NavigationResult goNext(SessionFields fields, Discriminator discriminator) {
        if (busy) {
            return new NavigationResult.Refused(currentStep, "commit in progress");
        }
        List<String> errors = StepValidator.validate(currentStep, fields, discriminator);
        if (!errors.isEmpty()) {
            LOG.debug("Next from '{}' blocked by {} error(s)", currentStep, errors.size());
            return new NavigationResult.Blocked(currentStep, errors);
        }

        List<StepId> steps = registry.requiredStepIds(discriminator);
        int index = steps.indexOf(currentStep);
        if (index < 0 || index == steps.size() - 1) {
            return new NavigationResult.Stayed(currentStep);
        }
        completedSteps.add(currentStep);
        return moveTo(steps.get(index + 1));
    }

    /**
     * Step back one. Never blocked by validation; on the first step this does nothing.
     */
    public NavigationResult goPrevious(Discriminator discriminator) {
        if (busy) {
            return new NavigationResult.Refused(currentStep, "commit in progress");
        }
        List<StepId> steps = registry.requiredStepIds(discriminator);
        int index = steps.indexOf(currentStep);
        if (index <= 0) {
            return new NavigationResult.Stayed(currentStep);
        }
        return moveTo(steps.get(index - 1));
    }

    /**
     * Jump to a step. Allowed when the target is completed, next to the current step, or
     * anywhere behind it. Refused moves change nothing.
     */
    public NavigationResult goToStep(StepId target, Discriminator discriminator) {
        if (busy) {
            return new NavigationResult.Refused(currentStep, "commit in progress");
        }
        if (target == currentStep) {
            return new NavigationResult.Stayed(currentStep);
        }
        List<StepId> steps = registry.requiredStepIds(discriminator);
        int targetIndex = steps.indexOf(target);
        if (targetIndex < 0) {
            return new NavigationResult.Refused(currentStep, "step '%s' is not part of this flow".formatted(target));
        }
        int currentIndex = steps.indexOf(currentStep);
        boolean completed = completedSteps.contains(target);
        boolean adjacent = Math.abs(targetIndex - currentIndex) <= 1;
        boolean behind = targetIndex <= currentIndex;
        if (!(completed || adjacent || behind)) {
            LOG.debug("Jump from '{}' to '{}' refused", currentStep, target);
            return new NavigationResult.Refused(currentStep, "step '%s' is not reachable yet".formatted(target));
        }
        return moveTo(target);
    }

    /**
     * Enter from a deep link such as {@code /recepthantering/wizard/basic-info}. The link is
     * treated like a {@link #goToStep} request; malformed links are refused.
     */
    public NavigationResult enterFromLink(String path, Discriminator discriminator) {
        Optional<StepId> target = stepFromLink(path);
        if (target.isEmpty()) {
            return new NavigationResult.Refused(currentStep, "unrecognised link '%s'".formatted(path));
        }
        return goToStep(target.get(), discriminator);
    }

    public static Optional<StepId> stepFromLink(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = LINK_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return StepId.fromId(matcher.group(1));
    }

    public static String linkFor(StepId step) {
        return LINK_BASE_PATH + "/" + step.id();
    }

    private NavigationResult moveTo(StepId target) {
        StepId from = currentStep;
        currentStep = target;
        LOG.debug("Moved '{}' -> '{}'", from, target);
        return new NavigationResult.Moved(from, target);
    }
}
