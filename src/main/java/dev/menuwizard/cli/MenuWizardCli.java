package dev.menuwizard.cli;

import dev.menuwizard.engine.DraftLoader;
import dev.menuwizard.engine.PayloadBuilder;
import dev.menuwizard.engine.ProgressCalculator;
import dev.menuwizard.engine.StepRegistry;
import dev.menuwizard.engine.StepValidator;
import dev.menuwizard.engine.WizardDefinitionLoader;
import dev.menuwizard.model.Discriminator;
import dev.menuwizard.model.StepDefinition;
import dev.menuwizard.model.StepId;
import dev.menuwizard.model.WizardDefinition;
import dev.menuwizard.model.WizardDraft;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line companion to the wizard: shows the step flow and dry-runs drafts.
 */
@Command(
    name = "menu-wizard",
    mixinStandardHelpOptions = true,
    description = "Inspect the recipe / menu item creation flow and check drafts without saving them."
)
public class MenuWizardCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--steps", description = "List the required steps and their progress")
    private boolean steps;

    @Option(names = "--type", converter = DiscriminatorConverter.class,
        description = "Creation type for --steps: recipe or menu-item (default: not chosen)")
    private Discriminator type;

    @Option(names = "--draft", description = "Validate a draft JSON file and print the payload it would send")
    private Path draft;

    @Option(names = "--definitions", description = "Step definitions JSON (default: bundled)")
    private Path definitions;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!steps && draft == null) {
            err.println("Error: nothing to do. Use --steps or --draft <file>.");
            return 1;
        }

        WizardDefinition definition = definitions == null
            ? WizardDefinitionLoader.loadDefault()
            : WizardDefinitionLoader.loadFromFile(definitions);
        StepRegistry registry = new StepRegistry(definition.steps());

        if (steps) {
            printSteps(registry, out);
        }
        if (draft != null) {
            return checkDraft(registry, DraftLoader.loadFromFile(draft), out, err);
        }
        return 0;
    }

    private void printSteps(StepRegistry registry, PrintWriter out) {
        out.println("Steps for " + (type == null ? "(type not chosen)" : type.id()) + ":");
        for (StepDefinition step : registry.requiredSteps(type)) {
            var progress = ProgressCalculator.describe(registry, step.id(), type);
            out.printf("  %d/%d %-17s %3d%%  %s%n",
                progress.stepNumber(), progress.stepCount(), step.id().id(), progress.percent(), step.title());
        }
        out.flush();
    }

    private int checkDraft(StepRegistry registry, WizardDraft loaded, PrintWriter out, PrintWriter err)
        throws IOException {
        Map<StepId, List<String>> errors = StepValidator.validateAll(registry, loaded.fields(), loaded.discriminator());
        if (!errors.isEmpty()) {
            err.println("Draft is not ready to save:");
            errors.forEach((step, messages) -> messages.forEach(m -> err.println("  [" + step.id() + "] " + m)));
            err.flush();
            return 1;
        }
        String action = loaded.entityId() == null ? "create" : "update " + loaded.entityId();
        out.println("Would " + action + " " + loaded.discriminator().id() + ":");
        out.println(DraftLoader.toJson(PayloadBuilder.build(loaded.fields(), loaded.discriminator())));
        out.flush();
        return 0;
    }

    public static final class DiscriminatorConverter implements CommandLine.ITypeConverter<Discriminator> {
        @Override
        public Discriminator convert(String value) {
            return Discriminator.fromId(value)
                .orElseThrow(() -> new CommandLine.TypeConversionException(
                    "'%s' is not a creation type; use recipe or menu-item".formatted(value)));
        }
    }
}
