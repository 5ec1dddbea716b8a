package dev.menuwizard.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.menuwizard.model.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the step table and wizard settings from JSON.
 */
public final class WizardDefinitionLoader {

    public static final String DEFAULT_RESOURCE = "/wizard-steps.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WizardDefinitionLoader() {}

    /**
     * Load the definition bundled on the classpath.
     */
    public static WizardDefinition loadDefault() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    public static WizardDefinition loadFromResource(String resource) throws IOException {
        try (InputStream in = WizardDefinitionLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Step definitions not found on classpath: " + resource);
            }
            return parseDefinition(MAPPER.readTree(in));
        }
    }

    public static WizardDefinition loadFromFile(Path path) throws IOException {
        return parseDefinition(MAPPER.readTree(path.toFile()));
    }

    public static WizardDefinition loadFromString(String json) throws IOException {
        return parseDefinition(MAPPER.readTree(json));
    }

    private static WizardDefinition parseDefinition(JsonNode root) {
        WizardSettings settings = parseSettings(root);
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalArgumentException("Missing 'steps' array");
        }

        var steps = new ArrayList<StepDefinition>();
        stepsNode.forEach(node -> steps.add(parseStep(node)));
        return new WizardDefinition(steps, settings);
    }

    private static WizardSettings parseSettings(JsonNode root) {
        int historyLimit = root.has("historyLimit")
            ? root.get("historyLimit").asInt() : WizardSettings.DEFAULT_HISTORY_LIMIT;
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be at least 1, was " + historyLimit);
        }
        return new WizardSettings(historyLimit);
    }

    private static StepDefinition parseStep(JsonNode node) {
        String id = node.path("id").asText();
        StepId stepId = StepId.fromId(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown step id: " + id));
        String title = node.path("title").asText();
        String description = node.path("description").asText("");
        boolean optional = node.path("optional").asBoolean(false);

        Set<Discriminator> requiredFor = null;
        if (node.has("requiredFor")) {
            requiredFor = EnumSet.noneOf(Discriminator.class);
            for (JsonNode d : node.get("requiredFor")) {
                String type = d.asText();
                requiredFor.add(Discriminator.fromId(type)
                    .orElseThrow(() -> new IllegalArgumentException(
                        "Step '%s': unknown creation type '%s'".formatted(id, type))));
            }
        }

        return new StepDefinition(stepId, title, description, optional, requiredFor);
    }
}
