package dev.menuwizard.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.menuwizard.model.CommitPayload;
import dev.menuwizard.model.WizardDraft;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads wizard drafts (pre-filled sessions) from JSON and writes payloads back out.
 */
public final class DraftLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private DraftLoader() {}

    public static WizardDraft loadFromFile(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), WizardDraft.class);
    }

    public static WizardDraft loadFromString(String json) throws IOException {
        return MAPPER.readValue(json, WizardDraft.class);
    }

    /**
     * Render a payload the way it would go over the wire.
     */
    public static String toJson(CommitPayload payload) throws IOException {
        return MAPPER.writeValueAsString(payload);
    }
}
