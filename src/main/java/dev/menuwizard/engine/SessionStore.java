package dev.menuwizard.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.menuwizard.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Sole owner of the session's {@link SessionFields}. Updates are shallow merges at the top
 * level; the current step is not stored here and cannot be set through an update.
 */
public final class SessionStore {

    private static final Logger LOG = LoggerFactory.getLogger(SessionStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<IngredientLine>> INGREDIENT_LIST = new TypeReference<>() {};

    private SessionFields fields;

    public SessionStore() {
        this(SessionFields.defaults());
    }

    public SessionStore(SessionFields initial) {
        this.fields = initial == null ? SessionFields.defaults() : initial;
    }

    public SessionFields fields() {
        return fields;
    }

    /**
     * Replace every sub-object present in the patch; leave the others as they are.
     */
    public void update(FieldsPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return;
        }
        fields = fields.merge(patch);
    }

    /**
     * Apply a JSON patch sent by a host UI, e.g. {@code {"basicInfo": {...}}}.
     * See {@link #readPatch(JsonNode)} for what gets rejected.
     *
     * @return true if the patch was applied
     */
    public boolean update(JsonNode patch) {
        Optional<FieldsPatch> parsed = readPatch(patch);
        parsed.ifPresent(this::update);
        return parsed.isPresent();
    }

    /**
     * Convert a JSON patch into a {@link FieldsPatch}, all-or-nothing. A patch that tries to set
     * {@code currentStep}, names an unknown key or carries a malformed sub-object is logged and
     * comes back empty.
     */
    public static Optional<FieldsPatch> readPatch(JsonNode patch) {
        if (patch == null || !patch.isObject()) {
            LOG.warn("Ignoring session update that is not a JSON object: {}", patch);
            return Optional.empty();
        }
        if (patch.has("currentStep")) {
            LOG.warn("Ignoring session update that tries to set currentStep; use navigation instead");
            return Optional.empty();
        }

        BasicInfo basicInfo = null;
        List<IngredientLine> ingredients = null;
        Preparation preparation = null;
        CostCalculation costCalculation = null;
        SalesSettings salesSettings = null;
        try {
            for (var entry : patch.properties()) {
                JsonNode value = entry.getValue();
                switch (entry.getKey()) {
                    case "basicInfo" -> basicInfo = MAPPER.treeToValue(value, BasicInfo.class);
                    case "ingredients" -> ingredients = MAPPER.convertValue(value, INGREDIENT_LIST);
                    case "preparation" -> preparation = MAPPER.treeToValue(value, Preparation.class);
                    case "costCalculation" -> costCalculation = MAPPER.treeToValue(value, CostCalculation.class);
                    case "salesSettings" -> salesSettings = MAPPER.treeToValue(value, SalesSettings.class);
                    default -> {
                        LOG.warn("Ignoring session update with unknown key '{}'", entry.getKey());
                        return Optional.empty();
                    }
                }
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Ignoring malformed session update: {}", e.getMessage());
            return Optional.empty();
        }

        return Optional.of(new FieldsPatch(basicInfo, ingredients, preparation, costCalculation, salesSettings));
    }
}
