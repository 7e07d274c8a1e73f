package io.phaseline.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.error.StructureInvalidException;
import io.phaseline.model.StepDefinition;
import io.phaseline.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a locked structure into the concrete step list of the dynamic phase. Stateless: freezing
 * the result into the session is the orchestrator's job.
 */
public final class DynamicExpander {
    private static final Logger log = LoggerFactory.getLogger(DynamicExpander.class);
    static final int GENERATED_TIMEOUT_SECONDS = 900;

    private final StepCatalog catalog;
    private final LockedStructureLoader loader;

    public DynamicExpander(StepCatalog catalog, LockedStructureLoader loader) {
        this.catalog = catalog;
        this.loader = loader;
    }

    public List<StepDefinition> expand(String slug) {
        LockedStructure structure = loader.load(slug);
        List<JsonNode> entries = structure.entries();
        if (entries.isEmpty()) {
            throw new StructureInvalidException("Locked structure for " + slug + " has no entries");
        }
        String previous = catalog.dynamicPhaseStart() > 0
                ? catalog.step(catalog.dynamicPhaseStart() - 1).key()
                : null;
        Set<String> seen = new HashSet<>();
        List<StepDefinition> out = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            if (entry == null || !entry.isObject()) {
                throw new StructureInvalidException("Structure entry " + i + " is not an object");
            }
            JsonNode number = entry.path("number");
            if (!number.isIntegralNumber() || !number.canConvertToInt()) {
                throw new StructureInvalidException(i, "number");
            }
            String title = requireText(entry, i, "title");
            String writer = requireText(entry, i, "writerAgent");
            int chapter = number.intValue();
            String key = String.format("ch%02d-%s", chapter, writer.trim());
            if (!seen.add(key)) {
                throw new StructureInvalidException("Structure entry " + i + " duplicates step " + key);
            }
            String output = entry.path("outputFile").asText("").trim();
            if (output.isEmpty()) {
                output = String.format("%02d-%s.md", chapter, Slugs.slugify(title));
            }
            out.add(new StepDefinition(
                    key,
                    "Chapter " + chapter + ": " + title.trim(),
                    catalog.dynamicPhase(),
                    previous == null ? List.of() : List.of(previous),
                    GENERATED_TIMEOUT_SECONDS,
                    true,
                    List.of(output),
                    describe(entry, chapter, title.trim())
            ));
            previous = key;
        }
        log.info("Expanded dynamic phase for {} into {} steps", slug, out.size());
        return out;
    }

    private static String requireText(JsonNode entry, int index, String field) {
        JsonNode value = entry.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new StructureInvalidException(index, field);
        }
        return value.asText();
    }

    private static String describe(JsonNode entry, int chapter, String title) {
        String purpose = entry.path("purpose").asText("").trim();
        StringBuilder sb = new StringBuilder();
        sb.append(purpose.isEmpty() ? "Write chapter " + chapter + ": " + title : purpose);
        int words = entry.path("targetWords").asInt(0);
        if (words > 0) {
            sb.append(" (target ").append(words).append(" words)");
        }
        return sb.toString();
    }
}
