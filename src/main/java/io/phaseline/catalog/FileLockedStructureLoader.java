package io.phaseline.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.error.StructureInvalidException;
import io.phaseline.error.StructureNotLockedException;
import io.phaseline.error.StructureNotReadyException;
import io.phaseline.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code research/<slug>/chapter-structure.json}.
 */
public final class FileLockedStructureLoader implements LockedStructureLoader {
    private final PhaselineConfig config;

    public FileLockedStructureLoader(PhaselineConfig config) {
        this.config = config;
    }

    @Override
    public LockedStructure load(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new StructureNotReadyException(String.valueOf(slug));
        }
        Path file = config.structureFile(slug);
        if (!Files.isRegularFile(file)) {
            throw new StructureNotReadyException(slug);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new StructureInvalidException("Structure file is not valid JSON: " + file, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read structure file: " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new StructureInvalidException("Structure file is not a JSON object: " + file);
        }
        if (!root.path("locked").asBoolean(false)) {
            throw new StructureNotLockedException(slug);
        }
        JsonNode chapters = root.path("chapters");
        if (!chapters.isArray()) {
            throw new StructureInvalidException("Structure file has no chapters array: " + file);
        }
        List<JsonNode> entries = new ArrayList<>();
        chapters.forEach(entries::add);
        return new LockedStructure(slug, file.toString(), entries);
    }
}
