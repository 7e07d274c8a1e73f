package io.phaseline.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A finalized structure artifact. Entries are kept raw so the expander can report exactly which
 * field of which entry is unusable.
 */
public record LockedStructure(String slug, String source, List<JsonNode> entries) {
    public LockedStructure {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
