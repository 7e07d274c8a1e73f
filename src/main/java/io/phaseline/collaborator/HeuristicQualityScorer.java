package io.phaseline.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.model.StepDefinition;

public final class HeuristicQualityScorer implements QualityScorer {
    static final int TARGET_WORDS = 500;

    @Override
    public double score(JsonNode output, StepDefinition step) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            return 0.0d;
        }
        String text = output.isTextual() ? output.asText() : output.toString();
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0.0d;
        }
        int words = trimmed.split("\\s+").length;
        double length = Math.min(1.0d, words / (double) TARGET_WORDS) * 0.8d;
        double structure = 0.0d;
        if (trimmed.contains("\n#") || trimmed.startsWith("#")) {
            structure += 0.1d;
        }
        if (trimmed.contains("\n- ") || trimmed.contains("\n1. ")) {
            structure += 0.1d;
        }
        return Math.max(0.0d, Math.min(1.0d, length + structure));
    }
}
