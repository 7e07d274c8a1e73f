package io.phaseline.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.model.StepDefinition;

/**
 * Scores a step output in [0, 1]. A missing output is passed as null.
 */
@FunctionalInterface
public interface QualityScorer {
    double score(JsonNode output, StepDefinition step);
}
