package io.phaseline.model;

import java.util.List;

public record PhaseDefinition(
        int id,
        String name,
        List<String> stepKeys,
        String description,
        boolean dynamic
) {
    public PhaseDefinition {
        stepKeys = stepKeys == null ? List.of() : List.copyOf(stepKeys);
    }

    public int size() {
        return stepKeys.size();
    }
}
