package io.phaseline.model;

import java.util.List;

/**
 * One pipeline step. {@code timeout} is in seconds; dependencies are informational only.
 */
public record StepDefinition(
        String key,
        String name,
        int phase,
        List<String> dependencies,
        int timeout,
        boolean critical,
        List<String> expectedOutputs,
        String description
) {
    public StepDefinition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        expectedOutputs = expectedOutputs == null ? List.of() : List.copyOf(expectedOutputs);
    }
}
