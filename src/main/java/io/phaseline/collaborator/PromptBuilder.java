package io.phaseline.collaborator;

import io.phaseline.model.StepDefinition;

@FunctionalInterface
public interface PromptBuilder {
    String build(StepDefinition step, PromptContext context);
}
