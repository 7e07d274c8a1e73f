package io.phaseline.collaborator;

import io.phaseline.model.StepDefinition;

/**
 * Default builder: a workflow header so the executor knows where it sits, then the task.
 */
public final class WorkflowPromptBuilder implements PromptBuilder {
    @Override
    public String build(StepDefinition step, PromptContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("## WORKFLOW CONTEXT\n");
        sb.append("Agent #").append(context.position()).append('/').append(context.total())
                .append(": ").append(step.key()).append('\n');
        sb.append("Phase ").append(context.phase()).append(": ").append(context.phaseName()).append('\n');
        sb.append("Previous: ").append(context.previousKey() == null ? "none" : context.previousKey()).append('\n');
        sb.append("Next: ").append(context.nextKey() == null ? "none" : context.nextKey()).append("\n\n");
        sb.append("## TASK: ").append(step.name()).append('\n');
        if (step.description() != null && !step.description().isBlank()) {
            sb.append(step.description()).append('\n');
        }
        sb.append("\nResearch query: ").append(context.query()).append('\n');
        if (!step.expectedOutputs().isEmpty()) {
            sb.append("\nWrite output to:\n");
            for (String output : step.expectedOutputs()) {
                sb.append("- ").append(context.outputDir()).append('/').append(output).append('\n');
            }
        }
        return sb.toString();
    }
}
