package io.phaseline.model;

public record ToolUsageEntry(
        long timestamp,
        String agentKey,
        String tool,
        String justification,
        CoverageGrade coverageGradeAtTime,
        boolean allowed
) {
}
