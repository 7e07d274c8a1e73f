package io.phaseline.model;

import java.util.List;

/**
 * Immutable progress marker taken after a completed step. {@code snapshotPath} is null when
 * there was no external context to capture.
 */
public record Checkpoint(
        String id,
        long timestamp,
        int phase,
        String stepKey,
        String sessionId,
        String snapshotPath,
        List<String> completedAgents,
        double quality,
        CheckpointState state
) {
    public Checkpoint {
        completedAgents = completedAgents == null ? List.of() : List.copyOf(completedAgents);
        state = state == null ? CheckpointState.VALID : state;
    }
}
