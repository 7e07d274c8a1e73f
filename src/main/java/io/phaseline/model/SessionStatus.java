package io.phaseline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SessionStatus {
    @JsonProperty("running") RUNNING,
    @JsonProperty("paused") PAUSED,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
