package io.phaseline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CheckpointState {
    @JsonProperty("valid") VALID,
    @JsonProperty("corrupted") CORRUPTED,
    @JsonProperty("partial") PARTIAL
}
