package io.phaseline.model;

public record SessionError(String stepKey, String message, long timestamp) {
}
