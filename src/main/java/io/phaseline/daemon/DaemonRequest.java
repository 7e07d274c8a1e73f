package io.phaseline.daemon;

import com.fasterxml.jackson.databind.JsonNode;

public record DaemonRequest(String method, JsonNode params, Long id) {
}
