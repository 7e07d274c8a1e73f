package io.phaseline.daemon;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exactly one of {@code result} and {@code error} is set. {@code id} is null only when the
 * server could not read a request id (parse failure, rejected connection).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DaemonResponse(Long id, JsonNode result, DaemonError error) {
    public static DaemonResponse ok(Long id, JsonNode result) {
        return new DaemonResponse(id, result, null);
    }

    public static DaemonResponse failure(Long id, DaemonError error) {
        return new DaemonResponse(id, null, error);
    }
}
