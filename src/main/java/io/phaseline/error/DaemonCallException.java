package io.phaseline.error;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.util.Jsons;

import java.util.Map;

/**
 * A typed error returned by the daemon and re-raised on the client side.
 */
public final class DaemonCallException extends PipelineException {
    private final int code;
    private final JsonNode data;

    public DaemonCallException(ErrorKind kind, int code, String message, JsonNode data) {
        super(kind, message);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public JsonNode data() {
        return data;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> details() {
        if (data == null || !data.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(data, Map.class);
    }
}
