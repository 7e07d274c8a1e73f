package io.phaseline.error;

import java.util.LinkedHashMap;
import java.util.Map;

public final class StructureInvalidException extends PipelineException {
    private final int index;
    private final String field;

    public StructureInvalidException(String message) {
        this(message, -1, null, null);
    }

    public StructureInvalidException(String message, Throwable cause) {
        this(message, -1, null, cause);
    }

    public StructureInvalidException(int index, String field) {
        this("Structure entry " + index + " is missing required field '" + field + "'", index, field, null);
    }

    private StructureInvalidException(String message, int index, String field, Throwable cause) {
        super(ErrorKind.STRUCTURE_INVALID, message, cause);
        this.index = index;
        this.field = field;
    }

    public int index() {
        return index;
    }

    public String field() {
        return field;
    }

    @Override
    public Map<String, Object> details() {
        if (field == null) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("index", index);
        out.put("field", field);
        return out;
    }
}
