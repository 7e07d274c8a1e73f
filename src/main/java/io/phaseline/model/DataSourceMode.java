package io.phaseline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Where a session is allowed to look for material: local corpus only, external tools only
 * when justified, or external tools always.
 */
public enum DataSourceMode {
    @JsonProperty("local") LOCAL,
    @JsonProperty("hybrid") HYBRID,
    @JsonProperty("external") EXTERNAL;

    public static DataSourceMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXTERNAL;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "local":
                return LOCAL;
            case "hybrid":
                return HYBRID;
            case "external":
                return EXTERNAL;
            default:
                throw new IllegalArgumentException("Unknown data source mode: " + raw);
        }
    }
}
