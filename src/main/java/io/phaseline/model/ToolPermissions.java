package io.phaseline.model;

import java.util.Locale;

public record ToolPermissions(boolean webSearch, boolean webFetch, boolean perplexity) {
    public static ToolPermissions none() {
        return new ToolPermissions(false, false, false);
    }

    public static ToolPermissions all() {
        return new ToolPermissions(true, true, true);
    }

    public boolean allows(String tool) {
        if (tool == null) {
            return false;
        }
        switch (tool.trim().toLowerCase(Locale.ROOT)) {
            case "websearch":
            case "web-search":
                return webSearch;
            case "webfetch":
            case "web-fetch":
                return webFetch;
            case "perplexity":
                return perplexity;
            default:
                // Anything that is not an external research tool is not gated.
                return true;
        }
    }
}
