package io.phaseline.model;

import java.util.List;

public record QueryIntent(
        boolean recencyRequired,
        List<String> outsideCorpusDomains,
        boolean externalSupplementationJustified,
        List<String> temporalMarkers
) {
    public QueryIntent {
        outsideCorpusDomains = outsideCorpusDomains == null ? List.of() : List.copyOf(outsideCorpusDomains);
        temporalMarkers = temporalMarkers == null ? List.of() : List.copyOf(temporalMarkers);
    }
}
