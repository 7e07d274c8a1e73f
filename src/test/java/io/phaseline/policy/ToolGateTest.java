package io.phaseline.policy;

import io.phaseline.model.CoverageGrade;
import io.phaseline.model.DataSourceMode;
import io.phaseline.model.QueryIntent;
import io.phaseline.model.ToolPermissions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ToolGateTest {

    @Test
    void modeDecidesBeforeCoverage() {
        QueryIntent plain = ToolGate.analyzeQueryIntent("graph theory foundations");
        Assertions.assertEquals(ToolPermissions.none(),
                ToolGate.resolvePermissions(DataSourceMode.LOCAL, CoverageGrade.NONE, plain));
        Assertions.assertEquals(ToolPermissions.all(),
                ToolGate.resolvePermissions(DataSourceMode.EXTERNAL, CoverageGrade.HIGH, plain));
        Assertions.assertEquals(ToolPermissions.all(),
                ToolGate.resolvePermissions(null, CoverageGrade.HIGH, plain));
    }

    @Test
    void hybridOpensOnlyWhenCoverageIsThinOrQueryNeedsIt() {
        QueryIntent plain = ToolGate.analyzeQueryIntent("graph theory foundations");
        Assertions.assertEquals(ToolPermissions.all(),
                ToolGate.resolvePermissions(DataSourceMode.HYBRID, CoverageGrade.LOW, plain));
        Assertions.assertEquals(ToolPermissions.none(),
                ToolGate.resolvePermissions(DataSourceMode.HYBRID, CoverageGrade.MED, plain));

        QueryIntent recent = ToolGate.analyzeQueryIntent("Latest results on graph coloring");
        Assertions.assertEquals(ToolPermissions.all(),
                ToolGate.resolvePermissions(DataSourceMode.HYBRID, CoverageGrade.HIGH, recent));
    }

    @Test
    void intentDetectsMarkersYearsAndDomains() {
        QueryIntent recent = ToolGate.analyzeQueryIntent("Emerging methods since 2023");
        Assertions.assertTrue(recent.recencyRequired());
        Assertions.assertEquals(List.of("emerging"), recent.temporalMarkers());
        Assertions.assertTrue(recent.externalSupplementationJustified());

        QueryIntent year = ToolGate.analyzeQueryIntent("survey of results from 2031");
        Assertions.assertTrue(year.recencyRequired());
        Assertions.assertTrue(year.temporalMarkers().isEmpty());

        QueryIntent domain = ToolGate.analyzeQueryIntent("CRISPR off-target effects");
        Assertions.assertFalse(domain.recencyRequired());
        Assertions.assertEquals(List.of("CRISPR"), domain.outsideCorpusDomains());
        Assertions.assertTrue(domain.externalSupplementationJustified());

        QueryIntent none = ToolGate.analyzeQueryIntent("knowledge renewal in archives");
        Assertions.assertFalse(none.recencyRequired());
        Assertions.assertFalse(none.externalSupplementationJustified());
    }

    @Test
    void containsWordRespectsWordBoundaries() {
        Assertions.assertTrue(ToolGate.containsWord("what is new here", "new"));
        Assertions.assertFalse(ToolGate.containsWord("renewal", "new"));
        Assertions.assertTrue(ToolGate.containsWord("state-of-the-art models", "state-of-the-art"));
        Assertions.assertTrue(ToolGate.containsWord("gpt-4 evaluation", "GPT-4"));
    }

    @Test
    void permissionsGateOnlyResearchTools() {
        ToolPermissions none = ToolPermissions.none();
        Assertions.assertFalse(none.allows("webSearch"));
        Assertions.assertFalse(none.allows("web-fetch"));
        Assertions.assertFalse(none.allows("Perplexity"));
        Assertions.assertTrue(none.allows("read"));
        Assertions.assertFalse(none.allows(null));
    }
}
