package io.phaseline.runtime;

import io.phaseline.catalog.StepCatalog;
import io.phaseline.model.PhaseDefinition;
import io.phaseline.model.Session;
import io.phaseline.model.StepDefinition;
import io.phaseline.model.StepRef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class StepRouterTest {

    private static final StepCatalog CATALOG = StepCatalog.of(
            List.of(
                    new PhaseDefinition(1, "Before", List.of("a", "b"), "", false),
                    new PhaseDefinition(2, "Dynamic", List.of("p1", "p2"), "", true),
                    new PhaseDefinition(3, "After", List.of("x", "y"), "", false)
            ),
            List.of(step("a", 1), step("b", 1), step("p1", 2), step("p2", 2), step("x", 3), step("y", 3)),
            2
    );

    @Test
    void unexpandedSessionFollowsCatalog() {
        StepRouter router = new StepRouter(CATALOG);
        Session session = new Session();

        Assertions.assertEquals(StepRef.ofStatic(0), router.resolveStep(session, 0).orElseThrow());
        Assertions.assertEquals("p1", router.stepAt(session, 2).orElseThrow().key());
        Assertions.assertTrue(router.resolveStep(session, 6).isEmpty());
        Assertions.assertTrue(router.resolveStep(session, -1).isEmpty());
        Assertions.assertEquals(6, router.effectiveTotal(session));
    }

    @Test
    void expandedSessionRoutesThroughGeneratedSteps() {
        StepRouter router = new StepRouter(CATALOG);
        Session session = new Session();
        session.setDynamicAgents(List.of(step("ch01-w", 2), step("ch02-w", 2), step("ch03-w", 2)));
        session.setDynamicTotalAgents(router.frozenTotal(3));

        Assertions.assertEquals(7, router.effectiveTotal(session));
        Assertions.assertEquals(StepRef.ofStatic(1), router.resolveStep(session, 1).orElseThrow());
        Assertions.assertEquals(StepRef.generated(0), router.resolveStep(session, 2).orElseThrow());
        Assertions.assertEquals(StepRef.generated(2), router.resolveStep(session, 4).orElseThrow());
        Assertions.assertEquals(StepRef.ofStatic(4), router.resolveStep(session, 5).orElseThrow());
        Assertions.assertEquals("y", router.stepAt(session, 6).orElseThrow().key());
        Assertions.assertTrue(router.resolveStep(session, 7).isEmpty());

        Assertions.assertEquals(3, router.phaseAt(session, 7));
        Assertions.assertEquals(2, router.phaseAt(session, 3));
    }

    @Test
    void expansionIsPendingOnlyAtOrPastTheDynamicBoundary() {
        StepRouter router = new StepRouter(CATALOG);
        Session session = new Session();
        session.setCurrentAgentIndex(1);
        Assertions.assertFalse(router.expansionPending(session));
        session.setCurrentAgentIndex(2);
        Assertions.assertTrue(router.expansionPending(session));
        session.setDynamicAgents(List.of(step("ch01-w", 2)));
        Assertions.assertFalse(router.expansionPending(session));
    }

    private static StepDefinition step(String key, int phase) {
        return new StepDefinition(key, key, phase, List.of(), 60, true, List.of(), "");
    }
}
