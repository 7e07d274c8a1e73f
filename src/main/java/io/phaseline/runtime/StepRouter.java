package io.phaseline.runtime;

import io.phaseline.catalog.StepCatalog;
import io.phaseline.model.Session;
import io.phaseline.model.StepDefinition;
import io.phaseline.model.StepRef;

import java.util.List;
import java.util.Optional;

/**
 * Maps an effective pipeline index to a step. Every orchestrator operation goes through
 * {@link #resolveStep(Session, int)} so that next, complete, resume and status agree.
 *
 * <p>Without generated steps the catalog is used as is. With them: indices before the dynamic
 * phase hit the catalog directly, the next {@code n} hit the generated list, and the rest are
 * shifted back onto the catalog steps that follow the dynamic phase.
 */
public final class StepRouter {
    private final StepCatalog catalog;

    public StepRouter(StepCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<StepRef> resolveStep(Session session, int index) {
        if (index < 0) {
            return Optional.empty();
        }
        List<StepDefinition> generated = session.getDynamicAgents();
        if (generated == null) {
            return index < catalog.size() ? Optional.of(StepRef.ofStatic(index)) : Optional.empty();
        }
        int start = catalog.dynamicPhaseStart();
        int end = start + generated.size() - 1;
        if (index < start) {
            return Optional.of(StepRef.ofStatic(index));
        }
        if (index <= end) {
            return Optional.of(StepRef.generated(index - start));
        }
        int staticIndex = index - (end + 1) + catalog.staticPostStartOffset();
        return staticIndex < catalog.size() ? Optional.of(StepRef.ofStatic(staticIndex)) : Optional.empty();
    }

    public StepDefinition definition(Session session, StepRef ref) {
        if (ref.isGenerated()) {
            return session.getDynamicAgents().get(ref.index());
        }
        return catalog.step(ref.index());
    }

    public Optional<StepDefinition> stepAt(Session session, int index) {
        return resolveStep(session, index).map(ref -> definition(session, ref));
    }

    public int effectiveTotal(Session session) {
        Integer frozen = session.getDynamicTotalAgents();
        return frozen != null ? frozen : catalog.size();
    }

    public int frozenTotal(int generatedCount) {
        return catalog.dynamicPhaseStart() + generatedCount + catalog.staticAfterCount();
    }

    /**
     * Phase of the step at {@code index}; past the end it stays on the final step's phase.
     */
    public int phaseAt(Session session, int index) {
        Optional<StepDefinition> step = stepAt(session, index);
        if (step.isPresent()) {
            return step.get().phase();
        }
        int last = effectiveTotal(session) - 1;
        return stepAt(session, Math.max(0, last)).map(StepDefinition::phase).orElse(session.getCurrentPhase());
    }

    public boolean expansionPending(Session session) {
        return session.getDynamicAgents() == null
                && session.getCurrentAgentIndex() >= catalog.dynamicPhaseStart();
    }

    public StepCatalog catalog() {
        return catalog;
    }
}
