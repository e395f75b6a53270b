package com.feedblend.common.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for strategies that decide gaps up front and fill them with injectables in
 * selection order. Subclasses only name their candidate gap indices; ineligible gaps
 * are skipped here without substitution, so the realized count may fall short of the
 * budget.
 */
abstract class GapSequencePlanner implements InjectionPlanner {

    /** Candidate gap indices, ascending, each within {@code [0, realCount]}. */
    protected abstract List<Integer> candidateGaps(PlanningInput input);

    @Override
    public final List<Placement> plan(PlanningInput input) {
        List<Placement> placements = new ArrayList<>();
        int nextItem = 0;
        for (int gapIndex : candidateGaps(input)) {
            if (placements.size() >= input.budget() || nextItem >= input.injectable().size()) {
                break;
            }
            if (!input.gaps().get(gapIndex).isEligible(input.minGapMinutes())) {
                continue;
            }
            placements.add(new Placement(gapIndex, nextItem++));
        }
        return placements;
    }
}
