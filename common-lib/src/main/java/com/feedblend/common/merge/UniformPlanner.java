package com.feedblend.common.merge;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spreads {@code k} injections evenly: gap {@code round(i · m / (k+1))} for
 * {@code i = 1..k}, with {@code m} the number of real items. Positions are clamped to
 * {@code [0, m]} and de-duplicated, so budgets larger than the timeline collapse onto
 * fewer gaps.
 */
final class UniformPlanner extends GapSequencePlanner {

    @Override
    protected List<Integer> candidateGaps(PlanningInput input) {
        int m = input.realCount();
        int k = input.budget();
        Set<Integer> positions = new LinkedHashSet<>();
        for (int i = 1; i <= k; i++) {
            long position = Math.round((double) i * m / (k + 1));
            positions.add((int) Math.max(0, Math.min(m, position)));
        }
        return new ArrayList<>(positions);
    }
}
