package com.feedblend.common.merge;

import java.util.ArrayList;
import java.util.List;

/** Candidate gap after every {@code n}-th real item: gaps n, 2n, 3n, … ≤ m. */
final class AfterNPlanner extends GapSequencePlanner {

    @Override
    protected List<Integer> candidateGaps(PlanningInput input) {
        int n = input.strategy().n();
        List<Integer> gaps = new ArrayList<>();
        for (int g = n; g <= input.realCount(); g += n) {
            gaps.add(g);
        }
        return gaps;
    }
}
