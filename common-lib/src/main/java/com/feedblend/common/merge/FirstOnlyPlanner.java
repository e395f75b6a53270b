package com.feedblend.common.merge;

import java.util.ArrayList;
import java.util.List;

/** Candidate gaps after each of the first {@value #HEAD_SIZE} real items, in order. */
final class FirstOnlyPlanner extends GapSequencePlanner {

    static final int HEAD_SIZE = 10;

    @Override
    protected List<Integer> candidateGaps(PlanningInput input) {
        int last = Math.min(HEAD_SIZE, input.realCount());
        List<Integer> gaps = new ArrayList<>(last);
        for (int g = 1; g <= last; g++) {
            gaps.add(g);
        }
        return gaps;
    }
}
