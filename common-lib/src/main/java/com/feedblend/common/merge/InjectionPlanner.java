package com.feedblend.common.merge;

import java.util.List;

/**
 * Chooses where injectable items go for one strategy type.
 *
 * <p>Implementations must be stateless and deterministic, must place at most one item
 * per gap, must never place into a gap that fails {@link Gap#isEligible(long)}, and must
 * return at most {@link PlanningInput#budget()} placements ordered by gap index.
 */
public interface InjectionPlanner {

    List<Placement> plan(PlanningInput input);
}
