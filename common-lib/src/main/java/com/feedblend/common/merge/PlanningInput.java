package com.feedblend.common.merge;

import com.feedblend.common.model.InjectionStrategy;
import com.feedblend.common.model.Item;

import java.util.List;

/**
 * Normalized inputs handed to an {@link InjectionPlanner}.
 *
 * @param real       real items sorted newest first
 * @param injectable injectable items in selection order (sorted, possibly shuffled)
 * @param gaps       the {@code real.size() + 1} gaps of the real sequence
 * @param budget     maximum number of placements, {@code k}
 * @param strategy   the strategy being applied
 */
public record PlanningInput(
    List<Item> real,
    List<Item> injectable,
    List<Gap> gaps,
    int budget,
    InjectionStrategy strategy
) {
    public int realCount() {
        return real.size();
    }

    public long minGapMinutes() {
        return strategy.minGapMinutes();
    }
}
