package com.feedblend.common.merge;

import com.feedblend.common.model.Item;

import java.util.ArrayList;
import java.util.List;

/**
 * Anchors injections on tag overlap. Walks real items newest first; the gap after
 * real item {@code r} is used only if it is eligible and some unused injectable
 * shares a tag with {@code r}. The best match is consumed: highest score (ties by
 * lower id), or the first match in selection order when matches are unscored.
 *
 * <p>Consumption is tracked by index over the call-local pool, never by mutating the
 * caller's list.
 */
final class TagMatchPlanner implements InjectionPlanner {

    @Override
    public List<Placement> plan(PlanningInput input) {
        List<Item> pool = input.injectable();
        boolean[] used = new boolean[pool.size()];
        List<Placement> placements = new ArrayList<>();

        for (int r = 0; r < input.realCount(); r++) {
            if (placements.size() >= input.budget()) {
                break;
            }
            Gap gap = input.gaps().get(r + 1);
            if (!gap.isEligible(input.minGapMinutes())) {
                continue;
            }
            int match = bestMatch(input.real().get(r), pool, used);
            if (match >= 0) {
                used[match] = true;
                placements.add(new Placement(gap.index(), match));
            }
        }
        return placements;
    }

    private static int bestMatch(Item anchor, List<Item> pool, boolean[] used) {
        int best = -1;
        for (int i = 0; i < pool.size(); i++) {
            if (used[i] || !anchor.sharesTagWith(pool.get(i))) {
                continue;
            }
            if (best < 0 || beats(pool.get(i), pool.get(best))) {
                best = i;
            }
        }
        return best;
    }

    private static boolean beats(Item candidate, Item current) {
        if (!candidate.hasScore()) {
            return false;
        }
        if (!current.hasScore()) {
            return true;
        }
        int byScore = Double.compare(candidate.getScore(), current.getScore());
        if (byScore != 0) {
            return byScore > 0;
        }
        return candidate.getId().compareTo(current.getId()) < 0;
    }
}
