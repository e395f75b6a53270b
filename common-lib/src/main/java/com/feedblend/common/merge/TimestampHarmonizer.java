package com.feedblend.common.merge;

import com.feedblend.common.model.Item;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes timestamps for injected items so the merged timeline stays strictly
 * descending without a re-sort.
 *
 * <ul>
 *   <li>Interior gap: {@code older + (newer − older) × 0.6}, i.e. nearer the newer
 *       post, nudged by one nanosecond if it would touch either boundary.</li>
 *   <li>Before the first real item: {@code first + 1s}.</li>
 *   <li>After the last real item: {@code last − 1s}.</li>
 * </ul>
 */
public final class TimestampHarmonizer {

    /** Numerator / denominator of the position inside an interior gap, measured from the older side. */
    static final long GAP_RATIO_NUM = 3;
    static final long GAP_RATIO_DEN = 5;

    static final Duration BOUNDARY_OFFSET = Duration.ofSeconds(1);

    /** Step used to separate injected items that share a timestamp when no real items exist. */
    static final Duration TIE_STEP = Duration.ofMillis(1);

    private TimestampHarmonizer() {}

    public static Instant forGap(Gap gap) {
        if (gap.isInterior()) {
            return between(gap.newer().getCreatedAt(), gap.older().getCreatedAt());
        }
        if (gap.older() != null) {
            return gap.older().getCreatedAt().plus(BOUNDARY_OFFSET);
        }
        if (gap.newer() != null) {
            return gap.newer().getCreatedAt().minus(BOUNDARY_OFFSET);
        }
        throw new IllegalArgumentException("Gap " + gap.index() + " has no neighbouring real item");
    }

    /**
     * @param newer later instant (appears first in the timeline)
     * @param older earlier instant; must be at least 2ns before {@code newer}
     * @return an instant strictly between the two
     */
    public static Instant between(Instant newer, Instant older) {
        Duration width = Duration.between(older, newer);
        Instant candidate = older.plus(width.multipliedBy(GAP_RATIO_NUM).dividedBy(GAP_RATIO_DEN));
        if (!candidate.isAfter(older)) {
            candidate = older.plusNanos(1);
        }
        if (!candidate.isBefore(newer)) {
            candidate = newer.minusNanos(1);
        }
        return candidate;
    }

    /**
     * Returns timestamps for {@code items} (already sorted newest first) where every
     * entry is strictly older than the previous one. Entries that tie with or exceed
     * their predecessor are pushed {@link #TIE_STEP} below it.
     */
    public static List<Instant> strictlyDescending(List<Item> items) {
        List<Instant> result = new ArrayList<>(items.size());
        Instant previous = null;
        for (Item item : items) {
            Instant ts = item.getCreatedAt();
            if (previous != null && !ts.isBefore(previous)) {
                ts = previous.minus(TIE_STEP);
            }
            result.add(ts);
            previous = ts;
        }
        return result;
    }
}
