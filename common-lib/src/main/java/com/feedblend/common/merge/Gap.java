package com.feedblend.common.merge;

import com.feedblend.common.model.Item;

import java.time.Duration;

/**
 * Slot between two consecutive real items, or before the first / after the last.
 *
 * <p>For {@code m} real items (newest first) gap {@code 0} precedes the first item,
 * gap {@code g} (1 ≤ g ≤ m−1) sits between items {@code g−1} and {@code g}, and gap
 * {@code m} follows the last. Gap {@code g ≥ 1} is therefore "after the g-th real item".
 *
 * @param index position of the gap, 0..m
 * @param newer real item just before the gap in timeline order, {@code null} for gap 0
 * @param older real item just after the gap, {@code null} for gap m
 */
public record Gap(int index, Item newer, Item older) {

    /** Smallest interior width that can hold a strictly-between timestamp. */
    static final Duration MIN_INTERIOR_WIDTH = Duration.ofNanos(2);

    public boolean isInterior() {
        return newer != null && older != null;
    }

    /** Time span of an interior gap; {@code null} for boundary gaps. */
    public Duration width() {
        return isInterior() ? Duration.between(older.getCreatedAt(), newer.getCreatedAt()) : null;
    }

    /**
     * Boundary gaps have no pair to measure and are always eligible. An interior gap
     * must span at least {@code minGapMinutes} and be wide enough to fit a timestamp
     * strictly inside it.
     */
    public boolean isEligible(long minGapMinutes) {
        if (!isInterior()) {
            return true;
        }
        Duration width = width();
        return width.compareTo(MIN_INTERIOR_WIDTH) >= 0
            && width.toMinutes() >= minGapMinutes;
    }
}
