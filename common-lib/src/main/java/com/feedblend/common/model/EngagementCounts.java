package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public engagement counters of an {@link Item}. Negative inputs are clamped to zero.
 */
public record EngagementCounts(
    @JsonProperty("replies")   long replies,
    @JsonProperty("boosts")    long boosts,
    @JsonProperty("favorites") long favorites
) {
    public static final EngagementCounts NONE = new EngagementCounts(0, 0, 0);

    public EngagementCounts {
        replies   = Math.max(0, replies);
        boosts    = Math.max(0, boosts);
        favorites = Math.max(0, favorites);
    }

    /** Sum of the three counters, saturating at {@link Long#MAX_VALUE}. */
    public long total() {
        try {
            return Math.addExact(Math.addExact(replies, boosts), favorites);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
