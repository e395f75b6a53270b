package com.feedblend.common.scoring;

/**
 * Raw term values (each in [0,1]) and the weighted total produced for one item,
 * plus the reason label of the largest weighted contribution.
 */
public record ScoreBreakdown(
    double authorTerm,
    double engagementTerm,
    double recencyTerm,
    double score,
    String reason
) {
    public static final String REASON_AUTHOR     = "From an author you might like";
    public static final String REASON_ENGAGEMENT = "Popular with other users";
    public static final String REASON_RECENCY    = "Recently posted";
    public static final String REASON_DEFAULT    = "Recommended for you";
}
