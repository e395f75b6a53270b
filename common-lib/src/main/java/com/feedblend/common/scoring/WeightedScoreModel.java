package com.feedblend.common.scoring;

import com.feedblend.common.model.EngagementCounts;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.WeightConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Default {@link ScoreModel}: a convex combination of three terms.
 *
 * <h3>Terms</h3>
 * <pre>
 *   author     = affinity(author) / maxAffinity          (0 if unknown; population
 *                                                         average when anonymized)
 *   engagement = min(1, ln(1 + replies + boosts + favorites) / 10)
 *   recency    = exp(-ageDays / decayDays)               (future items: age = 0)
 *
 *   score      = wA·author + wE·engagement + wR·recency  (weights normalized to sum 1)
 * </pre>
 *
 * <p>The log scale keeps very popular posts from dominating; it saturates at
 * roughly 22k interactions.
 *
 * <p>This class is stateless and thread-safe.
 */
public class WeightedScoreModel implements ScoreModel {

    /** Divisor of the log-scaled engagement total. */
    static final double ENGAGEMENT_LOG_SCALE = 10.0;

    private static final double SECONDS_PER_DAY = 24.0 * 3600.0;

    @Override
    public double score(Item item, SignalProfile profile, WeightConfig weights) {
        return explain(item, profile, weights).score();
    }

    @Override
    public ScoreBreakdown explain(Item item, SignalProfile profile, WeightConfig weights) {
        WeightConfig w = weights.normalized();

        double author     = authorTerm(item, profile);
        double engagement = engagementTerm(item.getEngagement());
        double recency    = recencyTerm(item.getCreatedAt(), profile.now(), w.decayDays());

        double authorPart     = w.authorWeight()     * author;
        double engagementPart = w.engagementWeight() * engagement;
        double recencyPart    = w.recencyWeight()    * recency;

        double total = clamp(authorPart + engagementPart + recencyPart);
        return new ScoreBreakdown(author, engagement, recency, total,
                                  dominantReason(authorPart, engagementPart, recencyPart));
    }

    static double authorTerm(Item item, SignalProfile profile) {
        if (profile.anonymized()) {
            return clamp(profile.populationAffinity());
        }
        if (item.getAuthorId() == null) {
            return 0.0;
        }
        Double affinity = profile.authorAffinity().get(item.getAuthorId());
        double max = profile.maxAffinity();
        if (affinity == null || max <= 0.0) {
            return 0.0;
        }
        return clamp(affinity / max);
    }

    static double engagementTerm(EngagementCounts counts) {
        return clamp(Math.log1p(counts.total()) / ENGAGEMENT_LOG_SCALE);
    }

    static double recencyTerm(Instant createdAt, Instant now, double decayDays) {
        Duration age = Duration.between(createdAt, now);
        double ageDays = Math.max(0.0, (age.getSeconds() + age.getNano() / 1e9) / SECONDS_PER_DAY);
        if (decayDays <= 0.0) {
            return ageDays == 0.0 ? 1.0 : 0.0;
        }
        return clamp(Math.exp(-ageDays / decayDays));
    }

    private static String dominantReason(double author, double engagement, double recency) {
        if (author <= 0.0 && engagement <= 0.0 && recency <= 0.0) {
            return ScoreBreakdown.REASON_DEFAULT;
        }
        if (author >= engagement && author >= recency) return ScoreBreakdown.REASON_AUTHOR;
        if (engagement >= recency)                     return ScoreBreakdown.REASON_ENGAGEMENT;
        return ScoreBreakdown.REASON_RECENCY;
    }

    /** Bounds {@code value} to [0,1]; NaN maps to 0. */
    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
