package com.feedblend.common.scoring;

import com.feedblend.common.model.InjectionMetadata;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.WeightConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces a raw candidate pool to a ranked injectable sequence using a {@link ScoreModel}.
 *
 * <ol>
 *   <li>Score every candidate against the (privacy-restricted) profile.</li>
 *   <li>Keep candidates whose score is strictly above {@code minScore}.</li>
 *   <li>Order by score descending, ties by item id ascending.</li>
 *   <li>Truncate to {@code maxCandidates}.</li>
 * </ol>
 *
 * <p>Each kept item carries its score and a {@code recommendation_engine} source hint
 * whose explanation is the dominant term's reason.
 */
public final class CandidateRanker {

    /** Highest score first; identical scores fall back to lexical id order. */
    public static final Comparator<Item> BY_SCORE_THEN_ID =
        Comparator.comparing((Item item) -> item.hasScore() ? item.getScore() : 0.0)
                  .reversed()
                  .thenComparing(Item::getId);

    private final ScoreModel scoreModel;
    private final double minScore;
    private final int maxCandidates;

    public CandidateRanker(ScoreModel scoreModel, double minScore, int maxCandidates) {
        this.scoreModel    = scoreModel;
        this.minScore      = minScore;
        this.maxCandidates = Math.max(0, maxCandidates);
    }

    /**
     * @param pool    candidate items, already filtered by the storage collaborator
     * @param profile profile as returned by {@code PrivacyGate.restrict}
     * @param weights ranking weights
     * @return ranked, annotated items; empty when the pool is empty or nothing clears
     *         the minimum score
     */
    public List<Item> rank(List<Item> pool, SignalProfile profile, WeightConfig weights) {
        if (pool == null || pool.isEmpty() || maxCandidates == 0) {
            return List.of();
        }
        WeightConfig normalized = weights.normalized();

        List<Item> scored = new ArrayList<>(pool.size());
        for (Item candidate : pool) {
            ScoreBreakdown breakdown = scoreModel.explain(candidate, profile, normalized);
            if (breakdown.score() > minScore) {
                scored.add(candidate.withScore(breakdown.score())
                                    .withSourceHint(InjectionMetadata.SOURCE_RECOMMENDATION,
                                                    breakdown.reason()));
            }
        }
        scored.sort(BY_SCORE_THEN_ID);
        return scored.size() > maxCandidates
            ? List.copyOf(scored.subList(0, maxCandidates))
            : List.copyOf(scored);
    }

    public double getMinScore() {
        return minScore;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }
}
