package com.feedblend.common.scoring;

import com.feedblend.common.model.Item;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.WeightConfig;

/**
 * Relevance scoring contract for candidate items.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Pure</b>: no I/O, no logging, no mutation of the item or profile</li>
 *   <li><b>Stateless</b>: safe to call concurrently and repeatedly with the same result</li>
 *   <li><b>Bounded</b>: the returned score always lies in [0.0, 1.0]</li>
 * </ul>
 *
 * <p>Callers must consult {@link com.feedblend.common.privacy.PrivacyGate} before
 * invoking a model; a {@code DISABLED} personalization mode forbids calling it at all.
 */
public interface ScoreModel {

    /**
     * @return relevance of {@code item} for the profile's owner, in [0.0, 1.0]
     * @throws com.feedblend.common.exception.InvalidWeightConfigException if a weight is negative
     */
    double score(Item item, SignalProfile profile, WeightConfig weights);

    /**
     * Per-term breakdown of {@link #score}. The default reports only the total.
     */
    default ScoreBreakdown explain(Item item, SignalProfile profile, WeightConfig weights) {
        double total = score(item, profile, weights);
        return new ScoreBreakdown(0.0, 0.0, 0.0, total, ScoreBreakdown.REASON_DEFAULT);
    }
}
