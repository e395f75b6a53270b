package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feedblend.common.exception.InvalidWeightConfigException;

/**
 * Relative weights of the three ranking terms plus the recency decay window.
 *
 * <p>The three weights are expected to sum to 1.0. Values that do not (for example
 * after a lossy round-trip through environment configuration) are re-normalized by
 * {@link #normalized()} instead of being rejected; only negative values are invalid.
 */
public record WeightConfig(
    @JsonProperty("authorWeight")     double authorWeight,
    @JsonProperty("engagementWeight") double engagementWeight,
    @JsonProperty("recencyWeight")    double recencyWeight,
    @JsonProperty("decayDays")        double decayDays
) {
    /** Tolerance used when deciding whether the weights already sum to one. */
    public static final double SUM_TOLERANCE = 1e-6;

    /** Author 0.4, engagement 0.3, recency 0.3, 7-day decay. */
    public static final WeightConfig DEFAULT = new WeightConfig(0.4, 0.3, 0.3, 7.0);

    /**
     * @throws InvalidWeightConfigException if any weight or the decay window is negative,
     *                                      infinite or not a number
     */
    public void validate() {
        requireNonNegative("author", authorWeight);
        requireNonNegative("engagement", engagementWeight);
        requireNonNegative("recency", recencyWeight);
        requireNonNegative("decay window", decayDays);
    }

    public double weightSum() {
        return authorWeight + engagementWeight + recencyWeight;
    }

    /**
     * Returns a copy whose three weights sum to one. If they already do within
     * {@value #SUM_TOLERANCE} this instance is returned unchanged. All-zero weights
     * become an equal split so that no term silently drops out.
     *
     * @throws InvalidWeightConfigException if validation fails
     */
    public WeightConfig normalized() {
        validate();
        double sum = weightSum();
        if (Math.abs(sum - 1.0) <= SUM_TOLERANCE) {
            return this;
        }
        if (sum <= 0.0) {
            double third = 1.0 / 3.0;
            return new WeightConfig(third, third, third, decayDays);
        }
        return new WeightConfig(authorWeight / sum, engagementWeight / sum,
                                recencyWeight / sum, decayDays);
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidWeightConfigException(
                "Weight '" + name + "' must be finite and non-negative but was " + value);
        }
    }
}
