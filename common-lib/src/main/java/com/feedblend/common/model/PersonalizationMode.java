package com.feedblend.common.model;

/**
 * How much personalization signal the scoring path may use for a request.
 * Resolved from a {@link TrackingLevel} by {@link com.feedblend.common.privacy.PrivacyGate}.
 */
public enum PersonalizationMode {
    /** Complete per-user signal profile. */
    FULL,
    /** Aggregate signal only; per-user author affinity is replaced by the population average. */
    DEGRADED,
    /** No scoring at all; content comes from the cold-start selector. */
    DISABLED
}
