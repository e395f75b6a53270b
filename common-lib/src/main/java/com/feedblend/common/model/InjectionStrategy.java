package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declarative description of how injectable items are placed into a real timeline.
 *
 * <p>Out-of-range numbers are normalized rather than rejected: a negative
 * {@code maxInjections} means no injections, an {@code n} below one falls back to
 * {@value #DEFAULT_N}, a negative gap becomes zero. A {@code null} {@code maxInjections}
 * means "the whole injectable pool".
 */
public record InjectionStrategy(
    @JsonProperty("type")              StrategyType type,
    @JsonProperty("maxInjections")     Integer maxInjections,
    @JsonProperty("n")                 int n,
    @JsonProperty("shuffleInjectable") boolean shuffleInjectable,
    @JsonProperty("minGapMinutes")     long minGapMinutes,
    @JsonProperty("shuffleSeed")       Long shuffleSeed
) {
    public static final int DEFAULT_N = 3;

    public InjectionStrategy {
        type          = type != null ? type : StrategyType.UNIFORM;
        maxInjections = maxInjections == null ? null : Math.max(0, maxInjections);
        n             = n >= 1 ? n : DEFAULT_N;
        minGapMinutes = Math.max(0L, minGapMinutes);
    }

    public static InjectionStrategy of(StrategyType type) {
        return new InjectionStrategy(type, null, DEFAULT_N, false, 0L, null);
    }

    /**
     * @throws com.feedblend.common.exception.UnknownStrategyException for an unrecognised type
     */
    public static InjectionStrategy of(String type) {
        return of(StrategyType.fromValue(type));
    }

    public InjectionStrategy withMaxInjections(int max) {
        return new InjectionStrategy(type, max, n, shuffleInjectable, minGapMinutes, shuffleSeed);
    }

    public InjectionStrategy withN(int everyN) {
        return new InjectionStrategy(type, maxInjections, everyN, shuffleInjectable, minGapMinutes, shuffleSeed);
    }

    public InjectionStrategy withMinGapMinutes(long minutes) {
        return new InjectionStrategy(type, maxInjections, n, shuffleInjectable, minutes, shuffleSeed);
    }

    /** Enables shuffling; a non-null seed makes the shuffle reproducible. */
    public InjectionStrategy withShuffle(Long seed) {
        return new InjectionStrategy(type, maxInjections, n, true, minGapMinutes, seed);
    }

    /** Injection budget {@code k = min(maxInjections, poolSize)}. */
    public int budget(int poolSize) {
        int cap = maxInjections != null ? maxInjections : poolSize;
        return Math.max(0, Math.min(cap, poolSize));
    }
}
