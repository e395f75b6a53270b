package com.feedblend.blend.config;

import com.feedblend.common.model.StrategyType;

/**
 * Server-side defaults for the blend pipeline, resolved once at startup.
 *
 * @param includeSynthetic   keep candidates flagged synthetic
 * @param minInteractions    interaction floor below which a profile is not used
 * @param coldStartEnabled   whether cold-start content may be injected at all
 * @param coldStartLimit     maximum cold-start pool exposure per request
 * @param defaultStrategy    strategy used when the request names none
 * @param defaultMaxInjections injection cap used when the request gives no limit
 * @param minGapMinutes      minimum real-item gap for any injection
 */
public record BlendProperties(
    boolean includeSynthetic,
    int minInteractions,
    boolean coldStartEnabled,
    int coldStartLimit,
    StrategyType defaultStrategy,
    int defaultMaxInjections,
    long minGapMinutes
) {}
