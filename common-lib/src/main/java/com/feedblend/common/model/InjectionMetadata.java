package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transparency record attached to every injected {@link Item}.
 *
 * <p>Producers upstream of the merge (cold start, ranking) attach a partial record
 * carrying only {@code source} and {@code explanation}; the merger completes it with
 * the strategy name and the score at injection time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InjectionMetadata(
    @JsonProperty("source")      String source,
    @JsonProperty("strategy")    String strategy,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("score")       Double score
) {
    public static final String SOURCE_COLD_START      = "cold_start";
    public static final String SOURCE_RECOMMENDATION  = "recommendation_engine";
    public static final String SOURCE_TIMELINE        = "timeline_injector";

    public static final String DEFAULT_EXPLANATION =
        "Suggested content we think you might find interesting";

    /** Partial record set before merging: no strategy, no score. */
    public static InjectionMetadata hint(String source, String explanation) {
        return new InjectionMetadata(source, null, explanation, null);
    }
}
