package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-user aggregate read by the scoring path. Built by the identity/privacy
 * collaborator; the engine never mutates it.
 *
 * <p>{@code userAlias} is the pseudonymized id, never the raw account id.
 * {@code populationAffinity} is the author-affinity value used in place of per-user
 * affinity when the profile is {@code anonymized}.
 */
public record SignalProfile(
    @JsonProperty("userAlias")          String userAlias,
    @JsonProperty("authorAffinity")     Map<String, Double> authorAffinity,
    @JsonProperty("now")                Instant now,
    @JsonProperty("interactionCount")   int interactionCount,
    @JsonProperty("populationAffinity") double populationAffinity,
    @JsonProperty("anonymized")         boolean anonymized
) {
    /** Baseline affinity for authors the user has never interacted with. */
    public static final double DEFAULT_POPULATION_AFFINITY = 0.1;

    public SignalProfile {
        Map<String, Double> cleaned = new HashMap<>();
        if (authorAffinity != null) {
            authorAffinity.forEach((author, weight) -> {
                if (author != null && weight != null && weight > 0.0) {
                    cleaned.put(author, weight);
                }
            });
        }
        authorAffinity     = Map.copyOf(cleaned);
        now                = now != null ? now : Instant.now();
        interactionCount   = Math.max(0, interactionCount);
        populationAffinity = Math.max(0.0, Math.min(1.0, populationAffinity));
    }

    @JsonCreator
    public static SignalProfile fromJson(
            @JsonProperty("userAlias")          String userAlias,
            @JsonProperty("authorAffinity")     Map<String, Double> authorAffinity,
            @JsonProperty("now")                Instant now,
            @JsonProperty("interactionCount")   Integer interactionCount,
            @JsonProperty("populationAffinity") Double populationAffinity,
            @JsonProperty("anonymized")         Boolean anonymized) {
        return new SignalProfile(
            userAlias, authorAffinity, now,
            interactionCount != null ? interactionCount : 0,
            populationAffinity != null ? populationAffinity : DEFAULT_POPULATION_AFFINITY,
            anonymized != null && anonymized);
    }

    public static SignalProfile of(String userAlias, Map<String, Double> authorAffinity,
                                   Instant now, int interactionCount) {
        return new SignalProfile(userAlias, authorAffinity, now, interactionCount,
                                 DEFAULT_POPULATION_AFFINITY, false);
    }

    /** Profile with no per-user data: alias and affinity removed, aggregates kept. */
    public SignalProfile anonymizedCopy() {
        return new SignalProfile(null, Map.of(), now, interactionCount, populationAffinity, true);
    }

    public double maxAffinity() {
        return authorAffinity.values().stream()
            .mapToDouble(Double::doubleValue)
            .max()
            .orElse(0.0);
    }
}
