package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * User consent tier for interaction tracking. Owned by the privacy collaborator;
 * the engine only reads it.
 */
public enum TrackingLevel {
    FULL("full"),
    LIMITED("limited"),
    NONE("none");

    private final String value;

    TrackingLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a stored or requested level. A missing value means no preference was
     * recorded, which defaults to {@link #FULL}.
     *
     * @throws IllegalArgumentException for any other unrecognised value
     */
    @JsonCreator
    public static TrackingLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FULL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TrackingLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid tracking level: " + raw);
    }
}
