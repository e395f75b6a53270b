package com.feedblend.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.feedblend.common.exception.UnknownStrategyException;

import java.util.Locale;

/**
 * Gap-selection rule used by {@link com.feedblend.common.merge.TimelineMerger}.
 */
public enum StrategyType {
    UNIFORM("uniform"),
    AFTER_N("after_n"),
    FIRST_ONLY("first_only"),
    TAG_MATCH("tag_match");

    private final String value;

    StrategyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws UnknownStrategyException if {@code raw} names no known strategy
     */
    @JsonCreator
    public static StrategyType fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (StrategyType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnknownStrategyException(raw);
    }
}
