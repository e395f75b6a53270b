package com.feedblend.blend.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where the injected part of a blended timeline came from. */
public enum FeedSource {
    PERSONALIZED("personalized"),
    COLD_START("cold_start"),
    NONE("none");

    private final String value;

    FeedSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
