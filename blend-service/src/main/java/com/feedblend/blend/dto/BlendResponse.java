package com.feedblend.blend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.PersonalizationMode;

import java.util.List;

/**
 * Blended timeline, strictly newest first, plus how it was produced.
 */
public record BlendResponse(
    @JsonProperty("items")         List<Item> items,
    @JsonProperty("mode")          PersonalizationMode mode,
    @JsonProperty("source")        FeedSource source,
    @JsonProperty("injectedCount") int injectedCount,
    @JsonProperty("strategy")      String strategy
) {}
