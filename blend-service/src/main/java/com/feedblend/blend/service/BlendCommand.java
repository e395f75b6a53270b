package com.feedblend.blend.service;

import com.feedblend.common.model.InjectionStrategy;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.TrackingLevel;

import java.util.List;

/**
 * Fully resolved input of one blend: request body plus the effective strategy.
 *
 * @param profile {@code null} for anonymous users
 * @param inject  {@code false} returns the real timeline untouched
 */
public record BlendCommand(
    String traceId,
    String userId,
    TrackingLevel trackingLevel,
    List<Item> realItems,
    List<Item> candidates,
    SignalProfile profile,
    InjectionStrategy strategy,
    boolean inject
) {
    public BlendCommand {
        realItems  = realItems  != null ? realItems  : List.of();
        candidates = candidates != null ? candidates : List.of();
    }
}
