package com.feedblend.common.merge;

/**
 * Decision to put injectable item {@code itemIndex} into gap {@code gapIndex}.
 * Indices refer to the normalized sequences of one merge call.
 */
public record Placement(int gapIndex, int itemIndex) {}
