package com.feedblend.common.model;

import com.feedblend.common.exception.UnknownStrategyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InjectionStrategyTest {

    @Test
    @DisplayName("strategy names parse case-insensitively")
    void parsesNames() {
        assertEquals(StrategyType.AFTER_N, StrategyType.fromValue("after_n"));
        assertEquals(StrategyType.TAG_MATCH, StrategyType.fromValue(" Tag_Match "));
        assertEquals(StrategyType.FIRST_ONLY, InjectionStrategy.of("first_only").type());
    }

    @Test
    @DisplayName("unknown or missing strategy name fails")
    void unknownName() {
        UnknownStrategyException ex = assertThrows(UnknownStrategyException.class,
            () -> StrategyType.fromValue("random"));
        assertEquals("random", ex.getStrategyType());
        assertEquals("TimelineMerger", ex.getComponent());
        assertThrows(UnknownStrategyException.class, () -> StrategyType.fromValue(null));
    }

    @Test
    @DisplayName("out-of-range numbers are normalized")
    void normalizes() {
        InjectionStrategy strategy = new InjectionStrategy(null, -4, 0, false, -10, null);

        assertEquals(StrategyType.UNIFORM, strategy.type());
        assertEquals(Integer.valueOf(0), strategy.maxInjections());
        assertEquals(InjectionStrategy.DEFAULT_N, strategy.n());
        assertEquals(0L, strategy.minGapMinutes());
    }

    @Test
    @DisplayName("budget is the smaller of the cap and the pool")
    void budget() {
        InjectionStrategy uncapped = InjectionStrategy.of(StrategyType.UNIFORM);
        assertEquals(7, uncapped.budget(7));
        assertEquals(3, uncapped.withMaxInjections(3).budget(7));
        assertEquals(2, uncapped.withMaxInjections(3).budget(2));
        assertEquals(0, uncapped.withMaxInjections(0).budget(9));
    }

    @Test
    @DisplayName("withShuffle enables shuffling and keeps the other settings")
    void shuffle() {
        InjectionStrategy strategy = InjectionStrategy.of(StrategyType.AFTER_N).withN(4).withShuffle(11L);

        assertTrue(strategy.shuffleInjectable());
        assertEquals(Long.valueOf(11L), strategy.shuffleSeed());
        assertEquals(4, strategy.n());
    }

    @Test
    @DisplayName("tracking level: blank means full, unknown values are rejected")
    void trackingLevel() {
        assertEquals(TrackingLevel.FULL, TrackingLevel.fromValue(null));
        assertEquals(TrackingLevel.FULL, TrackingLevel.fromValue(" "));
        assertEquals(TrackingLevel.LIMITED, TrackingLevel.fromValue("LIMITED"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> TrackingLevel.fromValue("partial"));
        assertEquals("Invalid tracking level: partial", ex.getMessage());
    }
}
